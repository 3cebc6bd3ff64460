package io.newsharvest.ingestion.config;

import java.util.List;

public record QualityFilterConfig(
        int minTitleLength,
        int minDescriptionLength,
        List<String> nonArticleSuffixes
) {}
