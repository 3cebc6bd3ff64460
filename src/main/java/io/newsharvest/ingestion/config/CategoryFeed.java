package io.newsharvest.ingestion.config;

import java.util.List;

public record CategoryFeed(
        String name,
        List<String> feedUrls,
        boolean enabled
) {}
