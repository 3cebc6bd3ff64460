package io.newsharvest.ingestion.config;

public record ExtractionConfig(
        int minMainContentLength,
        int minParagraphLength,
        int minPrimaryLength,
        int minRssContentLength,
        int minMetaDescriptionLength,
        int maxImages
) {}
