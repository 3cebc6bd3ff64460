package io.newsharvest.ingestion.api.dto;

public record RewriteRequest(
        String sourceText,
        String sourceUrl,
        String originalTitle,
        String category
) {}
