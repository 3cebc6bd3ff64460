package io.newsharvest.ingestion.api.dto;

import java.util.List;

/**
 * Article fields produced by the rewrite service, already validated and trimmed to storage limits.
 */
public record StructuredArticle(
        String title,
        String excerpt,
        String content,
        String slug,
        String seoTitle,
        String seoDescription,
        List<String> tags,
        String location
) {
    public StructuredArticle {
        tags = tags == null ? List.of() : List.copyOf(tags);
        location = location == null ? "" : location;
    }
}
