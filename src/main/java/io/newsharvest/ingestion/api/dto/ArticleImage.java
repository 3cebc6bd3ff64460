package io.newsharvest.ingestion.api.dto;

/**
 * Stored form of a scored image: where it lives, its alt text and what it is used for.
 */
public record ArticleImage(
        String url,
        String alt,
        ImageUsage usage
) {
    public static ArticleImage of(ScoredImage image) {
        return new ArticleImage(image.url(), image.alt(), image.usageClass());
    }
}
