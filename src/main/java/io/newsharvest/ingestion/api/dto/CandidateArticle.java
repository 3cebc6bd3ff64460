package io.newsharvest.ingestion.api.dto;

import java.util.List;
import java.util.Objects;

/**
 * Fully assembled article that has not been stored yet. {@code rewritten} is null when the
 * rewrite service is disabled or failed; {@code bestImage} is null when no image survived scoring.
 * {@code classifiedImages} buckets the same images by usage.
 */
public record CandidateArticle(
        String sourceUrl,
        FeedItem feedItem,
        ExtractedContent content,
        List<ScoredImage> images,
        ClassifiedImages classifiedImages,
        ScoredImage bestImage,
        QualityRating quality,
        StructuredArticle rewritten,
        Category category
) {
    public CandidateArticle {
        Objects.requireNonNull(feedItem, "feedItem");
        if (!Objects.equals(sourceUrl, feedItem.link())) {
            throw new IllegalArgumentException("sourceUrl must equal the feed item link");
        }
        images = images == null ? List.of() : List.copyOf(images);
        if (classifiedImages == null) {
            classifiedImages = new ClassifiedImages(List.of(), List.of(), List.of());
        }
    }

    public boolean isRewritten() {
        return rewritten != null;
    }
}
