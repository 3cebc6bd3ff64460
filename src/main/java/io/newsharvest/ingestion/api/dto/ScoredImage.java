package io.newsharvest.ingestion.api.dto;

import java.util.OptionalDouble;

public record ScoredImage(
        String url,
        String alt,
        Integer width,
        Integer height,
        int score,
        ImageUsage usageClass
) {
    public ScoredImage {
        if (score < 0) {
            throw new IllegalArgumentException("Image score must be non-negative: " + score);
        }
    }

    public ScoredImage withUsage(ImageUsage usage) {
        return new ScoredImage(url, alt, width, height, score, usage);
    }

    public OptionalDouble aspectRatio() {
        if (width == null || height == null || width <= 0 || height <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) width / height);
    }
}
