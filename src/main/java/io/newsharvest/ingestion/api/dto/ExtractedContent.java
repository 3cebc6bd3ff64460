package io.newsharvest.ingestion.api.dto;

import java.util.List;

public record ExtractedContent(
        String bodyText,
        List<RawImage> rawImages,
        ExtractionStrategy strategyUsed,
        boolean success
) {
    public ExtractedContent {
        bodyText = bodyText == null ? "" : bodyText;
        rawImages = rawImages == null ? List.of() : List.copyOf(rawImages);

        if (success && bodyText.isEmpty()) {
            throw new IllegalArgumentException("Successful extraction must carry body text");
        }
    }

    public static ExtractedContent succeeded(String bodyText, List<RawImage> images, ExtractionStrategy strategy) {
        return new ExtractedContent(bodyText, images, strategy, true);
    }

    public static ExtractedContent failed(ExtractionStrategy strategy) {
        return new ExtractedContent("", List.of(), strategy, false);
    }

    public int textLength() {
        return bodyText.length();
    }
}
