package io.newsharvest.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Content acquisition strategies, in the order they are attempted.
 */
public enum ExtractionStrategy {
    PRIMARY_EXTRACTION("primary_extraction"),
    RSS_CONTENT_FALLBACK("rss_content_fallback"),
    META_DESCRIPTION_FALLBACK("meta_description_fallback"),
    TITLE_ONLY_FALLBACK("title_only_fallback");

    private final String id;

    ExtractionStrategy(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
