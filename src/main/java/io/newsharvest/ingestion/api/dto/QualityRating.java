package io.newsharvest.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QualityRating {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
