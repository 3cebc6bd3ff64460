package io.newsharvest.ingestion.api.dto;

public record RawImage(
        String url,
        String alt,
        Integer width,
        Integer height
) {
    public static RawImage of(String url) {
        return new RawImage(url, "", null, null);
    }
}
