package io.newsharvest.ingestion.api.dto;

import java.nio.charset.Charset;

public record FetchedPage(
        String requestedUrl,
        String finalUrl,
        int statusCode,
        String contentType,
        byte[] body,
        Charset charset
) {
    public String text() {
        return new String(body, charset);
    }
}
