package io.newsharvest.ingestion.api.exception;

public class PageFetchException extends CategorizedException {

    private final String url;

    public PageFetchException(String url, String message, ErrorCategory category) {
        super(message, category);
        this.url = url;
    }

    public PageFetchException(String url, String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
