package io.newsharvest.ingestion.api.exception;

/**
 * A feed could not be fetched or parsed. Callers treat this as zero items for that feed.
 */
public class FeedUnavailableException extends CategorizedException {

    private final String feedUrl;

    public FeedUnavailableException(String feedUrl, String message, ErrorCategory category) {
        super(message, category);
        this.feedUrl = feedUrl;
    }

    public FeedUnavailableException(String feedUrl, String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
        this.feedUrl = feedUrl;
    }

    public static FeedUnavailableException from(String feedUrl, PageFetchException e) {
        return new FeedUnavailableException(feedUrl, e.getMessage(), e, e.getCategory());
    }

    public String getFeedUrl() {
        return feedUrl;
    }
}
