package io.newsharvest.ingestion.api.dto;

/**
 * Terminal outcome of one feed item inside a run.
 */
public record ItemOutcome(
        Status status,
        String sourceUrl,
        String articleId,
        String reason
) {
    public enum Status {
        IMPORTED,
        SKIPPED,
        ERROR
    }

    public static ItemOutcome imported(String sourceUrl, String articleId) {
        return new ItemOutcome(Status.IMPORTED, sourceUrl, articleId, null);
    }

    public static ItemOutcome skipped(String sourceUrl, String reason) {
        return new ItemOutcome(Status.SKIPPED, sourceUrl, null, reason);
    }

    public static ItemOutcome error(String sourceUrl, String reason) {
        return new ItemOutcome(Status.ERROR, sourceUrl, null, reason);
    }
}
