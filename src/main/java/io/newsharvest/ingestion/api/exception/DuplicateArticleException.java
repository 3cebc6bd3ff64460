package io.newsharvest.ingestion.api.exception;

/**
 * Another writer already stored an article for the same source URL.
 */
public class DuplicateArticleException extends PersistenceException {

    private final String sourceUrl;

    public DuplicateArticleException(String sourceUrl) {
        super("Article already stored for " + sourceUrl);
        this.sourceUrl = sourceUrl;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }
}
