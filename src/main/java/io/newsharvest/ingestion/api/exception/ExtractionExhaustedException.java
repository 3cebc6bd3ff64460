package io.newsharvest.ingestion.api.exception;

public class ExtractionExhaustedException extends RuntimeException {

    public ExtractionExhaustedException(String sourceUrl) {
        super("All extraction strategies failed for " + sourceUrl);
    }
}
