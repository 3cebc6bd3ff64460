package io.newsharvest.ingestion.api.exception;

/**
 * A category or author required for a run is missing from the store.
 */
public class RepositoryLookupException extends RuntimeException {

    public RepositoryLookupException(String message) {
        super(message);
    }

    public RepositoryLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
