package io.newsharvest.ingestion.api.exception;

/**
 * The rewrite service could not be reached or answered with an error status.
 */
public class RewriteCallException extends CategorizedException {

    public RewriteCallException(String message, ErrorCategory category) {
        super(message, category);
    }

    public RewriteCallException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
