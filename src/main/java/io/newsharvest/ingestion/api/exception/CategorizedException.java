package io.newsharvest.ingestion.api.exception;

/**
 * Base for network-boundary failures that carry an {@link ErrorCategory}.
 */
public abstract class CategorizedException extends Exception {
    private final ErrorCategory category;

    protected CategorizedException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    protected CategorizedException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isTransient() {
        return category.isTransient();
    }
}
