package io.newsharvest.ingestion.config;

/**
 * Retry settings per network boundary.
 */
public record RetryConfig(
        RetrySettings feed,
        RetrySettings page,
        RetrySettings rewrite
) {}
