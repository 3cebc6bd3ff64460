package io.newsharvest.ingestion.config;

import java.time.Duration;

public record RetrySettings(
        int maxAttempts,
        Duration initialDelay,
        double multiplier,
        Duration maxDelay
) {
    public static RetrySettings noRetry() {
        return new RetrySettings(1, Duration.ZERO, 1.0, Duration.ZERO);
    }
}
