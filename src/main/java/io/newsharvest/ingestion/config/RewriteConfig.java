package io.newsharvest.ingestion.config;

import java.time.Duration;

public record RewriteConfig(
        boolean enabled,
        String baseUrl,
        String apiKey,
        String model,
        int maxSourceChars,
        Duration timeout
) {}
