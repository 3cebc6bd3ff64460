package io.newsharvest.ingestion.config;

import java.time.Duration;
import java.util.List;

public record ImportJob(
        String name,
        Duration interval,
        Duration initialDelay,
        List<String> categories,
        int maxArticlesPerCategory,
        boolean enabled
) {}
