package io.newsharvest.ingestion.config;

import java.util.List;

public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        int maxBodyBytes,
        List<String> userAgents
) {}
