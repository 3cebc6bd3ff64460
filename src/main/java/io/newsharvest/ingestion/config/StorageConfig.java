package io.newsharvest.ingestion.config;

public record StorageConfig(
        String defaultAuthor
) {}
