package io.newsharvest.ingestion.api.dto;

public record Category(String id, String name) {}
