package io.newsharvest.ingestion.api.dto;

public record Author(String id, String name) {}
