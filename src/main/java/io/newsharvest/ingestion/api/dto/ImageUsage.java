package io.newsharvest.ingestion.api.dto;

public enum ImageUsage {
    HERO,
    THUMBNAIL,
    GALLERY
}
