package com.starscape.mediacatalog.features.tags.domain;

/**
 * Data for creating a tag.
 */
public record NewTag(String name, int categoryId, String description) {}
