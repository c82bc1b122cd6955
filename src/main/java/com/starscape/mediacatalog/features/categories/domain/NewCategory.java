package com.starscape.mediacatalog.features.categories.domain;

/**
 * Data for creating a tag category.
 */
public record NewCategory(String name, String color, String description) {}
