package com.starscape.mediacatalog.features.categories.domain;

/**
 * Patch for a tag category. A {@code null} field keeps the current value.
 */
public record CategoryUpdate(String name, String color, String description) {
    
    public static CategoryUpdate empty() {
        return new CategoryUpdate(null, null, null);
    }
}
