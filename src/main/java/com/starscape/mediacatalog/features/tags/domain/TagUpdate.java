package com.starscape.mediacatalog.features.tags.domain;

/**
 * Patch for a tag. A {@code null} field keeps the current value.
 */
public record TagUpdate(String name, Integer categoryId, String description) {
    
    public static TagUpdate empty() {
        return new TagUpdate(null, null, null);
    }
}
