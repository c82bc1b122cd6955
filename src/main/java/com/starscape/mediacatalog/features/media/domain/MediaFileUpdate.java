package com.starscape.mediacatalog.features.media.domain;

/**
 * Patch for a media file. A {@code null} field keeps the current value.
 */
public record MediaFileUpdate(
    Integer width,
    Integer height,
    Double size,
    Integer mark,
    String description
) {
    
    public static MediaFileUpdate empty() {
        return new MediaFileUpdate(null, null, null, null, null);
    }
}
