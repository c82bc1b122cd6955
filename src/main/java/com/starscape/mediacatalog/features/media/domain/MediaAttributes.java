package com.starscape.mediacatalog.features.media.domain;

/**
 * The mutable part of a media file.
 *
 * @param width       pixels, if an image or video
 * @param height      pixels, if an image or video
 * @param size        size in kB
 * @param mark        rating from 1 to 10, if any
 * @param description free text
 */
public record MediaAttributes(
    Integer width,
    Integer height,
    double size,
    Integer mark,
    String description
) {
    
    /**
     * Overlay the fields set in {@code update}; unset fields keep their value.
     */
    public MediaAttributes merge(MediaFileUpdate update) {
        return new MediaAttributes(
            update.width() != null ? update.width() : width,
            update.height() != null ? update.height() : height,
            update.size() != null ? update.size() : size,
            update.mark() != null ? update.mark() : mark,
            update.description() != null ? update.description() : description
        );
    }
}
