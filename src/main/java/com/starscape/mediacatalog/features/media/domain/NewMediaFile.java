package com.starscape.mediacatalog.features.media.domain;

/**
 * Data for registering a media file.
 */
public record NewMediaFile(
    String relativePath,
    int basePathId,
    Integer width,
    Integer height,
    double size,
    Integer mark,
    String description,
    MediaType mediaType
) {}
