package com.starscape.mediacatalog.features.media.domain;

import java.util.Optional;

/**
 * Repository interface for MediaTag junction entity.
 */
public interface MediaTagRepository {
    MediaTag saveAndFlush(MediaTag mediaTag);
    Optional<MediaTag> findByMediaIdAndTagId(Long mediaId, Integer tagId);
    boolean existsByMediaIdAndTagId(Long mediaId, Integer tagId);
    long countByMediaId(Long mediaId);
    long countByTagId(Integer tagId);
    void delete(MediaTag mediaTag);
    void flush();
}
