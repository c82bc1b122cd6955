package com.starscape.mediacatalog.features.media.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for MediaFile domain entity.
 */
public interface MediaFileRepository {
    MediaFile save(MediaFile mediaFile);
    MediaFile saveAndFlush(MediaFile mediaFile);
    Optional<MediaFile> findById(Long id);
    Optional<MediaFile> findByBasePathIdAndRelativePath(Integer basePathId, String relativePath);
    boolean existsByBasePathIdAndRelativePath(Integer basePathId, String relativePath);
    List<MediaFile> findByBasePathIdOrderByIdAsc(Integer basePathId);
    long countByBasePathId(Integer basePathId);
    
    /**
     * Media tagged with every one of {@code tagIds}.
     * @param tagIds distinct tag ids
     * @param tagCount number of ids in {@code tagIds}
     */
    List<MediaFile> findTaggedWithAll(Collection<Integer> tagIds, long tagCount);
    
    void delete(MediaFile mediaFile);
    void flush();
}
