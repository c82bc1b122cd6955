package com.starscape.mediacatalog.features.media.infra;

import com.starscape.mediacatalog.features.media.domain.MediaFile;
import com.starscape.mediacatalog.features.media.domain.MediaFileRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JPA repository implementation for MediaFile entity.
 */
@Repository
public interface JpaMediaFileRepository extends JpaRepository<MediaFile, Long>, MediaFileRepository {
    
    @Override
    Optional<MediaFile> findByBasePathIdAndRelativePath(Integer basePathId, String relativePath);
    
    @Override
    boolean existsByBasePathIdAndRelativePath(Integer basePathId, String relativePath);
    
    @Override
    List<MediaFile> findByBasePathIdOrderByIdAsc(Integer basePathId);
    
    @Override
    long countByBasePathId(Integer basePathId);
    
    /**
     * Intersection over media_tags: group the associations of the requested tags
     * by media and keep the groups that hold every requested tag.
     */
    @Override
    @Query("SELECT m FROM MediaFile m WHERE m.id IN (" +
           "SELECT mt.mediaId FROM MediaTag mt WHERE mt.tagId IN :tagIds " +
           "GROUP BY mt.mediaId HAVING COUNT(DISTINCT mt.tagId) = :tagCount) " +
           "ORDER BY m.id ASC")
    List<MediaFile> findTaggedWithAll(
        @Param("tagIds") Collection<Integer> tagIds,
        @Param("tagCount") long tagCount);
}
