package com.starscape.mediacatalog.features.media.infra;

import com.starscape.mediacatalog.features.media.domain.MediaTag;
import com.starscape.mediacatalog.features.media.domain.MediaTagRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * JPA repository implementation for MediaTag junction entity.
 */
@Repository
public interface JpaMediaTagRepository extends JpaRepository<MediaTag, Long>, MediaTagRepository {
    
    @Override
    Optional<MediaTag> findByMediaIdAndTagId(Long mediaId, Integer tagId);
    
    @Override
    boolean existsByMediaIdAndTagId(Long mediaId, Integer tagId);
    
    @Override
    long countByMediaId(Long mediaId);
    
    @Override
    long countByTagId(Integer tagId);
}
