package com.starscape.mediacatalog.features.basepaths.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for BasePath domain entity.
 */
public interface BasePathRepository {
    BasePath save(BasePath basePath);
    BasePath saveAndFlush(BasePath basePath);
    Optional<BasePath> findById(Integer id);
    List<BasePath> findAllByOrderByIdAsc();
    List<BasePath> findByIdInOrderByIdAsc(Collection<Integer> ids);
    void delete(BasePath basePath);
    void flush();
}
