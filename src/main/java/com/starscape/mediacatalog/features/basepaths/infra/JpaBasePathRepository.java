package com.starscape.mediacatalog.features.basepaths.infra;

import com.starscape.mediacatalog.features.basepaths.domain.BasePath;
import com.starscape.mediacatalog.features.basepaths.domain.BasePathRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * JPA repository implementation for BasePath entity.
 * Spring Data JPA provides save, saveAndFlush, findById, delete and flush
 * from JpaRepository.
 */
@Repository
public interface JpaBasePathRepository extends JpaRepository<BasePath, Integer>, BasePathRepository {
    
    @Override
    List<BasePath> findAllByOrderByIdAsc();
    
    @Override
    List<BasePath> findByIdInOrderByIdAsc(Collection<Integer> ids);
}
