package com.starscape.mediacatalog.features.tags.infra;

import com.starscape.mediacatalog.features.tags.domain.Tag;
import com.starscape.mediacatalog.features.tags.domain.TagRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA repository implementation for Tag entity.
 * Spring Data JPA automatically provides implementations for methods declared in TagRepository
 * that match JpaRepository methods (save, saveAndFlush, findById, delete, flush).
 */
@Repository
public interface JpaTagRepository extends JpaRepository<Tag, Integer>, TagRepository {
    
    @Override
    boolean existsByNameAndCategoryId(String name, Integer categoryId);
    
    @Override
    boolean existsByNameAndCategoryIdAndIdNot(String name, Integer categoryId, Integer id);
    
    @Override
    List<Tag> findAllByOrderByNameAscIdAsc();
    
    @Override
    List<Tag> findByCategoryIdOrderByNameAscIdAsc(Integer categoryId);
    
    @Override
    long countByCategoryId(Integer categoryId);
    
    @Override
    @Query("SELECT t FROM Tag t WHERE t.id IN " +
           "(SELECT mt.tagId FROM MediaTag mt WHERE mt.mediaId = :mediaId) " +
           "ORDER BY t.name ASC, t.id ASC")
    List<Tag> findByMediaId(@Param("mediaId") Long mediaId);
}
