package com.starscape.mediacatalog.features.categories.infra;

import com.starscape.mediacatalog.features.categories.domain.Category;
import com.starscape.mediacatalog.features.categories.domain.CategoryRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * JPA repository implementation for Category entity.
 */
@Repository
public interface JpaCategoryRepository extends JpaRepository<Category, Integer>, CategoryRepository {
    
    @Override
    List<Category> findAllByOrderByIdAsc();
    
    @Override
    List<Category> findByIdInOrderByIdAsc(Collection<Integer> ids);
}
