package com.starscape.mediacatalog.features.categories.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Category domain entity.
 */
public interface CategoryRepository {
    Category save(Category category);
    Category saveAndFlush(Category category);
    Optional<Category> findById(Integer id);
    List<Category> findAllByOrderByIdAsc();
    List<Category> findByIdInOrderByIdAsc(Collection<Integer> ids);
    void delete(Category category);
    void flush();
}
