package com.starscape.mediacatalog.features.tags.domain;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Tag domain entity.
 */
public interface TagRepository {
    Tag save(Tag tag);
    Tag saveAndFlush(Tag tag);
    Optional<Tag> findById(Integer id);
    boolean existsByNameAndCategoryId(String name, Integer categoryId);
    boolean existsByNameAndCategoryIdAndIdNot(String name, Integer categoryId, Integer id);
    List<Tag> findAllByOrderByNameAscIdAsc();
    List<Tag> findByCategoryIdOrderByNameAscIdAsc(Integer categoryId);
    List<Tag> findByMediaId(Long mediaId);
    long countByCategoryId(Integer categoryId);
    void delete(Tag tag);
    void flush();
}
