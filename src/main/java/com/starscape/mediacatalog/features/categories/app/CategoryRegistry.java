package com.starscape.mediacatalog.features.categories.app;

import com.starscape.mediacatalog.common.config.CatalogProperties;
import com.starscape.mediacatalog.common.exception.ErrorCode;
import com.starscape.mediacatalog.common.exception.NotFoundException;
import com.starscape.mediacatalog.common.exception.StateException;
import com.starscape.mediacatalog.common.exception.ValidationException;
import com.starscape.mediacatalog.common.persistence.IntegrityViolations;
import com.starscape.mediacatalog.common.text.Graphemes;
import com.starscape.mediacatalog.features.categories.domain.Category;
import com.starscape.mediacatalog.features.categories.domain.CategoryLookup;
import com.starscape.mediacatalog.features.categories.domain.CategoryRepository;
import com.starscape.mediacatalog.features.categories.domain.CategoryUpdate;
import com.starscape.mediacatalog.features.categories.domain.HexColor;
import com.starscape.mediacatalog.features.categories.domain.NewCategory;
import com.starscape.mediacatalog.features.tags.domain.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Owns tag categories: name, display color and description.
 */
@Service
public class CategoryRegistry implements CategoryLookup {

    private static final Logger log = LoggerFactory.getLogger(CategoryRegistry.class);

    private final CategoryRepository categoryRepository;
    private final TagRepository tagRepository;
    private final CatalogProperties properties;

    public CategoryRegistry(
            CategoryRepository categoryRepository,
            TagRepository tagRepository,
            CatalogProperties properties) {
        this.categoryRepository = categoryRepository;
        this.tagRepository = tagRepository;
        this.properties = properties;
    }

    @Transactional
    public Category create(NewCategory request) {
        CleanCategory clean = validate(request.name(), request.color(), request.description());

        Category saved = categoryRepository.saveAndFlush(new Category(clean.name(), clean.color(), clean.description()));
        log.info("Created category: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Category get(int id) {
        if (id <= 0) {
            throw new ValidationException(ErrorCode.INVALID_ID, "Invalid category id: " + id);
        }
        return categoryRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Category not found: " + id));
    }

    /**
     * List categories ordered by id. A null or empty {@code ids} lists all of them.
     */
    @Transactional(readOnly = true)
    public List<Category> list(Collection<Integer> ids) {
        return ids == null || ids.isEmpty()
                ? categoryRepository.findAllByOrderByIdAsc()
                : categoryRepository.findByIdInOrderByIdAsc(ids);
    }

    /**
     * Categories whose name starts with {@code prefix}, ignoring case.
     * The whole table is filtered in memory; categories number in the hundreds at most.
     */
    @Transactional(readOnly = true)
    public List<Category> searchByName(String prefix) {
        String cleanPrefix = Graphemes.clean(prefix);
        if (properties.isSearchTooShort(cleanPrefix)) {
            throw new ValidationException(ErrorCode.NAME_TO_SEARCH_TOO_SHORT,
                "Name to search must be at least " + properties.getSearchMinLength() + " characters");
        }

        return list(null).stream()
                .filter(category -> Graphemes.startsWithIgnoreCase(category.getName(), cleanPrefix))
                .toList();
    }

    /**
     * Apply a patch. Validation runs on the merged record, so a patch that only
     * changes the color is checked against the stored name and description too.
     */
    @Transactional
    public void update(int id, CategoryUpdate update) {
        Category category = get(id);

        CleanCategory clean = validate(
            update.name() != null ? update.name() : category.getName(),
            update.color() != null ? update.color() : category.getColor(),
            update.description() != null ? update.description() : category.getDescription());

        category.rename(clean.name());
        category.recolor(clean.color());
        category.describe(clean.description());
        categoryRepository.save(category);
        log.info("Updated category {}", id);
    }

    /**
     * Remove a category that no tag belongs to.
     */
    @Transactional
    public void delete(int id) {
        Category category = get(id);

        long tagCount = tagRepository.countByCategoryId(id);
        if (tagCount > 0) {
            log.debug("Refusing to delete category {}: {} tags belong to it", id, tagCount);
            throw new StateException(ErrorCode.IN_USE,
                String.format("Category %d has %d tags", id, tagCount));
        }

        try {
            categoryRepository.delete(category);
            categoryRepository.flush();
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isForeignKeyViolation(e)) {
                throw e;
            }
            log.warn("Category {} gained tags while being deleted", id);
            throw new StateException(ErrorCode.IN_USE, "Category " + id + " is in use", e);
        }
        log.info("Deleted category: id={}, name={}", id, category.getName());
    }

    private CleanCategory validate(String name, String color, String description) {
        String cleanName = Graphemes.clean(name);
        String cleanDescription = Graphemes.clean(description);

        if (cleanName.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_NAME, "Category name cannot be empty");
        }
        if (properties.isNameTooLong(cleanName)) {
            throw new ValidationException(ErrorCode.NAME_TOO_LONG,
                "Category name must be " + properties.getNameMaxLength() + " characters or less");
        }
        if (properties.isDescriptionTooLong(cleanDescription)) {
            throw new ValidationException(ErrorCode.DESCRIPTION_TOO_LONG,
                "Description must be " + properties.getDescriptionMaxLength() + " characters or less");
        }
        String cleanColor = HexColor.normalize(color)
                .orElseThrow(() -> new ValidationException(ErrorCode.INVALID_COLOR, "Invalid color: " + color));

        return new CleanCategory(cleanName, cleanColor, cleanDescription);
    }

    private record CleanCategory(String name, String color, String description) {}
}
