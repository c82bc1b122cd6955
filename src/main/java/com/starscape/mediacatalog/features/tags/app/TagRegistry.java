package com.starscape.mediacatalog.features.tags.app;

import com.starscape.mediacatalog.common.config.CatalogProperties;
import com.starscape.mediacatalog.common.exception.ConflictException;
import com.starscape.mediacatalog.common.exception.ErrorCode;
import com.starscape.mediacatalog.common.exception.NotFoundException;
import com.starscape.mediacatalog.common.exception.ReferenceException;
import com.starscape.mediacatalog.common.exception.StateException;
import com.starscape.mediacatalog.common.exception.ValidationException;
import com.starscape.mediacatalog.common.persistence.IntegrityViolations;
import com.starscape.mediacatalog.common.text.Graphemes;
import com.starscape.mediacatalog.features.categories.domain.Category;
import com.starscape.mediacatalog.features.categories.domain.CategoryLookup;
import com.starscape.mediacatalog.features.media.domain.MediaTagRepository;
import com.starscape.mediacatalog.features.tags.domain.NewTag;
import com.starscape.mediacatalog.features.tags.domain.Tag;
import com.starscape.mediacatalog.features.tags.domain.TagLookup;
import com.starscape.mediacatalog.features.tags.domain.TagRepository;
import com.starscape.mediacatalog.features.tags.domain.TagUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Owns tags. A tag name is unique within its category.
 */
@Service
public class TagRegistry implements TagLookup {

    private static final Logger log = LoggerFactory.getLogger(TagRegistry.class);

    private final TagRepository tagRepository;
    private final MediaTagRepository mediaTagRepository;
    private final CategoryLookup categories;
    private final CatalogProperties properties;

    public TagRegistry(
            TagRepository tagRepository,
            MediaTagRepository mediaTagRepository,
            CategoryLookup categories,
            CatalogProperties properties) {
        this.tagRepository = tagRepository;
        this.mediaTagRepository = mediaTagRepository;
        this.categories = categories;
        this.properties = properties;
    }

    @Transactional
    public Tag create(NewTag request) {
        Category category = resolveCategory(request.categoryId());
        String name = validName(request.name());
        String description = validDescription(request.description());

        if (tagRepository.existsByNameAndCategoryId(name, category.getId())) {
            throw new ConflictException(ErrorCode.ALREADY_EXISTS,
                String.format("Tag '%s' already exists in category %d", name, category.getId()));
        }

        Tag saved = saveUnique(new Tag(name, category, description));
        log.info("Created tag: id={}, name={}, categoryId={}", saved.getId(), saved.getName(), saved.getCategoryId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Tag get(int id) {
        if (id <= 0) {
            throw new ValidationException(ErrorCode.INVALID_ID, "Invalid tag id: " + id);
        }
        return tagRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Tag not found: " + id));
    }

    /**
     * Apply a patch, validate the merged tag and make sure it does not collide
     * with another tag of the target category.
     */
    @Transactional
    public void update(int id, TagUpdate update) {
        Tag tag = get(id);

        int categoryId = update.categoryId() != null ? update.categoryId() : tag.getCategoryId();
        Category category = resolveCategory(categoryId);
        String name = validName(update.name() != null ? update.name() : tag.getName());
        String description = validDescription(update.description() != null ? update.description() : tag.getDescription());

        if (tagRepository.existsByNameAndCategoryIdAndIdNot(name, category.getId(), tag.getId())) {
            throw new ConflictException(ErrorCode.ALREADY_EXISTS,
                String.format("Tag '%s' already exists in category %d", name, category.getId()));
        }

        tag.rename(name);
        tag.moveTo(category);
        tag.describe(description);
        saveUnique(tag);
        log.info("Updated tag {}", id);
    }

    /**
     * List tags sorted by name, optionally only those of one category.
     */
    @Transactional(readOnly = true)
    public List<Tag> list(Integer categoryId) {
        if (categoryId == null) {
            return tagRepository.findAllByOrderByNameAscIdAsc();
        }
        Category category = resolveCategory(categoryId);
        return tagRepository.findByCategoryIdOrderByNameAscIdAsc(category.getId());
    }

    /**
     * Tags whose name starts with {@code prefix}, ignoring case.
     */
    @Transactional(readOnly = true)
    public List<Tag> searchByName(String prefix) {
        String cleanPrefix = Graphemes.clean(prefix);
        if (properties.isSearchTooShort(cleanPrefix)) {
            throw new ValidationException(ErrorCode.INVALID_NAME,
                "Name to search must be at least " + properties.getSearchMinLength() + " characters");
        }

        return list(null).stream()
                .filter(tag -> Graphemes.startsWithIgnoreCase(tag.getName(), cleanPrefix))
                .toList();
    }

    /**
     * Remove a tag that is not attached to any media file.
     */
    @Transactional
    public void delete(int id) {
        Tag tag = get(id);

        long mediaCount = mediaTagRepository.countByTagId(id);
        if (mediaCount > 0) {
            log.debug("Refusing to delete tag {}: attached to {} media files", id, mediaCount);
            throw new StateException(ErrorCode.IN_USE,
                String.format("Tag %d is attached to %d media files", id, mediaCount));
        }

        try {
            tagRepository.delete(tag);
            tagRepository.flush();
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isForeignKeyViolation(e)) {
                throw e;
            }
            log.warn("Tag {} was attached to media while being deleted", id);
            throw new StateException(ErrorCode.IN_USE, "Tag " + id + " is in use", e);
        }
        log.info("Deleted tag: id={}, name={}", id, tag.getName());
    }

    private Category resolveCategory(int categoryId) {
        if (categoryId <= 0) {
            throw new ValidationException(ErrorCode.INVALID_CATEGORY_ID, "Invalid category id: " + categoryId);
        }
        try {
            return categories.get(categoryId);
        } catch (NotFoundException e) {
            throw new ReferenceException(ErrorCode.CATEGORY_NOT_FOUND, "Category not found: " + categoryId, e);
        }
    }

    private String validName(String name) {
        String cleanName = Graphemes.clean(name);
        if (cleanName.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_NAME, "Tag name cannot be empty");
        }
        if (properties.isNameTooLong(cleanName)) {
            throw new ValidationException(ErrorCode.NAME_TOO_LONG,
                "Tag name must be " + properties.getNameMaxLength() + " characters or less");
        }
        return cleanName;
    }

    private String validDescription(String description) {
        String cleanDescription = Graphemes.clean(description);
        if (properties.isDescriptionTooLong(cleanDescription)) {
            throw new ValidationException(ErrorCode.DESCRIPTION_TOO_LONG,
                "Description must be " + properties.getDescriptionMaxLength() + " characters or less");
        }
        return cleanDescription;
    }

    private Tag saveUnique(Tag tag) {
        try {
            return tagRepository.saveAndFlush(tag);
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isUniqueViolation(e)) {
                throw e;
            }
            log.warn("Tag '{}' in category {} was created concurrently", tag.getName(), tag.getCategoryId());
            throw new ConflictException(ErrorCode.ALREADY_EXISTS,
                String.format("Tag '%s' already exists in category %d", tag.getName(), tag.getCategoryId()), e);
        }
    }
}
