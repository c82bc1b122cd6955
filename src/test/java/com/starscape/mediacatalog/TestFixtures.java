package com.starscape.mediacatalog;

import com.starscape.mediacatalog.common.config.CatalogProperties;
import com.starscape.mediacatalog.features.basepaths.domain.BasePath;
import com.starscape.mediacatalog.features.categories.domain.Category;
import com.starscape.mediacatalog.features.media.domain.MediaAttributes;
import com.starscape.mediacatalog.features.media.domain.MediaFile;
import com.starscape.mediacatalog.features.media.domain.MediaType;
import com.starscape.mediacatalog.features.tags.domain.Tag;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.sql.SQLException;

/**
 * Builders for unit tests that run registries against mocked repositories.
 * Entities get their ids set the way the database would assign them.
 */
public final class TestFixtures {
    
    private TestFixtures() {
    }
    
    public static CatalogProperties defaultProperties() {
        return new CatalogProperties();
    }
    
    public static BasePath basePath(int id, String path) {
        return withId(new BasePath(path, ""), id);
    }
    
    public static Category category(int id, String name) {
        return withId(new Category(name, "#ff8800", ""), id);
    }
    
    public static Tag tag(int id, String name, Category category) {
        return withId(new Tag(name, category, ""), id);
    }
    
    public static MediaFile media(long id, BasePath basePath, String relativePath) {
        MediaAttributes attributes = new MediaAttributes(1920, 1080, 512.5, null, "");
        return withId(new MediaFile(basePath, relativePath, attributes, MediaType.IMAGE), id);
    }
    
    public static <T> T withId(T entity, Object id) {
        ReflectionTestUtils.setField(entity, "id", id);
        return entity;
    }
    
    /**
     * A string of {@code count} grapheme clusters, each an "e" with a combining acute accent.
     */
    public static String accentedText(int count) {
        return "e\u0301".repeat(count);
    }
    
    /**
     * {@code count} graphemes of an "e" stacked with seven combining marks, eight chars each.
     */
    public static String markedText(int count) {
        return "e\u0301\u0302\u0303\u0304\u0306\u0307\u0308".repeat(count);
    }
    
    public static DataIntegrityViolationException uniqueViolation(String constraint) {
        return integrityViolation(constraint, "23505");
    }
    
    public static DataIntegrityViolationException foreignKeyViolation(String constraint) {
        return integrityViolation(constraint, "23503");
    }
    
    /**
     * A violation the way Spring translates it from the driver, with the SQL state at the bottom.
     */
    public static DataIntegrityViolationException integrityViolation(String constraint, String sqlState) {
        SQLException sqlException = new SQLException("violates " + constraint, sqlState);
        return new DataIntegrityViolationException("could not execute statement",
            new ConstraintViolationException("could not execute statement", sqlException, constraint));
    }
}
