package com.starscape.mediacatalog.features.basepaths.app;

import com.starscape.mediacatalog.common.config.CatalogProperties;
import com.starscape.mediacatalog.common.exception.ConflictException;
import com.starscape.mediacatalog.common.exception.ErrorCode;
import com.starscape.mediacatalog.common.exception.NotFoundException;
import com.starscape.mediacatalog.common.exception.StateException;
import com.starscape.mediacatalog.common.exception.ValidationException;
import com.starscape.mediacatalog.common.persistence.IntegrityViolations;
import com.starscape.mediacatalog.common.text.Graphemes;
import com.starscape.mediacatalog.features.basepaths.domain.BasePath;
import com.starscape.mediacatalog.features.basepaths.domain.BasePathLookup;
import com.starscape.mediacatalog.features.basepaths.domain.BasePathRepository;
import com.starscape.mediacatalog.features.media.domain.MediaFileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Registers root directories and keeps them apart: no two base paths may be
 * equal or contain one another.
 */
@Service
public class BasePathRegistry implements BasePathLookup {

    private static final Logger log = LoggerFactory.getLogger(BasePathRegistry.class);

    private final BasePathRepository basePathRepository;
    private final MediaFileRepository mediaFileRepository;
    private final CatalogProperties properties;

    public BasePathRegistry(
            BasePathRepository basePathRepository,
            MediaFileRepository mediaFileRepository,
            CatalogProperties properties) {
        this.basePathRepository = basePathRepository;
        this.mediaFileRepository = mediaFileRepository;
        this.properties = properties;
    }

    /**
     * Register a directory that exists on disk.
     * Both arguments are trimmed; the path loses trailing slashes and "." or ".." segments.
     * Containment is checked under serializable isolation.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public BasePath create(String path, String description) {
        String trimmedPath = stripTrailingSlashes(Graphemes.clean(path));
        String cleanDescription = Graphemes.clean(description);

        if (trimmedPath.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_PATH, "Base path cannot be empty");
        }
        if (properties.isDescriptionTooLong(cleanDescription)) {
            throw new ValidationException(ErrorCode.DESCRIPTION_TOO_LONG,
                "Description must be " + properties.getDescriptionMaxLength() + " characters or less");
        }

        Path directory = toPath(trimmedPath);
        String normalizedPath = directory.toString();
        if (!Files.exists(directory)) {
            throw new ValidationException(ErrorCode.NOT_EXISTS, "Path does not exist: " + trimmedPath);
        }
        if (!Files.isDirectory(directory)) {
            throw new ValidationException(ErrorCode.NOT_A_DIRECTORY, "Path is not a directory: " + trimmedPath);
        }
        if (!directory.isAbsolute()) {
            throw new ValidationException(ErrorCode.NOT_ABSOLUTE, "Path is not absolute: " + trimmedPath);
        }

        for (BasePath existing : basePathRepository.findAllByOrderByIdAsc()) {
            checkNoOverlap(directory, normalizedPath, existing);
        }

        try {
            BasePath saved = basePathRepository.saveAndFlush(new BasePath(normalizedPath, cleanDescription));
            log.info("Registered base path: id={}, path={}", saved.getId(), saved.getPath());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isUniqueViolation(e)) {
                throw e;
            }
            log.warn("Base path {} was registered concurrently", normalizedPath);
            throw new ConflictException(ErrorCode.ALREADY_EXISTS, "Base path already exists: " + normalizedPath, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public BasePath get(int id) {
        if (id <= 0) {
            throw new ValidationException(ErrorCode.INVALID_ID, "Invalid base path id: " + id);
        }
        return basePathRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Base path not found: " + id));
    }

    /**
     * List base paths ordered by id. A null or empty {@code ids} lists all of them.
     */
    @Transactional(readOnly = true)
    public List<BasePath> list(Collection<Integer> ids) {
        return ids == null || ids.isEmpty()
                ? basePathRepository.findAllByOrderByIdAsc()
                : basePathRepository.findByIdInOrderByIdAsc(ids);
    }

    @Transactional
    public void updateDescription(int id, String description) {
        String cleanDescription = Graphemes.clean(description);

        BasePath basePath = get(id);
        if (properties.isDescriptionTooLong(cleanDescription)) {
            throw new ValidationException(ErrorCode.DESCRIPTION_TOO_LONG,
                "Description must be " + properties.getDescriptionMaxLength() + " characters or less");
        }
        basePath.changeDescription(cleanDescription);
        basePathRepository.save(basePath);
        log.info("Updated description of base path {}", id);
    }

    /**
     * Remove a base path that no media file references.
     */
    @Transactional
    public void delete(int id) {
        BasePath basePath = get(id);

        long mediaCount = mediaFileRepository.countByBasePathId(id);
        if (mediaCount > 0) {
            log.debug("Refusing to delete base path {}: {} media files reference it", id, mediaCount);
            throw new StateException(ErrorCode.IN_USE,
                String.format("Base path %d is used by %d media files", id, mediaCount));
        }

        try {
            basePathRepository.delete(basePath);
            basePathRepository.flush();
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isForeignKeyViolation(e)) {
                throw e;
            }
            log.warn("Base path {} gained media files while being deleted", id);
            throw new StateException(ErrorCode.IN_USE, "Base path " + id + " is in use", e);
        }
        log.info("Deleted base path: id={}, path={}", id, basePath.getPath());
    }

    private void checkNoOverlap(Path candidate, String candidatePath, BasePath existing) {
        if (existing.getPath().equals(candidatePath)) {
            throw new ConflictException(ErrorCode.ALREADY_EXISTS, "Base path already exists: " + candidatePath);
        }

        Path existingPath = Path.of(existing.getPath());
        if (candidate.startsWith(existingPath) || existingPath.startsWith(candidate)) {
            log.debug("Base path {} overlaps registered base path {}", candidatePath, existing.getPath());
            throw new ConflictException(ErrorCode.IS_SUB_PATH,
                String.format("Base path %s overlaps registered base path %s", candidatePath, existing.getPath()));
        }
    }

    private Path toPath(String path) {
        try {
            return Path.of(path).normalize();
        } catch (InvalidPathException e) {
            throw new ValidationException(ErrorCode.INVALID_PATH, "Invalid base path: " + e.getMessage());
        }
    }

    private String stripTrailingSlashes(String path) {
        String stripped = path;
        while (stripped.endsWith("/")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }
}
