package com.starscape.mediacatalog.features.media.app;

import com.starscape.mediacatalog.common.config.CatalogProperties;
import com.starscape.mediacatalog.common.exception.BusinessException;
import com.starscape.mediacatalog.common.exception.ConflictException;
import com.starscape.mediacatalog.common.exception.ErrorCode;
import com.starscape.mediacatalog.common.exception.NotFoundException;
import com.starscape.mediacatalog.common.exception.ReferenceException;
import com.starscape.mediacatalog.common.exception.StateException;
import com.starscape.mediacatalog.common.exception.StorageException;
import com.starscape.mediacatalog.common.exception.ValidationException;
import com.starscape.mediacatalog.common.persistence.IntegrityViolations;
import com.starscape.mediacatalog.common.text.Graphemes;
import com.starscape.mediacatalog.features.basepaths.domain.BasePath;
import com.starscape.mediacatalog.features.basepaths.domain.BasePathLookup;
import com.starscape.mediacatalog.features.media.domain.MediaAttributes;
import com.starscape.mediacatalog.features.media.domain.MediaFile;
import com.starscape.mediacatalog.features.media.domain.MediaFileRepository;
import com.starscape.mediacatalog.features.media.domain.MediaFileUpdate;
import com.starscape.mediacatalog.features.media.domain.MediaTag;
import com.starscape.mediacatalog.features.media.domain.MediaTagRepository;
import com.starscape.mediacatalog.features.media.domain.NewMediaFile;
import com.starscape.mediacatalog.features.tags.domain.Tag;
import com.starscape.mediacatalog.features.tags.domain.TagLookup;
import com.starscape.mediacatalog.features.tags.domain.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Media files and their tags.
 * Resolves base paths and tags through their registries and answers the
 * multi-tag intersection query.
 */
@Service
public class MediaCatalog {

    private static final Logger log = LoggerFactory.getLogger(MediaCatalog.class);
    private static final int MIN_MARK = 1;
    private static final int MAX_MARK = 10;

    private final MediaFileRepository mediaFileRepository;
    private final MediaTagRepository mediaTagRepository;
    private final TagRepository tagRepository;
    private final BasePathLookup basePaths;
    private final TagLookup tags;
    private final CatalogProperties properties;

    public MediaCatalog(
            MediaFileRepository mediaFileRepository,
            MediaTagRepository mediaTagRepository,
            TagRepository tagRepository,
            BasePathLookup basePaths,
            TagLookup tags,
            CatalogProperties properties) {
        this.mediaFileRepository = mediaFileRepository;
        this.mediaTagRepository = mediaTagRepository;
        this.tagRepository = tagRepository;
        this.basePaths = basePaths;
        this.tags = tags;
        this.properties = properties;
    }

    /**
     * Register a media file under an existing base path.
     */
    @Transactional
    public MediaFile create(NewMediaFile request) {
        BasePath basePath = resolveBasePath(request.basePathId());

        String relativePath = normalizeRelativePath(request.relativePath());
        if (relativePath.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_RELATIVE_PATH, "Relative path cannot be empty");
        }
        if (request.basePathId() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_BASE_PATH_ID, "Invalid base path id: " + request.basePathId());
        }
        MediaAttributes attributes = validate(new MediaAttributes(
            request.width(),
            request.height(),
            request.size(),
            request.mark(),
            Graphemes.clean(request.description())));

        if (mediaFileRepository.existsByBasePathIdAndRelativePath(basePath.getId(), relativePath)) {
            throw new ConflictException(ErrorCode.ALREADY_EXISTS,
                String.format("Media %s already exists in base path %d", relativePath, basePath.getId()));
        }

        try {
            MediaFile saved = mediaFileRepository.saveAndFlush(
                new MediaFile(basePath, relativePath, attributes, request.mediaType()));
            log.info("Registered media: id={}, basePathId={}, path={}", saved.getId(), saved.getBasePathId(), saved.getRelativePath());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isUniqueViolation(e)) {
                throw e;
            }
            log.warn("Media {} in base path {} was registered concurrently", relativePath, basePath.getId());
            throw new ConflictException(ErrorCode.ALREADY_EXISTS,
                String.format("Media %s already exists in base path %d", relativePath, basePath.getId()), e);
        }
    }

    @Transactional(readOnly = true)
    public MediaFile get(long id) {
        if (id <= 0) {
            throw new ValidationException(ErrorCode.INVALID_ID, "Invalid media id: " + id);
        }
        return mediaFileRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Media not found: " + id));
    }

    @Transactional(readOnly = true)
    public MediaFile getByRelativePath(int basePathId, String relativePath) {
        String normalized = normalizeRelativePath(relativePath);
        if (normalized.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_RELATIVE_PATH, "Relative path cannot be empty");
        }
        if (basePathId <= 0) {
            throw new ValidationException(ErrorCode.INVALID_BASE_PATH_ID, "Invalid base path id: " + basePathId);
        }

        return mediaFileRepository.findByBasePathIdAndRelativePath(basePathId, normalized)
                .orElseThrow(() -> new NotFoundException(
                    String.format("Media not found: basePathId=%d, path=%s", basePathId, normalized)));
    }

    /**
     * Apply a patch to the mutable attributes. Relative path, base path and
     * media type never change.
     */
    @Transactional
    public void update(long id, MediaFileUpdate update) {
        MediaFile media = get(id);
        MediaFileUpdate cleanUpdate = update.description() == null ? update : new MediaFileUpdate(
            update.width(), update.height(), update.size(), update.mark(), Graphemes.clean(update.description()));

        media.apply(validate(media.attributes().merge(cleanUpdate)));
        mediaFileRepository.save(media);
        log.info("Updated media {}", id);
    }

    /**
     * Media files of one base path, ordered by id.
     */
    @Transactional(readOnly = true)
    public List<MediaFile> list(int basePathId) {
        BasePath basePath = resolveBasePath(basePathId);
        return mediaFileRepository.findByBasePathIdOrderByIdAsc(basePath.getId());
    }

    /**
     * Remove a media file that carries no tags.
     */
    @Transactional
    public void delete(long id) {
        MediaFile media = get(id);

        long tagCount = mediaTagRepository.countByMediaId(id);
        if (tagCount > 0) {
            log.debug("Refusing to delete media {}: it has {} tags", id, tagCount);
            throw new StateException(ErrorCode.IN_USE, String.format("Media %d has %d tags", id, tagCount));
        }

        try {
            mediaFileRepository.delete(media);
            mediaFileRepository.flush();
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isForeignKeyViolation(e)) {
                throw e;
            }
            log.warn("Media {} was tagged while being deleted", id);
            throw new StateException(ErrorCode.IN_USE, "Media " + id + " is in use", e);
        }
        log.info("Deleted media: id={}, path={}", id, media.getRelativePath());
    }

    @Transactional
    public void tagMedia(long mediaId, int tagId) {
        MediaFile media = get(mediaId);
        Tag tag = resolveTag(tagId);

        if (mediaTagRepository.existsByMediaIdAndTagId(mediaId, tagId)) {
            throw new ConflictException(ErrorCode.ALREADY_TAGGED,
                String.format("Media %d is already tagged with %d", mediaId, tagId));
        }

        try {
            mediaTagRepository.saveAndFlush(new MediaTag(media, tag));
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isUniqueViolation(e)) {
                throw e;
            }
            log.warn("Media {} was tagged with {} concurrently", mediaId, tagId);
            throw new ConflictException(ErrorCode.ALREADY_TAGGED,
                String.format("Media %d is already tagged with %d", mediaId, tagId), e);
        }
        log.info("Tagged media {} with tag {}", mediaId, tagId);
    }

    @Transactional
    public void untagMedia(long mediaId, int tagId) {
        get(mediaId);
        resolveTag(tagId);

        MediaTag association = mediaTagRepository.findByMediaIdAndTagId(mediaId, tagId)
                .orElseThrow(() -> new StateException(ErrorCode.TAG_NOT_FOUND,
                    String.format("Media %d is not tagged with %d", mediaId, tagId)));

        mediaTagRepository.delete(association);
        mediaTagRepository.flush();
        log.info("Removed tag {} from media {}", tagId, mediaId);
    }

    /**
     * Tags of one media file, sorted by name.
     */
    @Transactional(readOnly = true)
    public List<Tag> listTagsForMedia(long mediaId) {
        get(mediaId);
        return tagRepository.findByMediaId(mediaId);
    }

    /**
     * Media tagged with every one of {@code tagIds} (logical AND), ordered by id.
     * Duplicate ids count once; unknown tag ids simply match nothing.
     */
    @Transactional(readOnly = true)
    public List<MediaFile> listMediaByTags(Collection<Integer> tagIds) {
        Set<Integer> distinctIds = new LinkedHashSet<>();
        if (tagIds != null) {
            tagIds.stream().filter(Objects::nonNull).forEach(distinctIds::add);
        }
        if (distinctIds.isEmpty()) {
            throw new ValidationException(ErrorCode.NO_TAGS_PROVIDED, "At least one tag is required");
        }

        List<MediaFile> result = mediaFileRepository.findTaggedWithAll(distinctIds, distinctIds.size());
        log.debug("Found {} media tagged with all of {}", result.size(), distinctIds);
        return result;
    }

    private BasePath resolveBasePath(int basePathId) {
        try {
            return basePaths.get(basePathId);
        } catch (StorageException e) {
            throw e;
        } catch (BusinessException e) {
            throw new ReferenceException(ErrorCode.BASE_PATH_ERROR,
                "Base path " + basePathId + " cannot be used: " + e.getMessage(), e);
        }
    }

    private Tag resolveTag(int tagId) {
        try {
            return tags.get(tagId);
        } catch (StorageException e) {
            throw e;
        } catch (BusinessException e) {
            throw new ReferenceException(ErrorCode.TAG_ERROR, "Tag " + tagId + " cannot be used: " + e.getMessage(), e);
        }
    }

    private MediaAttributes validate(MediaAttributes attributes) {
        if (attributes.width() != null && attributes.width() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_WIDTH, "Width must be positive: " + attributes.width());
        }
        if (attributes.height() != null && attributes.height() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_HEIGHT, "Height must be positive: " + attributes.height());
        }
        if (!Double.isFinite(attributes.size()) || attributes.size() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_SIZE, "Size must be positive: " + attributes.size());
        }
        if (attributes.mark() != null && (attributes.mark() < MIN_MARK || attributes.mark() > MAX_MARK)) {
            throw new ValidationException(ErrorCode.INVALID_MARK,
                String.format("Mark must be between %d and %d: %d", MIN_MARK, MAX_MARK, attributes.mark()));
        }
        if (properties.isDescriptionTooLong(attributes.description())) {
            throw new ValidationException(ErrorCode.DESCRIPTION_TOO_LONG,
                "Description must be " + properties.getDescriptionMaxLength() + " characters or less");
        }
        return attributes;
    }

    /**
     * Trim whitespace, then leading and trailing slashes.
     */
    private String normalizeRelativePath(String relativePath) {
        String normalized = Graphemes.clean(relativePath);
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '/') {
            start++;
        }
        while (end > start && normalized.charAt(end - 1) == '/') {
            end--;
        }
        return normalized.substring(start, end);
    }
}
