package com.starscape.mediacatalog.features.media.domain;

import com.starscape.mediacatalog.features.basepaths.domain.BasePath;
import jakarta.persistence.*;

/**
 * A media file tracked by its path relative to a base path.
 * Relative path, base path and media type are fixed once created.
 */
@Entity
@Table(name = "media", uniqueConstraints = {
    @UniqueConstraint(name = "media_base_path_relative_path_unique", columnNames = {"base_path_id", "relative_path"})
})
public class MediaFile {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "relative_path", nullable = false, columnDefinition = "varchar")
    private String relativePath;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "base_path_id", nullable = false)
    private BasePath basePath;
    
    @Column(name = "base_path_id", insertable = false, updatable = false)
    private Integer basePathId;
    
    @Column(name = "width")
    private Integer width;
    
    @Column(name = "height")
    private Integer height;
    
    /** Size in kB. */
    @Column(nullable = false)
    private double size;
    
    @Column(name = "mark")
    private Integer mark;
    
    @Column(nullable = false, columnDefinition = "varchar")
    private String description;
    
    @Convert(converter = MediaTypeConverter.class)
    @Column(name = "media_type", nullable = false, length = 16)
    private MediaType mediaType;
    
    protected MediaFile() {
        // JPA constructor
    }
    
    public MediaFile(BasePath basePath, String relativePath, MediaAttributes attributes, MediaType mediaType) {
        if (basePath == null || basePath.getId() == null) {
            throw new IllegalArgumentException("Media must belong to a persisted base path");
        }
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("Relative path cannot be blank");
        }
        
        this.basePath = basePath;
        this.basePathId = basePath.getId();
        this.relativePath = relativePath;
        this.mediaType = mediaType == null ? MediaType.UNKNOWN : mediaType;
        apply(attributes);
    }
    
    /**
     * Replace the mutable attributes with an already validated set.
     */
    public void apply(MediaAttributes attributes) {
        this.width = attributes.width();
        this.height = attributes.height();
        this.size = attributes.size();
        this.mark = attributes.mark();
        this.description = attributes.description();
    }
    
    public MediaAttributes attributes() {
        return new MediaAttributes(width, height, size, mark, description);
    }
    
    // Getters
    public Long getId() { return id; }
    public String getRelativePath() { return relativePath; }
    public Integer getBasePathId() { return basePathId; }
    public Integer getWidth() { return width; }
    public Integer getHeight() { return height; }
    public double getSize() { return size; }
    public Integer getMark() { return mark; }
    public String getDescription() { return description; }
    public MediaType getMediaType() { return mediaType; }
}
