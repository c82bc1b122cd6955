package com.starscape.mediacatalog.features.media.domain;

import com.starscape.mediacatalog.features.tags.domain.Tag;
import jakarta.persistence.*;

/**
 * Junction entity for the many-to-many relationship between media files and tags.
 */
@Entity
@Table(name = "media_tags", uniqueConstraints = {
    @UniqueConstraint(name = "media_tags_media_tag_unique", columnNames = {"media_id", "tag_id"})
})
public class MediaTag {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "media_id", nullable = false)
    private MediaFile media;
    
    @Column(name = "media_id", insertable = false, updatable = false)
    private Long mediaId;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tag_id", nullable = false)
    private Tag tag;
    
    @Column(name = "tag_id", insertable = false, updatable = false)
    private Integer tagId;
    
    protected MediaTag() {
        // JPA constructor
    }
    
    public MediaTag(MediaFile media, Tag tag) {
        if (media == null || media.getId() == null) {
            throw new IllegalArgumentException("Media must be persisted before tagging");
        }
        if (tag == null || tag.getId() == null) {
            throw new IllegalArgumentException("Tag must be persisted before tagging");
        }
        
        this.media = media;
        this.mediaId = media.getId();
        this.tag = tag;
        this.tagId = tag.getId();
    }
    
    // Getters
    public Long getId() { return id; }
    public Long getMediaId() { return mediaId; }
    public Integer getTagId() { return tagId; }
}
