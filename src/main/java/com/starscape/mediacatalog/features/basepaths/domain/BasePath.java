package com.starscape.mediacatalog.features.basepaths.domain;

import jakarta.persistence.*;

/**
 * A registered root directory. Media files are tracked by their path
 * relative to one of these.
 */
@Entity
@Table(name = "base_paths", uniqueConstraints = {
    @UniqueConstraint(name = "base_paths_base_path_unique", columnNames = {"base_path"})
})
public class BasePath {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;
    
    @Column(name = "base_path", nullable = false, columnDefinition = "varchar")
    private String path;
    
    @Column(nullable = false, columnDefinition = "varchar")
    private String description;
    
    protected BasePath() {
        // JPA constructor
    }
    
    public BasePath(String path, String description) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Base path cannot be blank");
        }
        this.path = path;
        this.description = description == null ? "" : description;
    }
    
    public void changeDescription(String description) {
        this.description = description;
    }
    
    // Getters
    public Integer getId() { return id; }
    public String getPath() { return path; }
    public String getDescription() { return description; }
}
