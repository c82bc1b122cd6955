package com.starscape.mediacatalog.features.tags.domain;

import com.starscape.mediacatalog.features.categories.domain.Category;
import jakarta.persistence.*;

/**
 * Tag entity. Every tag belongs to exactly one category and its name is
 * unique within that category.
 */
@Entity
@Table(name = "tags", uniqueConstraints = {
    @UniqueConstraint(name = "tags_name_category_unique", columnNames = {"name", "category_id"})
})
public class Tag {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;
    
    @Column(nullable = false, columnDefinition = "varchar")
    private String name;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;
    
    @Column(name = "category_id", insertable = false, updatable = false)
    private Integer categoryId;
    
    @Column(nullable = false, columnDefinition = "varchar")
    private String description;
    
    protected Tag() {
        // JPA constructor
    }
    
    public Tag(String name, Category category, String description) {
        this.name = name;
        this.description = description;
        moveTo(category);
    }
    
    public void rename(String name) {
        this.name = name;
    }
    
    public void describe(String description) {
        this.description = description;
    }
    
    public void moveTo(Category category) {
        if (category == null || category.getId() == null) {
            throw new IllegalArgumentException("Tag must belong to a persisted category");
        }
        this.category = category;
        this.categoryId = category.getId();
    }
    
    // Getters
    public Integer getId() { return id; }
    public String getName() { return name; }
    public Integer getCategoryId() { return categoryId; }
    public String getDescription() { return description; }
}
