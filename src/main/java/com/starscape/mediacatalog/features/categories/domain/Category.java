package com.starscape.mediacatalog.features.categories.domain;

import jakarta.persistence.*;

/**
 * Tag category, the top level of the tag taxonomy.
 */
@Entity
@Table(name = "tag_categories")
public class Category {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;
    
    @Column(nullable = false, columnDefinition = "varchar")
    private String name;
    
    /** Display color, "#" followed by lowercase hex digits. */
    @Column(nullable = false, length = 16)
    private String color;
    
    @Column(nullable = false, columnDefinition = "varchar")
    private String description;
    
    protected Category() {
        // JPA constructor
    }
    
    public Category(String name, String color, String description) {
        this.name = name;
        this.color = color;
        this.description = description;
    }
    
    public void rename(String name) {
        this.name = name;
    }
    
    public void recolor(String color) {
        this.color = color;
    }
    
    public void describe(String description) {
        this.description = description;
    }
    
    // Getters
    public Integer getId() { return id; }
    public String getName() { return name; }
    public String getColor() { return color; }
    public String getDescription() { return description; }
}
