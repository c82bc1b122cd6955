package com.starscape.mediacatalog.common.config;

import com.starscape.mediacatalog.common.text.Graphemes;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Text limits applied by the registries.
 * Binds to app.catalog.* properties from application.yml
 */
@Validated
@ConfigurationProperties(prefix = "app.catalog")
public class CatalogProperties {
    
    @Min(1)
    private int nameMaxLength = 50;
    
    @Min(1)
    private int descriptionMaxLength = 300;
    
    @Min(1)
    private int searchMinLength = 3;
    
    public int getNameMaxLength() {
        return nameMaxLength;
    }
    
    public void setNameMaxLength(int nameMaxLength) {
        this.nameMaxLength = nameMaxLength;
    }
    
    public int getDescriptionMaxLength() {
        return descriptionMaxLength;
    }
    
    public void setDescriptionMaxLength(int descriptionMaxLength) {
        this.descriptionMaxLength = descriptionMaxLength;
    }
    
    public int getSearchMinLength() {
        return searchMinLength;
    }
    
    public void setSearchMinLength(int searchMinLength) {
        this.searchMinLength = searchMinLength;
    }
    
    /**
     * Check a name against the configured maximum.
     * @param name The trimmed name
     * @return true if the name has more grapheme clusters than allowed
     */
    public boolean isNameTooLong(String name) {
        return Graphemes.count(name) > nameMaxLength;
    }
    
    public boolean isDescriptionTooLong(String description) {
        return Graphemes.count(description) > descriptionMaxLength;
    }
    
    public boolean isSearchTooShort(String prefix) {
        return Graphemes.count(prefix) < searchMinLength;
    }
}
