package com.starscape.mediacatalog.features.categories.domain;

/**
 * What other features may ask about tag categories.
 */
public interface CategoryLookup {

    /**
     * @throws com.starscape.mediacatalog.common.exception.ValidationException if the id is not positive
     * @throws com.starscape.mediacatalog.common.exception.NotFoundException if no category has this id
     */
    Category get(int id);
}
