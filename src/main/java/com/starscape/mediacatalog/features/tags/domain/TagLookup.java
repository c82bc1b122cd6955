package com.starscape.mediacatalog.features.tags.domain;

/**
 * What other features may ask about tags.
 */
public interface TagLookup {

    /**
     * @throws com.starscape.mediacatalog.common.exception.ValidationException if the id is not positive
     * @throws com.starscape.mediacatalog.common.exception.NotFoundException if no tag has this id
     */
    Tag get(int id);
}
