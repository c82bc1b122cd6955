package com.starscape.mediacatalog.features.basepaths.domain;

/**
 * What other features may ask about base paths.
 */
public interface BasePathLookup {

    /**
     * @throws com.starscape.mediacatalog.common.exception.ValidationException if the id is not positive
     * @throws com.starscape.mediacatalog.common.exception.NotFoundException if no base path has this id
     */
    BasePath get(int id);
}
