package com.starscape.mediacatalog.common.exception;

/**
 * Every failure the catalog reports to its callers.
 */
public enum ErrorCode {
    // input validation
    INVALID_ID,
    INVALID_PATH,
    DESCRIPTION_TOO_LONG,
    NOT_EXISTS,
    NOT_A_DIRECTORY,
    NOT_ABSOLUTE,
    INVALID_NAME,
    NAME_TOO_LONG,
    INVALID_COLOR,
    NAME_TO_SEARCH_TOO_SHORT,
    INVALID_CATEGORY_ID,
    INVALID_RELATIVE_PATH,
    INVALID_BASE_PATH_ID,
    INVALID_WIDTH,
    INVALID_HEIGHT,
    INVALID_SIZE,
    INVALID_MARK,
    NO_TAGS_PROVIDED,

    // referential
    NOT_FOUND,
    CATEGORY_NOT_FOUND,
    BASE_PATH_ERROR,
    TAG_ERROR,

    // conflicts
    ALREADY_EXISTS,
    ALREADY_TAGGED,
    IS_SUB_PATH,

    // state protection
    IN_USE,
    TAG_NOT_FOUND,

    // infrastructure
    STORAGE_ERROR
}
