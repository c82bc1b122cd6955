package com.starscape.mediacatalog.features.media.domain;

/**
 * Kind of a media file as stored in the media_type column.
 */
public enum MediaType {
    UNKNOWN("unknown"),
    IMAGE("image"),
    VIDEO("video"),
    SOUND("sound");
    
    private final String storageValue;
    
    MediaType(String storageValue) {
        this.storageValue = storageValue;
    }
    
    public String getStorageValue() {
        return storageValue;
    }
    
    /**
     * Anything that is not a known value, including null and empty, is UNKNOWN.
     */
    public static MediaType fromStorageValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (MediaType type : values()) {
            if (type.storageValue.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
