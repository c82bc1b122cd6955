package com.starscape.mediacatalog.features.media.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link MediaType} as its lowercase name. UNKNOWN is written as
 * "unknown" so it survives a round trip.
 */
@Converter
public class MediaTypeConverter implements AttributeConverter<MediaType, String> {
    
    @Override
    public String convertToDatabaseColumn(MediaType attribute) {
        return (attribute == null ? MediaType.UNKNOWN : attribute).getStorageValue();
    }
    
    @Override
    public MediaType convertToEntityAttribute(String dbData) {
        return MediaType.fromStorageValue(dbData);
    }
}
