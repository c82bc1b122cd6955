package com.starscape.mediacatalog.features.categories.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses category colors: an optional '#' followed by 6 (RGB) or 8 (RGBA)
 * hex digits, in any case.
 */
public final class HexColor {
    
    private static final Pattern HEX_COLOR = Pattern.compile("#?([0-9a-fA-F]{6}|[0-9a-fA-F]{8})");
    
    private HexColor() {
    }
    
    /**
     * @return the trimmed color with lowercase digits, keeping or omitting the '#'
     *         as given, or empty if it does not parse
     */
    public static Optional<String> normalize(String color) {
        if (color == null) {
            return Optional.empty();
        }
        String trimmed = color.trim();
        if (!HEX_COLOR.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(trimmed.toLowerCase(Locale.ROOT));
    }
}
