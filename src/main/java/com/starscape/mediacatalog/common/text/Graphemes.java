package com.starscape.mediacatalog.common.text;

import java.text.BreakIterator;
import java.util.Locale;

/**
 * Length and matching helpers for user-facing text. Lengths are counted in
 * user-perceived characters (grapheme clusters), so "e" followed by a
 * combining accent counts once.
 */
public final class Graphemes {
    
    private Graphemes() {
    }
    
    public static int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        BreakIterator iterator = BreakIterator.getCharacterInstance(Locale.ROOT);
        iterator.setText(text);
        int count = 0;
        while (iterator.next() != BreakIterator.DONE) {
            count++;
        }
        return count;
    }
    
    /**
     * Case-insensitive prefix match used by the name searches.
     */
    public static boolean startsWithIgnoreCase(String text, String prefix) {
        return text.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT));
    }
    
    /**
     * Trim whitespace, treating {@code null} as empty.
     */
    public static String clean(String text) {
        return text == null ? "" : text.trim();
    }
}
