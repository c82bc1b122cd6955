package com.starscape.mediacatalog.common.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphemesTest {

    @Test
    void testCount_PlainText() {
        assertEquals(0, Graphemes.count(null));
        assertEquals(0, Graphemes.count(""));
        assertEquals(5, Graphemes.count("hello"));
    }

    @Test
    void testCount_CombiningMarksJoinTheirBase() {
        String accented = "e\u0301te\u0301";

        assertEquals(5, accented.length());
        assertEquals(3, Graphemes.count(accented));
    }

    @Test
    void testCount_SurrogatePairIsOneCharacter() {
        String camera = "\uD83D\uDCF7";

        assertEquals(2, camera.length());
        assertEquals(1, Graphemes.count(camera));
    }

    @Test
    void testStartsWithIgnoreCase() {
        assertTrue(Graphemes.startsWithIgnoreCase("Holidays", "hOL"));
        assertFalse(Graphemes.startsWithIgnoreCase("Holidays", "days"));
    }

    @Test
    void testClean() {
        assertEquals("", Graphemes.clean(null));
        assertEquals("a b", Graphemes.clean("  a b \t"));
    }
}
