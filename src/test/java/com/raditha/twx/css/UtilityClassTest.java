package com.raditha.twx.css;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtilityClassTest {

    @Test
    void testParse_Plain() {
        UtilityClass parsed = UtilityClass.parse("p-4");

        assertEquals(List.of(), parsed.variants());
        assertFalse(parsed.important());
        assertFalse(parsed.negative());
        assertEquals("p-4", parsed.base());
    }

    @Test
    void testParse_VariantsImportantNegative() {
        UtilityClass parsed = UtilityClass.parse("md:hover:!-mt-4");

        assertEquals(List.of("md", "hover"), parsed.variants());
        assertTrue(parsed.important());
        assertTrue(parsed.negative());
        assertEquals("mt-4", parsed.base());
        assertEquals("md:hover:!-mt-4", parsed.raw());
    }

    @Test
    void testParse_ColonInsideBrackets() {
        UtilityClass parsed = UtilityClass.parse("lg:[mask-type:luminance]");

        assertEquals(List.of("lg"), parsed.variants());
        assertEquals("[mask-type:luminance]", parsed.base());
    }

    @Test
    void testParse_Malformed() {
        assertNull(UtilityClass.parse(""));
        assertNull(UtilityClass.parse(null));
        assertNull(UtilityClass.parse("md:"));
        assertNull(UtilityClass.parse(":flex"));
        assertNull(UtilityClass.parse("w-[10px"));
        assertNull(UtilityClass.parse("w-10px]"));
        assertNull(UtilityClass.parse("!"));
    }
}
