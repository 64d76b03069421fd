package com.raditha.twx.pipeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    private final DiffGenerator generator = new DiffGenerator();

    @Test
    void testIdenticalTexts() {
        assertEquals("", generator.generateUnifiedDiff("a.jsx", "same\n", "same\n"));
    }

    @Test
    void testUnifiedDiff() {
        String original = "line 1\n<div className=\"flex p-4\" />\nline 3\n";
        String revised = "line 1\n<div className=\"tw-a tw-b\" />\nline 3\n";

        String diff = generator.generateUnifiedDiff("src/App.jsx", original, revised);

        assertTrue(diff.startsWith("--- a/src/App.jsx\n+++ b/src/App.jsx\n"), diff);
        assertTrue(diff.contains("-<div className=\"flex p-4\" />"));
        assertTrue(diff.contains("+<div className=\"tw-a tw-b\" />"));
        assertTrue(diff.contains(" line 1"));
    }

    @Test
    void testContextLines() {
        String original = "a\nb\nc\nd\ne\nf\ng\n";
        String revised = "a\nb\nc\nX\ne\nf\ng\n";

        String diff = generator.generateUnifiedDiff("f.js", original, revised, 0);

        assertFalse(diff.contains(" c"));
        assertTrue(diff.contains("-d"));
        assertTrue(diff.contains("+X"));
    }
}
