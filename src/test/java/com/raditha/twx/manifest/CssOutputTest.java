package com.raditha.twx.manifest;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CssOutputTest {

    private static final Instant TIME = Instant.parse("2024-01-02T03:04:05Z");

    private static final String BUNDLE = ".flex {\n  display: flex;\n}\n\n.p-4 {\n  padding: 1rem;\n}\n";

    @Test
    void testRender_FullHeader() {
        String css = CssOutput.render(BUNDLE, false, TIME);

        assertTrue(css.startsWith("/*\n * Generated by twx v" + Manifest.EXTRACTOR_VERSION + "\n"));
        assertTrue(css.contains(" * Generation time: 2024-01-02 03:04:05 UTC\n"));
        assertTrue(css.contains(" * This file contains the extracted utility classes.\n"));
        assertTrue(css.endsWith(" */\n\n" + BUNDLE));
    }

    @Test
    void testRender_EmptyBundle() {
        String css = CssOutput.render("  \n", false, TIME);

        assertTrue(css.contains(" * No utility classes found\n"));
        assertFalse(css.contains("display"));
        assertEquals("/* twx: No classes found */\n", CssOutput.render("", true, TIME));
        assertEquals("/* twx: No classes found */\n", CssOutput.render(null, true, TIME));
    }

    @Test
    void testRender_Minified() {
        String css = CssOutput.render(BUNDLE, true, TIME);

        assertEquals("/* Generated by twx v" + Manifest.EXTRACTOR_VERSION + " at 2024-01-02 03:04:05 UTC */\n"
                + ".flex{display:flex}.p-4{padding:1rem}", css);
    }

    @Test
    void testMinify_StripsCommentsKeepsStrings() {
        String css = "/* banner */\n.a > .b {\n  /* inner */\n  content: \"a  ;  b\";\n  margin: 0 auto;\n}\n";

        assertEquals("/* banner */\n.a>.b{content:\"a  ;  b\";margin:0 auto}", CssOutput.minify(css));
    }

    @Test
    void testMinify_KeepsEscapes() {
        String css = ".md\\:flex {\n  display: flex;\n}\n";

        assertEquals(".md\\:flex{display:flex}", CssOutput.minify(css));
    }

    @Test
    void testMinify_SelectorLists() {
        assertEquals("a,b{color:red}", CssOutput.minify("a ,\n b {\n  color : red ;\n}"));
    }
}
