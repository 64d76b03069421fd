package com.raditha.twx.css;

import com.raditha.twx.exceptions.BundleException;
import com.raditha.twx.exceptions.ClassifyException;
import com.raditha.twx.obfuscation.ObfuscationMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UtilityClassCompilerTest {

    private final UtilityClassCompiler compiler = new UtilityClassCompiler();
    private final BundleOptions noReset = new BundleOptions(true, Map.of());

    @Test
    void testIsUtility() {
        assertTrue(compiler.isUtility("flex"));
        assertTrue(compiler.isUtility("p-4"));
        assertTrue(compiler.isUtility("-mt-2"));
        assertTrue(compiler.isUtility("hover:bg-blue-500"));
        assertTrue(compiler.isUtility("md:w-1/2"));
        assertTrue(compiler.isUtility("bg-white/50"));
        assertTrue(compiler.isUtility("w-[calc(100%_-_2rem)]"));
        assertTrue(compiler.isUtility("[mask-type:luminance]"));

        assertFalse(compiler.isUtility("card"));
        assertFalse(compiler.isUtility("p-"));
        assertFalse(compiler.isUtility("-p-4")); // padding is not negatable
        assertFalse(compiler.isUtility("unknown:flex"));
        assertFalse(compiler.isUtility("w-[oops"));
    }

    @Test
    void testClassify_PassThrough() throws ClassifyException {
        assertEquals("card flex p-4", compiler.classify("  card  flex\tp-4 ", false));

        ObfuscationMapper mapper = new ObfuscationMapper();
        assertEquals("card " + mapper.alias("flex"), compiler.classify("card flex", true));
    }

    @Test
    void testClassify_StrictRejectsUnknown() {
        UtilityClassCompiler strict = compiler.withMode(UtilityClassCompiler.Mode.STRICT);
        assertEquals(UtilityClassCompiler.Mode.STRICT, strict.getMode());

        ClassifyException ex = assertThrows(ClassifyException.class, () -> strict.classify("flex card", false));
        assertTrue(ex.getMessage().contains("card"));
    }

    @Test
    void testWithMode_SameModeReturnsSameInstance() {
        assertSame(compiler, compiler.withMode(UtilityClassCompiler.Mode.PASS_THROUGH));
    }

    @Test
    void testBundle_Declarations() throws BundleException {
        String css = compiler.bundle(List.of("p-4", "flex", "bg-blue-500"), noReset);

        assertTrue(css.contains(".p-4 {\n  padding: 1rem;\n}"), css);
        assertTrue(css.contains(".flex {\n  display: flex;\n}"), css);
        assertTrue(css.contains(".bg-blue-500 {\n  background-color: #3b82f6;\n}"), css);
    }

    @Test
    void testBundle_UnknownClassesIgnored() throws BundleException {
        assertEquals("", compiler.bundle(List.of("card", "header"), noReset));
    }

    @Test
    void testBundle_PreflightFirst() throws BundleException {
        String css = compiler.bundle(List.of("flex"), BundleOptions.defaults());

        assertTrue(css.startsWith(Preflight.CSS));
        assertFalse(compiler.bundle(List.of("flex"), noReset).contains("box-sizing"));
    }

    @Test
    void testBundle_Ordering() throws BundleException {
        String css = compiler.bundle(List.of("md:flex", "hover:underline", "p-4", "sm:p-2", "block"), noReset);

        int block = css.indexOf(".block {");
        int padding = css.indexOf(".p-4 {");
        int hover = css.indexOf(".hover\\:underline:hover {");
        int small = css.indexOf("@media (min-width: 640px)");
        int medium = css.indexOf("@media (min-width: 768px)");

        assertTrue(block >= 0 && padding >= 0 && hover >= 0 && small >= 0 && medium >= 0, css);
        assertTrue(block < padding, "plain rules sort by name");
        assertTrue(padding < hover, "state variants follow plain rules");
        assertTrue(hover < small, "media buckets come last");
        assertTrue(small < medium, "breakpoints in ascending order");
        assertTrue(css.contains("  .sm\\:p-2 {\n    padding: 0.5rem;\n  }"), css);
    }

    @Test
    void testBundle_OrderDoesNotDependOnInput() throws BundleException {
        String forward = compiler.bundle(List.of("flex", "p-4", "mt-2"), noReset);
        String backward = compiler.bundle(List.of("mt-2", "p-4", "flex"), noReset);

        assertEquals(forward, backward);
    }

    @Test
    void testBundle_ImportantAndNegative() throws BundleException {
        String css = compiler.bundle(List.of("!p-4", "-mt-2"), noReset);

        assertTrue(css.contains("padding: 1rem !important;"), css);
        assertTrue(css.contains("margin-top: -0.5rem;"), css);
    }

    @Test
    void testBundle_SelectorAliases() throws BundleException {
        String css = compiler.bundle(List.of("flex"), new BundleOptions(true, Map.of("flex", "twAb3")));

        assertTrue(css.contains(".twAb3 {\n  display: flex;\n}"), css);
        assertFalse(css.contains(".flex"));
    }

    @Test
    void testBundle_InvalidAlias() {
        BundleOptions options = new BundleOptions(true, Map.of("flex", "1bad"));
        assertThrows(BundleException.class, () -> compiler.bundle(List.of("flex"), options));
    }

    @Test
    void testEscape() {
        assertEquals("md\\:flex", UtilityClassCompiler.escape("md:flex"));
        assertEquals("w-1\\/2", UtilityClassCompiler.escape("w-1/2"));
        assertEquals("\\32 xl", UtilityClassCompiler.escape("2xl"));
        assertEquals("w-\\[10px\\]", UtilityClassCompiler.escape("w-[10px]"));
    }

    @Test
    void testThemeExtension() throws BundleException {
        Theme theme = Theme.defaults().extend(Map.of("brand", "#123456"), Map.of("128", "32rem"),
                Map.of("display", List.of("Inter Var", "sans-serif")));
        UtilityClassCompiler themed = new UtilityClassCompiler(theme, new ObfuscationMapper(),
                UtilityClassCompiler.Mode.PASS_THROUGH);

        assertTrue(themed.isUtility("bg-brand"));
        assertTrue(themed.isUtility("w-128"));
        assertFalse(compiler.isUtility("bg-brand"));

        String css = themed.bundle(List.of("text-brand", "font-display"), noReset);
        assertTrue(css.contains("color: #123456;"), css);
        assertTrue(css.contains("\"Inter Var\", sans-serif"), css);
    }
}
