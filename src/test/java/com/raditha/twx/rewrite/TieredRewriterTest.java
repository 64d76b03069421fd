package com.raditha.twx.rewrite;

import com.raditha.twx.css.ClassCompiler;
import com.raditha.twx.css.UtilityClassCompiler;
import com.raditha.twx.exceptions.ClassifyException;
import com.raditha.twx.obfuscation.ObfuscationMapper;
import com.raditha.twx.util.ClassTokens;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TieredRewriterTest {

    private final ObfuscationMapper mapper = new ObfuscationMapper();
    // field initializer rather than @BeforeEach: jqwik properties skip Jupiter lifecycle methods
    private final TieredRewriter rewriter =
            new TieredRewriter(new UtilityClassCompiler().withMode(UtilityClassCompiler.Mode.STRICT));

    @Test
    void testRewrite_KeepsOuterWhitespace() {
        assertEquals("  flex p-4 ", rewriter.rewrite("  flex \n  p-4 ", false));
        assertEquals("   ", rewriter.rewrite("   ", true));
        assertEquals("", rewriter.rewrite("", true));
    }

    @Test
    void testRewrite_AllUtilitiesObfuscated() {
        assertEquals(mapper.alias("flex") + " " + mapper.alias("p-4"), rewriter.rewrite("flex p-4", true));
    }

    @Test
    void testRewrite_FirstTokenUnknown() {
        // "card" is kept and the rest goes through in one piece
        String result = rewriter.rewrite("card flex p-4", true);
        assertEquals("card " + mapper.alias("flex") + " " + mapper.alias("p-4"), result);
    }

    @Test
    void testRewrite_LastTokenUnknown() {
        String result = rewriter.rewrite("flex p-4 card", true);
        assertEquals(mapper.alias("flex") + " " + mapper.alias("p-4") + " card", result);
    }

    @Test
    void testRewrite_UnknownInTheMiddle() {
        String result = rewriter.rewrite("flex card p-4", true);
        assertEquals(mapper.alias("flex") + " card " + mapper.alias("p-4"), result);
    }

    @Test
    void testRewrite_NothingRecognised() {
        assertEquals("card header", rewriter.rewrite("card\theader", true));
    }

    @Test
    void testRewrite_CompilerChangesTokenCount() throws ClassifyException {
        ClassCompiler compiler = mock(ClassCompiler.class);
        when(compiler.classify(anyString(), anyBoolean())).thenReturn("merged");
        TieredRewriter tiered = new TieredRewriter(compiler);

        // the whole string comes back as one token and is discarded; the tail tier fits
        assertEquals("a merged", tiered.rewrite("a b", false));
    }

    @Test
    void testRewrite_CompilerRejectsEverything() throws ClassifyException {
        ClassCompiler compiler = mock(ClassCompiler.class);
        when(compiler.classify(anyString(), anyBoolean())).thenThrow(new ClassifyException("x"));
        TieredRewriter tiered = new TieredRewriter(compiler);

        assertEquals(" a b c ", tiered.rewrite(" a  b c ", true));
    }

    @Property(tries = 200)
    void tokenCountAndOuterWhitespaceArePreserved(@ForAll("classStrings") String classString) {
        String rewritten = rewriter.rewrite(classString, true);

        assertEquals(ClassTokens.count(classString), ClassTokens.count(rewritten));
        assertEquals(leading(classString), leading(rewritten));
        assertEquals(trailing(classString), trailing(rewritten));
    }

    @Provide
    Arbitrary<String> classStrings() {
        Arbitrary<String> token = Arbitraries.of("flex", "p-4", "card", "hover:bg-blue-500", "md:mt-2", "btn",
                "w-1/2", "text-[13px]", "is-active");
        Arbitrary<String> space = Arbitraries.of(" ", "  ", "\t", "\n", "\u00a0");
        return Combinators.combine(space.list().ofMaxSize(2), token.list().ofMaxSize(6), space.list().ofMaxSize(2))
                .as((lead, tokens, trail) -> String.join("", lead) + String.join(" ", tokens) + String.join("", trail));
    }

    private static String leading(String value) {
        if (ClassTokens.isBlank(value)) {
            return value;
        }
        int i = 0;
        while (ClassTokens.isWhitespace(value.charAt(i))) {
            i++;
        }
        return value.substring(0, i);
    }

    private static String trailing(String value) {
        if (ClassTokens.isBlank(value)) {
            return value;
        }
        int i = value.length();
        while (ClassTokens.isWhitespace(value.charAt(i - 1))) {
            i--;
        }
        return value.substring(i);
    }

    @Test
    void testRewrite_SingleUnknownToken() {
        assertEquals("card", rewriter.rewrite("card", true));
        assertEquals(List.of("card"), ClassTokens.split(rewriter.rewrite(" card ", false)));
    }
}
