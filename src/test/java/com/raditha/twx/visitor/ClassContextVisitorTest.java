package com.raditha.twx.visitor;

import com.raditha.twx.classify.ClassLikenessClassifier;
import com.raditha.twx.classify.VariableAliasTable;
import com.raditha.twx.css.UtilityClassCompiler;
import com.raditha.twx.exceptions.ParseException;
import com.raditha.twx.model.ExtractedToken;
import com.raditha.twx.model.SourceUnit;
import com.raditha.twx.obfuscation.ObfuscationMapper;
import com.raditha.twx.parser.JsParser;
import com.raditha.twx.parser.SyntaxTree;
import com.raditha.twx.rewrite.TieredRewriter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ClassContextVisitor.
 * Each test parses a small snippet and checks which classes were found.
 */
class ClassContextVisitorTest {

    private final JsParser parser = new JsParser();

    @Test
    void testJsxClassNameAttribute() throws ParseException {
        List<ExtractedToken> tokens = extract("App.jsx", "const a = <div className=\"flex p-4 card\" />;");

        assertEquals(List.of("flex", "p-4", "card"), values(tokens));
        ExtractedToken flex = tokens.get(0);
        assertEquals("App.jsx", flex.file());
        assertEquals(1, flex.line());
        assertEquals(26, flex.column());
        assertEquals(31, tokens.get(1).column());
    }

    @Test
    void testSingleBareTokenInClassAttribute() throws ParseException {
        // a plain string in class position is always a class list
        assertEquals(List.of("container"), values(extract("a.jsx", "<main class=\"container\"></main>;")));
    }

    @Test
    void testHelperCallArguments() throws ParseException {
        String code = """
                const c = clsx("px-2 py-1", isActive && "bg-blue-500", { "text-white font-bold": isActive });
                """;
        assertEquals(List.of("px-2", "py-1", "bg-blue-500", "text-white", "font-bold"), values(extract("a.js", code)));
    }

    @Test
    void testConditionalClassName() throws ParseException {
        String code = """
                export const Nav = ({ active, mode }) => (
                  <nav className={mode === "dark" ? "bg-gray-900 text-white" : active ? "bg-white" : "border-b"}>
                    <span className={active || "opacity-50"}>x</span>
                  </nav>
                );
                """;
        List<String> values = values(extract("Nav.jsx", code));

        assertEquals(List.of("bg-gray-900", "text-white", "bg-white", "border-b", "opacity-50"), values);
        assertFalse(values.contains("dark"), "strings in the test are not classes");
    }

    @Test
    void testOrdinaryStringsIgnored() throws ParseException {
        String code = """
                const greeting = "Hello world, friend";
                const url = "/api/users";
                const id = "user";
                fetch("https://example.com/data.json");
                const label = <p title="Click me!">Welcome</p>;
                """;
        assertTrue(extract("a.jsx", code).isEmpty());
    }

    @Test
    void testStrongEvidenceOutsideClassContext() throws ParseException {
        assertEquals(List.of("p-4", "bg-blue-500"), values(extract("a.js", "const styles = \"p-4 bg-blue-500\";")));
    }

    @Test
    void testClassishVariableName() throws ParseException {
        assertEquals(List.of("card-title"), values(extract("a.js", "const titleClass = \"card-title\";")));
        assertTrue(extract("a.js", "const title = \"card-title\";").isEmpty());
    }

    @Test
    void testVariableAliasing() throws ParseException {
        String code = """
                const base = clsx("flex items-center");
                const full = base + " card-elevated";
                const other = unknown + " card-elevated";
                """;
        List<ExtractedToken> tokens = extract("a.js", code);

        assertEquals(List.of("flex", "items-center", "card-elevated"), values(tokens));
        assertEquals(2, tokens.get(2).line());
    }

    @Test
    void testClassNameObjectProperty() throws ParseException {
        String code = "const props = { className: \"btn\", id: \"submit-button\" };";
        assertEquals(List.of("btn"), values(extract("a.js", code)));
    }

    @Test
    void testClassNameAssignment() throws ParseException {
        assertEquals(List.of("modal", "is-open"), values(extract("a.js", "el.className = \"modal is-open\";")));
    }

    @Test
    void testClassListCalls() throws ParseException {
        String code = "el.classList.add(\"menu-hidden\", \"is-open\");\nel.classList.toggle(\"dark-mode\");";
        assertEquals(List.of("menu-hidden", "is-open", "dark-mode"), values(extract("a.js", code)));
    }

    @Test
    void testTemplateBoundaryFragmentsExcluded() throws ParseException {
        String code = "const a = <div className={`flex items-center ${gap} bg-${color}-500 p-4`} />;";
        List<String> values = values(extract("a.jsx", code));

        assertEquals(List.of("flex", "items-center", "p-4"), values);
    }

    @Test
    void testFunctionsStartFreshContext() throws ParseException {
        String code = """
                const buttonClasses = cn(() => { const msg = "one two"; return msg; });
                """;
        assertTrue(extract("a.js", code).isEmpty());
    }

    @Test
    void testRewriteMode() throws ParseException {
        ObfuscationMapper mapper = new ObfuscationMapper();
        TieredRewriter rewriter = new TieredRewriter(
                new UtilityClassCompiler().withMode(UtilityClassCompiler.Mode.STRICT));
        SyntaxTree tree = parser.parse(SourceUnit.of("a.jsx", "const a = <div className=\"flex card p-4\" />;"));
        ClassContextVisitor visitor = new ClassContextVisitor(tree, new ClassLikenessClassifier(),
                new VariableAliasTable(), rewriter, true);
        visitor.run();

        assertEquals(1, visitor.getTransformedCount());
        assertEquals(List.of("flex", "card", "p-4"), values(visitor.getTokens()));
        String expected = "const a = <div className=\"" + mapper.alias("flex") + " card " + mapper.alias("p-4")
                + "\" />;";
        assertEquals(expected, tree.serialize());
    }

    @Test
    void testRewriteMode_NothingToChange() throws ParseException {
        TieredRewriter rewriter = new TieredRewriter(
                new UtilityClassCompiler().withMode(UtilityClassCompiler.Mode.STRICT));
        String code = "const a = <div className=\"card header\" />;";
        SyntaxTree tree = parser.parse(SourceUnit.of("a.jsx", code));
        ClassContextVisitor visitor = new ClassContextVisitor(tree, new ClassLikenessClassifier(),
                new VariableAliasTable(), rewriter, true);
        visitor.run();

        assertEquals(0, visitor.getTransformedCount());
        assertEquals(code, tree.serialize());
    }

    private List<ExtractedToken> extract(String name, String code) throws ParseException {
        SyntaxTree tree = parser.parse(SourceUnit.of(name, code));
        ClassContextVisitor visitor = new ClassContextVisitor(tree, new ClassLikenessClassifier(),
                new VariableAliasTable(), null, false);
        visitor.run();
        return visitor.getTokens();
    }

    private static List<String> values(List<ExtractedToken> tokens) {
        return tokens.stream().map(ExtractedToken::value).toList();
    }
}
