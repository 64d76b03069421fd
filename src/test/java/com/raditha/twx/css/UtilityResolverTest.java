package com.raditha.twx.css;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UtilityResolverTest {

    private final UtilityResolver resolver = new UtilityResolver(Theme.defaults());

    private List<Declaration> declarations(String base, boolean negative) {
        UtilityResolver.Resolved resolved = resolver.resolve(base, negative);
        assertNotNull(resolved, base);
        return resolved.declarations();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "p-4          | padding          | 1rem",
            "p-px         | padding          | 1px",
            "mt-0.5       | margin-top       | 0.125rem",
            "w-1/2        | width            | 50%",
            "w-1/3        | width            | 33.333333%",
            "w-[200px]    | width            | 200px",
            "bg-blue-500  | background-color | #3b82f6",
            "bg-[#ff0000] | background-color | #ff0000",
            "hidden       | display          | none",
            "flex         | display          | flex",
            "items-center | align-items      | center"
    })
    void testSingleDeclaration(String base, String property, String value) {
        assertEquals(List.of(new Declaration(property, value)), declarations(base, false));
    }

    @Test
    void testMultipleProperties() {
        assertEquals(List.of(new Declaration("margin-left", "auto"), new Declaration("margin-right", "auto")),
                declarations("mx-auto", false));
        assertEquals(3, declarations("truncate", false).size());
    }

    @Test
    void testNegative() {
        assertEquals(List.of(new Declaration("margin-top", "-1rem")), declarations("mt-4", true));
        assertEquals(List.of(new Declaration("margin-top", "calc(10px * -1)")), declarations("mt-[10px]", true));
        // zero stays zero
        assertEquals(List.of(new Declaration("margin", "0px")), declarations("m-0", true));
        assertNull(resolver.resolve("p-4", true));
        assertNull(resolver.resolve("mx-auto", true));
        assertNull(resolver.resolve("flex", true));
    }

    @Test
    void testColorOpacity() {
        assertEquals(List.of(new Declaration("background-color", "rgb(59 130 246 / 0.5)")),
                declarations("bg-blue-500/50", false));
        assertNull(resolver.resolve("bg-blue-500/150", false));
    }

    @Test
    void testArbitraryProperty() {
        assertEquals(List.of(new Declaration("mask-type", "luminance")), declarations("[mask-type:luminance]", false));
        assertEquals(List.of(new Declaration("grid-area", "1 / 2")), declarations("[grid-area:1_/_2]", false));
        assertNull(resolver.resolve("[color:red;x:y]", false));
        assertNull(resolver.resolve("[:red]", false));
    }

    @Test
    void testSelectorSuffix() {
        UtilityResolver.Resolved resolved = resolver.resolve("space-x-4", false);

        assertEquals(List.of(new Declaration("margin-left", "1rem")), resolved.declarations());
        assertEquals(" > :not([hidden]) ~ :not([hidden])", resolved.selectorSuffix());
    }

    @ParameterizedTest
    @ValueSource(strings = {"card", "bogus-thing", "p-13", "p-[#fff]", "w-[a{b}]", "bg-notacolor-500"})
    void testUnknown(String base) {
        assertNull(resolver.resolve(base, false));
    }

    @Test
    void testExtendedTheme() {
        Theme theme = Theme.defaults().extend(Map.of("brand", "#123456"), Map.of("18", "4.5rem"),
                Map.of("display", List.of("Inter Var", "sans-serif")));
        UtilityResolver extended = new UtilityResolver(theme);

        assertEquals(List.of(new Declaration("background-color", "#123456")),
                extended.resolve("bg-brand", false).declarations());
        assertEquals(List.of(new Declaration("padding", "4.5rem")), extended.resolve("p-18", false).declarations());
        assertEquals("\"Inter Var\", sans-serif", theme.fontFamily().get("display"));
        assertNull(resolver.resolve("bg-brand", false));
    }
}
