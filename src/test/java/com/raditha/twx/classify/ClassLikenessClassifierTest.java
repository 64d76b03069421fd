package com.raditha.twx.classify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ClassLikenessClassifierTest {

    private final ClassLikenessClassifier classifier = new ClassLikenessClassifier();

    @Test
    void testGeneralContext_NeedsStrongEvidence() {
        assertTrue(classifier.isClassLike("p-4 bg-blue-500", false));
        assertTrue(classifier.isClassLike("hover:underline", false));
        assertTrue(classifier.isClassLike("card header", false)); // multi-token, one token longer than 3
        assertFalse(classifier.isClassLike("mycustomclass", false));
        assertFalse(classifier.isClassLike("card-title", false)); // marker but no utility prefix, single token
        assertFalse(classifier.isClassLike("a b", false));
    }

    @Test
    void testClassContext_MarkerOrWhitespace() {
        assertTrue(classifier.isClassLike("simple words here", true));
        assertTrue(classifier.isClassLike("card-title", true));
        assertTrue(classifier.isClassLike("w-[10px]", true));
        assertFalse(classifier.isClassLike("mycustomclass", true));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://example.com", "http://x.y", "/api/users", "./local", "../up",
            "Hello, world", "Really?", "Stop!", "end of sentence.", "a\\b", "x", "",
            "<div>", "key=value"
    })
    void testRejectedEverywhere(String value) {
        assertFalse(classifier.isClassLike(value, true), value);
        assertFalse(classifier.isClassLike(value, false), value);
    }

    @Test
    void testNumericFractionsAreNotProse() {
        assertTrue(classifier.isClassLike("p-1.5 mt-0.5", false));
        assertTrue(classifier.isClassLike("w-2.5", true));
    }

    @Test
    void testNull() {
        assertFalse(classifier.isClassLike(null, true));
    }

    @Test
    void testStackOverload() {
        ContextStack stack = new ContextStack();
        assertFalse(classifier.isClassLike("card-title", stack));
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.WhitelistedCall("clsx"))) {
            assertTrue(classifier.isClassLike("card-title", stack));
        }
    }

    @Test
    void testHasUtilityPrefix() {
        assertTrue(ClassLikenessClassifier.hasUtilityPrefix("bg-red-500"));
        assertTrue(ClassLikenessClassifier.hasUtilityPrefix("-mt-2"));
        assertTrue(ClassLikenessClassifier.hasUtilityPrefix("!p-4"));
        assertTrue(ClassLikenessClassifier.hasUtilityPrefix("md:flex"));
        assertFalse(ClassLikenessClassifier.hasUtilityPrefix("card-title"));
    }
}
