package com.raditha.twx.extraction;

import com.raditha.twx.model.ClassRecord;
import com.raditha.twx.model.ExtractedToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClassRegistryTest {

    @Test
    void testMerge_CountsAcrossFiles() {
        ClassRegistry merged = new ClassRegistry();
        merged.merge(fileRegistry("a.jsx"));
        merged.merge(fileRegistry("b.jsx"));

        assertEquals(2, merged.uniqueCount());
        ClassRecord flex = merged.get("flex");
        ClassRecord padding = merged.get("p-4");
        assertEquals(6, flex.getCount());
        assertEquals(2, padding.getCount());
        assertEquals(List.of("a.jsx", "b.jsx"), List.copyOf(flex.getFiles()));
        assertEquals(List.of("a.jsx", "b.jsx"), List.copyOf(padding.getFiles()));
        assertEquals(8, merged.totalOccurrences());
        assertEquals(Set.of("a.jsx", "b.jsx"), merged.filesWithClasses());
    }

    @Test
    void testAdd_SameLocationCountedOnce() {
        ClassRegistry registry = new ClassRegistry();
        ExtractedToken token = new ExtractedToken("flex", "a.jsx", 3, 14);

        assertTrue(registry.add(token));
        assertFalse(registry.add(new ExtractedToken("flex", "a.jsx", 3, 14)));
        assertEquals(1, registry.get("flex").getCount());
        assertEquals(List.of("a.jsx:3:14"), registry.get("flex").getLocations());
        // duplicates still count as reported occurrences
        assertEquals(2, registry.totalOccurrences());
    }

    @Test
    void testMerge_SkipsKnownOccurrences() {
        ClassRegistry first = new ClassRegistry();
        first.add(new ExtractedToken("flex", "a.jsx", 1, 0));
        ClassRegistry second = new ClassRegistry();
        second.add(new ExtractedToken("flex", "a.jsx", 1, 0));
        second.add(new ExtractedToken("flex", "a.jsx", 2, 0));

        first.merge(second);
        assertEquals(2, first.get("flex").getCount());
    }

    @Test
    void testFirstSeenOrder() {
        ClassRegistry registry = new ClassRegistry();
        registry.add(new ExtractedToken("p-4", "a.jsx", 1, 0));
        registry.add(new ExtractedToken("flex", "a.jsx", 1, 4));
        registry.add(new ExtractedToken("p-4", "b.jsx", 1, 0));

        assertEquals(List.of("p-4", "flex"), registry.classNames());
        assertTrue(registry.contains("flex"));
        assertFalse(registry.contains("grid"));
        assertNull(registry.get("grid"));
    }

    @Test
    void testApplyMapping() {
        ClassRegistry registry = new ClassRegistry();
        registry.add(new ExtractedToken("flex", "a.jsx", 1, 0));
        registry.add(new ExtractedToken("card", "a.jsx", 1, 5));

        registry.applyMapping(Map.of("flex", "twA"));
        assertEquals("twA", registry.get("flex").getObfuscated());
        assertNull(registry.get("card").getObfuscated());

        ClassRegistry target = new ClassRegistry();
        target.merge(registry);
        assertEquals("twA", target.get("flex").getObfuscated());
    }

    @Test
    void testEmpty() {
        ClassRegistry registry = new ClassRegistry();
        assertTrue(registry.isEmpty());
        assertEquals(0, registry.uniqueCount());
        assertTrue(registry.records().isEmpty());
    }

    @Test
    void testTokenValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractedToken("", "a.jsx", 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new ExtractedToken("flex", "a.jsx", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new ExtractedToken("flex", "a.jsx", 1, -1));
    }

    private static ClassRegistry fileRegistry(String file) {
        ClassRegistry registry = new ClassRegistry();
        registry.add(new ExtractedToken("flex", file, 1, 10));
        registry.add(new ExtractedToken("p-4", file, 1, 15));
        registry.add(new ExtractedToken("flex", file, 2, 10));
        registry.add(new ExtractedToken("flex", file, 3, 10));
        return registry;
    }
}
