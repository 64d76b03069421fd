package com.raditha.twx.obfuscation;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ObfuscationMapperTest {

    @Test
    void testAlias_StableAcrossInstances() {
        ObfuscationMapper first = new ObfuscationMapper();
        ObfuscationMapper second = new ObfuscationMapper(ObfuscationMapper.DEFAULT_SEED, "tw");

        assertEquals(first.alias("flex"), second.alias("flex"));
        assertEquals(first.alias("hover:bg-blue-500"), second.alias("hover:bg-blue-500"));
    }

    @Test
    void testAlias_ShapeAndPrefix() {
        ObfuscationMapper mapper = new ObfuscationMapper(42L, "x_");
        String alias = mapper.alias("p-4");

        assertTrue(alias.startsWith("x_"));
        assertTrue(alias.substring(2).matches("[A-Za-z0-9]+"), alias);
        assertTrue(alias.length() <= 2 + 11); // 64 bits need at most 11 base-62 digits
    }

    @Test
    void testAlias_RendersMixedCaseBase62() {
        ObfuscationMapper mapper = new ObfuscationMapper();
        List<String> names = IntStream.range(0, 200).mapToObj(i -> "p-" + i).toList();

        String digits = mapper.mapAll(names).values().stream()
                .map(alias -> alias.substring("tw".length()))
                .collect(Collectors.joining());

        assertTrue(digits.chars().anyMatch(Character::isLowerCase), digits);
        assertTrue(digits.chars().anyMatch(Character::isUpperCase), digits);
        assertTrue(digits.chars().anyMatch(Character::isDigit), digits);
    }

    @Test
    void testAlias_DependsOnSeedAndName() {
        ObfuscationMapper a = new ObfuscationMapper(1L, "tw");
        ObfuscationMapper b = new ObfuscationMapper(2L, "tw");

        assertNotEquals(a.alias("flex"), b.alias("flex"));
        assertNotEquals(a.alias("flex"), a.alias("block"));
    }

    @Test
    void testMapAll_KeepsInputOrder() {
        ObfuscationMapper mapper = new ObfuscationMapper();
        Map<String, String> mapping = mapper.mapAll(List.of("p-4", "flex", "mt-2"));

        assertEquals(List.of("p-4", "flex", "mt-2"), List.copyOf(mapping.keySet()));
        assertEquals(mapper.alias("flex"), mapping.get("flex"));
    }

    @Test
    void testInvalidPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new ObfuscationMapper(1L, "9tw"));
        assertThrows(IllegalArgumentException.class, () -> new ObfuscationMapper(1L, ""));
        assertThrows(IllegalArgumentException.class, () -> new ObfuscationMapper(1L, null));
        assertTrue(ObfuscationMapper.isValidPrefix("_a-b"));
        assertFalse(ObfuscationMapper.isValidPrefix("a b"));
    }

    @Property(tries = 200)
    void aliasIsDeterministicAndSelectorSafe(@ForAll long seed,
                                             @ForAll @AlphaChars @NumericChars @StringLength(min = 1, max = 30)
                                             String className) {
        ObfuscationMapper mapper = new ObfuscationMapper(seed, "tw");
        String alias = mapper.alias(className);

        assertEquals(alias, new ObfuscationMapper(seed, "tw").alias(className));
        assertTrue(alias.matches("tw[A-Za-z0-9]+"), alias);
    }
}
