package com.raditha.twx.config;

import com.raditha.twx.css.Theme;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User additions to the built-in theme, from the {@code theme.extend} block
 * of the configuration file.
 * <p>
 * Nested color groups are flattened the way utility names spell them:
 * {@code {brand: {DEFAULT: "#00f", 500: "#00a"}}} becomes {@code brand} and
 * {@code brand-500}.
 *
 * @param colors     color name to CSS color
 * @param spacing    spacing key to CSS length
 * @param fontFamily family key to font stack
 */
public record ThemeExtension(Map<String, String> colors, Map<String, String> spacing,
        Map<String, List<String>> fontFamily) {

    public ThemeExtension {
        colors = colors == null ? Map.of() : Map.copyOf(colors);
        spacing = spacing == null ? Map.of() : Map.copyOf(spacing);
        fontFamily = fontFamily == null ? Map.of() : Map.copyOf(fontFamily);
    }

    public static ThemeExtension empty() {
        return new ThemeExtension(Map.of(), Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return colors.isEmpty() && spacing.isEmpty() && fontFamily.isEmpty();
    }

    public Theme applyTo(Theme base) {
        return isEmpty() ? base : base.extend(colors, spacing, fontFamily);
    }

    /**
     * Entries of {@code other} win over entries of this extension.
     */
    public ThemeExtension overriddenBy(ThemeExtension other) {
        Map<String, String> mergedColors = new LinkedHashMap<>(colors);
        mergedColors.putAll(other.colors);
        Map<String, String> mergedSpacing = new LinkedHashMap<>(spacing);
        mergedSpacing.putAll(other.spacing);
        Map<String, List<String>> mergedFonts = new LinkedHashMap<>(fontFamily);
        mergedFonts.putAll(other.fontFamily);
        return new ThemeExtension(mergedColors, mergedSpacing, mergedFonts);
    }

    /**
     * Flatten a possibly nested color map. {@code DEFAULT} maps to the group
     * name itself.
     *
     * @throws IllegalArgumentException if a leaf is neither a string nor a number
     */
    public static Map<String, String> flattenColors(Map<String, ?> nested) {
        Map<String, String> flat = new LinkedHashMap<>();
        flatten("", nested, flat);
        return flat;
    }

    private static void flatten(String prefix, Map<String, ?> nested, Map<String, String> flat) {
        for (Map.Entry<String, ?> entry : nested.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String name;
            if ("DEFAULT".equals(key)) {
                name = prefix;
            } else {
                name = prefix.isEmpty() ? key : prefix + "-" + key;
            }
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> group) {
                @SuppressWarnings("unchecked")
                Map<String, ?> child = (Map<String, ?>) group;
                flatten(name, child, flat);
            } else if (value instanceof String || value instanceof Number) {
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("DEFAULT color needs an enclosing group");
                }
                flat.put(name, value.toString());
            } else {
                throw new IllegalArgumentException("Color '" + name + "' must be a string or a group, got: " + value);
            }
        }
    }
}
