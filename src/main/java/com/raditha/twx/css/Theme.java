package com.raditha.twx.css;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Design tokens the utility resolver draws values from.
 *
 * @param colors     color name ({@code blue-500}, {@code brand}) to CSS color
 * @param spacing    spacing key ({@code 4}, {@code px}, {@code 0.5}) to length
 * @param fontFamily family key ({@code sans}) to font stack
 */
public record Theme(Map<String, String> colors, Map<String, String> spacing, Map<String, String> fontFamily) {

    private static final String[] SPACING_KEYS = {
            "0.5", "1", "1.5", "2", "2.5", "3", "3.5", "4", "5", "6", "7", "8", "9", "10", "11", "12", "14", "16",
            "20", "24", "28", "32", "36", "40", "44", "48", "52", "56", "60", "64", "72", "80", "96"};

    public Theme {
        colors = Collections.unmodifiableMap(new LinkedHashMap<>(colors));
        spacing = Collections.unmodifiableMap(new LinkedHashMap<>(spacing));
        fontFamily = Collections.unmodifiableMap(new LinkedHashMap<>(fontFamily));
    }

    public static Theme defaults() {
        Map<String, String> spacing = new LinkedHashMap<>();
        spacing.put("0", "0px");
        spacing.put("px", "1px");
        for (String key : SPACING_KEYS) {
            BigDecimal rem = new BigDecimal(key).divide(BigDecimal.valueOf(4));
            spacing.put(key, rem.stripTrailingZeros().toPlainString() + "rem");
        }

        Map<String, String> fonts = new LinkedHashMap<>();
        fonts.put("sans", "ui-sans-serif, system-ui, sans-serif, \"Apple Color Emoji\", \"Segoe UI Emoji\"");
        fonts.put("serif", "ui-serif, Georgia, Cambria, \"Times New Roman\", Times, serif");
        fonts.put("mono", "ui-monospace, SFMono-Regular, Menlo, Monaco, Consolas, monospace");

        return new Theme(Palette.DEFAULT, spacing, fonts);
    }

    /**
     * A copy with extra or overriding entries. Font families are given as
     * lists and joined into a stack; names containing spaces are quoted.
     */
    public Theme extend(Map<String, String> extraColors, Map<String, String> extraSpacing,
            Map<String, List<String>> extraFonts) {
        Map<String, String> mergedColors = new LinkedHashMap<>(colors);
        if (extraColors != null) {
            mergedColors.putAll(extraColors);
        }
        Map<String, String> mergedSpacing = new LinkedHashMap<>(spacing);
        if (extraSpacing != null) {
            mergedSpacing.putAll(extraSpacing);
        }
        Map<String, String> mergedFonts = new LinkedHashMap<>(fontFamily);
        if (extraFonts != null) {
            extraFonts.forEach((name, stack) -> mergedFonts.put(name, fontStack(stack)));
        }
        return new Theme(mergedColors, mergedSpacing, mergedFonts);
    }

    private static String fontStack(List<String> families) {
        return String.join(", ", families.stream()
                .map(f -> f.contains(" ") && !f.startsWith("\"") ? "\"" + f + "\"" : f)
                .toList());
    }
}
