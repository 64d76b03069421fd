package com.raditha.twx.css;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the base of a utility class (variants and modifiers already removed)
 * to CSS declarations. Keyword utilities come from a fixed table; value
 * utilities ({@code p-4}, {@code bg-red-500/50}, {@code w-[200px]}) are
 * resolved by prefix families against the {@link Theme}.
 */
final class UtilityResolver {

    /**
     * @param declarations   declarations of the rule
     * @param selectorSuffix appended to the class selector, for utilities that
     *                       style children or pseudo elements
     */
    record Resolved(List<Declaration> declarations, String selectorSuffix) {
    }

    @FunctionalInterface
    private interface ValueResolver {
        List<Declaration> resolve(String value, boolean negative);
    }

    private record Family(String prefix, boolean negatable, String selectorSuffix, ValueResolver resolver) {

        String match(String base) {
            if (base.length() > prefix.length() + 1 && base.startsWith(prefix)
                    && base.charAt(prefix.length()) == '-') {
                return base.substring(prefix.length() + 1);
            }
            return null;
        }
    }

    private static final String SIBLINGS = " > :not([hidden]) ~ :not([hidden])";

    private static final Map<String, List<Declaration>> KEYWORDS = new HashMap<>();

    private static final Map<String, String> FONT_SIZES = Map.ofEntries(
            Map.entry("xs", "0.75rem/1rem"),
            Map.entry("sm", "0.875rem/1.25rem"),
            Map.entry("base", "1rem/1.5rem"),
            Map.entry("lg", "1.125rem/1.75rem"),
            Map.entry("xl", "1.25rem/1.75rem"),
            Map.entry("2xl", "1.5rem/2rem"),
            Map.entry("3xl", "1.875rem/2.25rem"),
            Map.entry("4xl", "2.25rem/2.5rem"),
            Map.entry("5xl", "3rem/1"),
            Map.entry("6xl", "3.75rem/1"),
            Map.entry("7xl", "4.5rem/1"),
            Map.entry("8xl", "6rem/1"),
            Map.entry("9xl", "8rem/1"));

    private static final Map<String, String> FONT_WEIGHTS = Map.of(
            "thin", "100", "extralight", "200", "light", "300", "normal", "400", "medium", "500",
            "semibold", "600", "bold", "700", "extrabold", "800", "black", "900");

    private static final Map<String, String> LINE_HEIGHTS = Map.of(
            "none", "1", "tight", "1.25", "snug", "1.375", "normal", "1.5", "relaxed", "1.625", "loose", "2");

    private static final Map<String, String> LETTER_SPACING = Map.of(
            "tighter", "-0.05em", "tight", "-0.025em", "normal", "0em", "wide", "0.025em", "wider", "0.05em",
            "widest", "0.1em");

    private static final Map<String, String> RADII = Map.of(
            "none", "0px", "sm", "0.125rem", "DEFAULT", "0.25rem", "md", "0.375rem", "lg", "0.5rem",
            "xl", "0.75rem", "2xl", "1rem", "3xl", "1.5rem", "full", "9999px");

    private static final Map<String, String> MAX_WIDTHS = Map.ofEntries(
            Map.entry("none", "none"), Map.entry("xs", "20rem"), Map.entry("sm", "24rem"),
            Map.entry("md", "28rem"), Map.entry("lg", "32rem"), Map.entry("xl", "36rem"),
            Map.entry("2xl", "42rem"), Map.entry("3xl", "48rem"), Map.entry("4xl", "56rem"),
            Map.entry("5xl", "64rem"), Map.entry("6xl", "72rem"), Map.entry("7xl", "80rem"),
            Map.entry("full", "100%"), Map.entry("min", "min-content"), Map.entry("max", "max-content"),
            Map.entry("fit", "fit-content"), Map.entry("prose", "65ch"), Map.entry("screen-sm", "640px"),
            Map.entry("screen-md", "768px"), Map.entry("screen-lg", "1024px"), Map.entry("screen-xl", "1280px"),
            Map.entry("screen-2xl", "1536px"));

    private static final Map<String, String> SIZE_KEYWORDS = Map.of(
            "auto", "auto", "full", "100%", "min", "min-content", "max", "max-content", "fit", "fit-content");

    private static final List<String> BORDER_WIDTHS = List.of("0", "2", "4", "8");
    private static final List<String> RING_WIDTHS = List.of("0", "1", "2", "4", "8");
    private static final List<String> TIMINGS = List.of("0", "75", "100", "150", "200", "300", "500", "700", "1000");
    private static final List<String> SCALES = List.of("0", "50", "75", "90", "95", "100", "105", "110", "125", "150");
    private static final List<String> ROTATIONS = List.of("0", "1", "2", "3", "6", "12", "45", "90", "180");

    static {
        keyword("block", "display", "block");
        keyword("inline-block", "display", "inline-block");
        keyword("inline", "display", "inline");
        keyword("flex", "display", "flex");
        keyword("inline-flex", "display", "inline-flex");
        keyword("grid", "display", "grid");
        keyword("inline-grid", "display", "inline-grid");
        keyword("table", "display", "table");
        keyword("table-row", "display", "table-row");
        keyword("table-cell", "display", "table-cell");
        keyword("contents", "display", "contents");
        keyword("flow-root", "display", "flow-root");
        keyword("list-item", "display", "list-item");
        keyword("hidden", "display", "none");

        for (String position : List.of("static", "fixed", "absolute", "relative", "sticky")) {
            keyword(position, "position", position);
        }
        keyword("visible", "visibility", "visible");
        keyword("invisible", "visibility", "hidden");
        keyword("collapse", "visibility", "collapse");
        keyword("isolate", "isolation", "isolate");

        keyword("flex-row", "flex-direction", "row");
        keyword("flex-row-reverse", "flex-direction", "row-reverse");
        keyword("flex-col", "flex-direction", "column");
        keyword("flex-col-reverse", "flex-direction", "column-reverse");
        keyword("flex-wrap", "flex-wrap", "wrap");
        keyword("flex-wrap-reverse", "flex-wrap", "wrap-reverse");
        keyword("flex-nowrap", "flex-wrap", "nowrap");
        keyword("flex-1", "flex", "1 1 0%");
        keyword("flex-auto", "flex", "1 1 auto");
        keyword("flex-initial", "flex", "0 1 auto");
        keyword("flex-none", "flex", "none");
        keyword("grow", "flex-grow", "1");
        keyword("grow-0", "flex-grow", "0");
        keyword("shrink", "flex-shrink", "1");
        keyword("shrink-0", "flex-shrink", "0");

        for (String align : List.of("start", "end", "center", "baseline", "stretch")) {
            String value = align.equals("start") || align.equals("end") ? "flex-" + align : align;
            keyword("items-" + align, "align-items", value);
            keyword("self-" + align, "align-self", value);
        }
        keyword("self-auto", "align-self", "auto");
        for (String justify : List.of("start", "end", "center", "between", "around", "evenly")) {
            String value = switch (justify) {
                case "start", "end" -> "flex-" + justify;
                case "between", "around", "evenly" -> "space-" + justify;
                default -> justify;
            };
            keyword("justify-" + justify, "justify-content", value);
            keyword("content-" + justify, "align-content", value);
        }
        keyword("justify-items-center", "justify-items", "center");
        keyword("justify-items-start", "justify-items", "start");
        keyword("justify-items-end", "justify-items", "end");
        keyword("justify-items-stretch", "justify-items", "stretch");
        keyword("place-items-center", "place-items", "center");
        keyword("place-content-center", "place-content", "center");

        keyword("text-left", "text-align", "left");
        keyword("text-center", "text-align", "center");
        keyword("text-right", "text-align", "right");
        keyword("text-justify", "text-align", "justify");
        keyword("text-start", "text-align", "start");
        keyword("text-end", "text-align", "end");
        keyword("uppercase", "text-transform", "uppercase");
        keyword("lowercase", "text-transform", "lowercase");
        keyword("capitalize", "text-transform", "capitalize");
        keyword("normal-case", "text-transform", "none");
        keyword("italic", "font-style", "italic");
        keyword("not-italic", "font-style", "normal");
        keyword("underline", "text-decoration-line", "underline");
        keyword("overline", "text-decoration-line", "overline");
        keyword("line-through", "text-decoration-line", "line-through");
        keyword("no-underline", "text-decoration-line", "none");
        keyword("antialiased", "-webkit-font-smoothing", "antialiased", "-moz-osx-font-smoothing", "grayscale");
        keyword("truncate", "overflow", "hidden", "text-overflow", "ellipsis", "white-space", "nowrap");
        keyword("text-ellipsis", "text-overflow", "ellipsis");
        keyword("text-clip", "text-overflow", "clip");
        keyword("break-normal", "overflow-wrap", "normal", "word-break", "normal");
        keyword("break-words", "overflow-wrap", "break-word");
        keyword("break-all", "word-break", "break-all");
        for (String ws : List.of("normal", "nowrap", "pre", "pre-line", "pre-wrap", "break-spaces")) {
            keyword("whitespace-" + ws, "white-space", ws);
        }
        keyword("align-top", "vertical-align", "top");
        keyword("align-middle", "vertical-align", "middle");
        keyword("align-bottom", "vertical-align", "bottom");
        keyword("align-baseline", "vertical-align", "baseline");
        keyword("list-none", "list-style-type", "none");
        keyword("list-disc", "list-style-type", "disc");
        keyword("list-decimal", "list-style-type", "decimal");
        keyword("list-inside", "list-style-position", "inside");
        keyword("list-outside", "list-style-position", "outside");
        keyword("line-clamp-none", "overflow", "visible", "display", "block", "-webkit-box-orient", "horizontal",
                "-webkit-line-clamp", "none");

        for (String overflow : List.of("auto", "hidden", "clip", "visible", "scroll")) {
            keyword("overflow-" + overflow, "overflow", overflow);
            keyword("overflow-x-" + overflow, "overflow-x", overflow);
            keyword("overflow-y-" + overflow, "overflow-y", overflow);
        }
        for (String fit : List.of("contain", "cover", "fill", "none", "scale-down")) {
            keyword("object-" + fit, "object-fit", fit);
        }
        keyword("object-center", "object-position", "center");
        keyword("object-top", "object-position", "top");
        keyword("object-bottom", "object-position", "bottom");
        keyword("box-border", "box-sizing", "border-box");
        keyword("box-content", "box-sizing", "content-box");
        keyword("aspect-auto", "aspect-ratio", "auto");
        keyword("aspect-square", "aspect-ratio", "1 / 1");
        keyword("aspect-video", "aspect-ratio", "16 / 9");
        keyword("sr-only", "position", "absolute", "width", "1px", "height", "1px", "padding", "0",
                "margin", "-1px", "overflow", "hidden", "clip", "rect(0, 0, 0, 0)", "white-space", "nowrap",
                "border-width", "0");
        keyword("not-sr-only", "position", "static", "width", "auto", "height", "auto", "padding", "0",
                "margin", "0", "overflow", "visible", "clip", "auto", "white-space", "normal");

        for (String cursor : List.of("auto", "default", "pointer", "wait", "text", "move", "help", "not-allowed",
                "none", "grab", "grabbing")) {
            keyword("cursor-" + cursor, "cursor", cursor);
        }
        keyword("select-none", "user-select", "none");
        keyword("select-text", "user-select", "text");
        keyword("select-all", "user-select", "all");
        keyword("select-auto", "user-select", "auto");
        keyword("pointer-events-none", "pointer-events", "none");
        keyword("pointer-events-auto", "pointer-events", "auto");
        keyword("resize", "resize", "both");
        keyword("resize-none", "resize", "none");
        keyword("resize-x", "resize", "horizontal");
        keyword("resize-y", "resize", "vertical");
        keyword("outline-none", "outline", "2px solid transparent", "outline-offset", "2px");
        keyword("outline", "outline-style", "solid");
        keyword("appearance-none", "appearance", "none");

        keyword("border", "border-width", "1px");
        for (String side : List.of("x", "y", "t", "r", "b", "l", "s", "e")) {
            List<String> properties = borderSideProperties(side, "-width");
            List<String> pairs = new ArrayList<>();
            for (String property : properties) {
                pairs.add(property);
                pairs.add("1px");
            }
            keyword("border-" + side, pairs.toArray(new String[0]));
        }
        for (String style : List.of("solid", "dashed", "dotted", "double", "hidden", "none")) {
            keyword("border-" + style, "border-style", style);
        }
        keyword("border-collapse", "border-collapse", "collapse");
        keyword("border-separate", "border-collapse", "separate");
        keyword("rounded", "border-radius", "0.25rem");
        for (String corner : List.of("t", "r", "b", "l", "tl", "tr", "br", "bl", "s", "e")) {
            List<String> pairs = new ArrayList<>();
            for (String property : radiusProperties(corner)) {
                pairs.add(property);
                pairs.add("0.25rem");
            }
            keyword("rounded-" + corner, pairs.toArray(new String[0]));
        }

        keyword("shadow-sm", "box-shadow", "0 1px 2px 0 rgb(0 0 0 / 0.05)");
        keyword("shadow", "box-shadow", "0 1px 3px 0 rgb(0 0 0 / 0.1), 0 1px 2px -1px rgb(0 0 0 / 0.1)");
        keyword("shadow-md", "box-shadow", "0 4px 6px -1px rgb(0 0 0 / 0.1), 0 2px 4px -2px rgb(0 0 0 / 0.1)");
        keyword("shadow-lg", "box-shadow", "0 10px 15px -3px rgb(0 0 0 / 0.1), 0 4px 6px -4px rgb(0 0 0 / 0.1)");
        keyword("shadow-xl", "box-shadow", "0 20px 25px -5px rgb(0 0 0 / 0.1), 0 8px 10px -6px rgb(0 0 0 / 0.1)");
        keyword("shadow-2xl", "box-shadow", "0 25px 50px -12px rgb(0 0 0 / 0.25)");
        keyword("shadow-inner", "box-shadow", "inset 0 2px 4px 0 rgb(0 0 0 / 0.05)");
        keyword("shadow-none", "box-shadow", "0 0 #0000");
        keyword("ring", "box-shadow", "0 0 0 3px var(--tw-ring-color, rgb(59 130 246 / 0.5))");
        keyword("ring-inset", "--tw-ring-inset", "inset");

        keyword("transition", "transition-property",
                "color, background-color, border-color, text-decoration-color, fill, stroke, opacity, box-shadow, transform, filter",
                "transition-timing-function", "cubic-bezier(0.4, 0, 0.2, 1)", "transition-duration", "150ms");
        keyword("transition-all", "transition-property", "all",
                "transition-timing-function", "cubic-bezier(0.4, 0, 0.2, 1)", "transition-duration", "150ms");
        keyword("transition-colors", "transition-property",
                "color, background-color, border-color, text-decoration-color, fill, stroke",
                "transition-timing-function", "cubic-bezier(0.4, 0, 0.2, 1)", "transition-duration", "150ms");
        keyword("transition-opacity", "transition-property", "opacity",
                "transition-timing-function", "cubic-bezier(0.4, 0, 0.2, 1)", "transition-duration", "150ms");
        keyword("transition-shadow", "transition-property", "box-shadow",
                "transition-timing-function", "cubic-bezier(0.4, 0, 0.2, 1)", "transition-duration", "150ms");
        keyword("transition-transform", "transition-property", "transform",
                "transition-timing-function", "cubic-bezier(0.4, 0, 0.2, 1)", "transition-duration", "150ms");
        keyword("transition-none", "transition-property", "none");
        keyword("ease-linear", "transition-timing-function", "linear");
        keyword("ease-in", "transition-timing-function", "cubic-bezier(0.4, 0, 1, 1)");
        keyword("ease-out", "transition-timing-function", "cubic-bezier(0, 0, 0.2, 1)");
        keyword("ease-in-out", "transition-timing-function", "cubic-bezier(0.4, 0, 0.2, 1)");
        keyword("animate-none", "animation", "none");
        keyword("animate-spin", "animation", "spin 1s linear infinite");
        keyword("animate-ping", "animation", "ping 1s cubic-bezier(0, 0, 0.2, 1) infinite");
        keyword("animate-pulse", "animation", "pulse 2s cubic-bezier(0.4, 0, 0.6, 1) infinite");
        keyword("animate-bounce", "animation", "bounce 1s infinite");

        keyword("container", "width", "100%");
        keyword("mx-auto", "margin-left", "auto", "margin-right", "auto");
        keyword("grid-flow-row", "grid-auto-flow", "row");
        keyword("grid-flow-col", "grid-auto-flow", "column");
        keyword("grid-flow-dense", "grid-auto-flow", "dense");
        keyword("col-auto", "grid-column", "auto");
        keyword("row-auto", "grid-row", "auto");
        keyword("col-span-full", "grid-column", "1 / -1");
        keyword("row-span-full", "grid-row", "1 / -1");
        keyword("grid-cols-none", "grid-template-columns", "none");
        keyword("grid-rows-none", "grid-template-rows", "none");
    }

    private final Theme theme;
    private final List<Family> families;

    UtilityResolver(Theme theme) {
        this.theme = theme;
        this.families = buildFamilies();
    }

    Resolved resolve(String base, boolean negative) {
        if (!negative) {
            List<Declaration> keyword = KEYWORDS.get(base);
            if (keyword != null) {
                return new Resolved(keyword, "");
            }
            Resolved property = arbitraryProperty(base);
            if (property != null) {
                return property;
            }
        }
        for (Family family : families) {
            if (negative && !family.negatable()) {
                continue;
            }
            String value = family.match(base);
            if (value == null) {
                continue;
            }
            List<Declaration> declarations = family.resolver().resolve(value, negative);
            if (declarations != null) {
                return new Resolved(declarations, family.selectorSuffix());
            }
        }
        return null;
    }

    private List<Family> buildFamilies() {
        List<Family> list = new ArrayList<>();

        spacingFamily(list, "p", false, Map.of(), "padding");
        spacingFamily(list, "px", false, Map.of(), "padding-left", "padding-right");
        spacingFamily(list, "py", false, Map.of(), "padding-top", "padding-bottom");
        spacingFamily(list, "pt", false, Map.of(), "padding-top");
        spacingFamily(list, "pr", false, Map.of(), "padding-right");
        spacingFamily(list, "pb", false, Map.of(), "padding-bottom");
        spacingFamily(list, "pl", false, Map.of(), "padding-left");
        spacingFamily(list, "ps", false, Map.of(), "padding-inline-start");
        spacingFamily(list, "pe", false, Map.of(), "padding-inline-end");

        Map<String, String> auto = Map.of("auto", "auto");
        spacingFamily(list, "m", true, auto, "margin");
        spacingFamily(list, "mx", true, auto, "margin-left", "margin-right");
        spacingFamily(list, "my", true, auto, "margin-top", "margin-bottom");
        spacingFamily(list, "mt", true, auto, "margin-top");
        spacingFamily(list, "mr", true, auto, "margin-right");
        spacingFamily(list, "mb", true, auto, "margin-bottom");
        spacingFamily(list, "ml", true, auto, "margin-left");
        spacingFamily(list, "ms", true, auto, "margin-inline-start");
        spacingFamily(list, "me", true, auto, "margin-inline-end");

        spacingFamily(list, "w", false, with(SIZE_KEYWORDS, "screen", "100vw"), "width");
        spacingFamily(list, "h", false, with(SIZE_KEYWORDS, "screen", "100vh"), "height");
        spacingFamily(list, "size", false, SIZE_KEYWORDS, "width", "height");
        spacingFamily(list, "min-w", false, SIZE_KEYWORDS, "min-width");
        spacingFamily(list, "min-h", false, with(SIZE_KEYWORDS, "screen", "100vh"), "min-height");
        spacingFamily(list, "max-h", false, with(with(SIZE_KEYWORDS, "screen", "100vh"), "none", "none"),
                "max-height");
        list.add(new Family("max-w", false, "", (value, negative) -> {
            String width = MAX_WIDTHS.get(value);
            if (width == null) {
                width = arbitrary(value);
            }
            return width == null ? null : declarations(width, "max-width");
        }));
        spacingFamily(list, "gap", false, Map.of(), "gap");
        spacingFamily(list, "gap-x", false, Map.of(), "column-gap");
        spacingFamily(list, "gap-y", false, Map.of(), "row-gap");
        Map<String, String> inset = Map.of("auto", "auto", "full", "100%");
        spacingFamily(list, "inset", true, inset, "top", "right", "bottom", "left");
        spacingFamily(list, "inset-x", true, inset, "left", "right");
        spacingFamily(list, "inset-y", true, inset, "top", "bottom");
        spacingFamily(list, "top", true, inset, "top");
        spacingFamily(list, "right", true, inset, "right");
        spacingFamily(list, "bottom", true, inset, "bottom");
        spacingFamily(list, "left", true, inset, "left");
        spacingFamily(list, "start", true, inset, "inset-inline-start");
        spacingFamily(list, "end", true, inset, "inset-inline-end");
        spacingFamily(list, "basis", false, SIZE_KEYWORDS, "flex-basis");
        spacingFamily(list, "indent", true, Map.of(), "text-indent");

        list.add(new Family("space-x", true, SIBLINGS, (value, negative) -> {
            String length = spacingValue(value, Map.of(), negative);
            return length == null ? null : declarations(length, "margin-left");
        }));
        list.add(new Family("space-y", true, SIBLINGS, (value, negative) -> {
            String length = spacingValue(value, Map.of(), negative);
            return length == null ? null : declarations(length, "margin-top");
        }));
        list.add(new Family("translate-x", true, "", (value, negative) -> {
            String length = spacingValue(value, Map.of("full", "100%"), negative);
            return length == null ? null : declarations("translateX(" + length + ")", "transform");
        }));
        list.add(new Family("translate-y", true, "", (value, negative) -> {
            String length = spacingValue(value, Map.of("full", "100%"), negative);
            return length == null ? null : declarations("translateY(" + length + ")", "transform");
        }));

        colorFamily(list, "bg", "", "background-color");
        colorFamily(list, "text", "", "color");
        colorFamily(list, "border", "", "border-color");
        colorFamily(list, "ring", "", "--tw-ring-color");
        colorFamily(list, "outline", "", "outline-color");
        colorFamily(list, "fill", "", "fill");
        colorFamily(list, "stroke", "", "stroke");
        colorFamily(list, "accent", "", "accent-color");
        colorFamily(list, "caret", "", "caret-color");
        colorFamily(list, "decoration", "", "text-decoration-color");
        colorFamily(list, "placeholder", "::placeholder", "color");

        list.add(new Family("text", false, "", (value, negative) -> {
            String size = FONT_SIZES.get(value);
            if (size != null) {
                int slash = size.indexOf('/');
                return List.of(new Declaration("font-size", size.substring(0, slash)),
                        new Declaration("line-height", size.substring(slash + 1)));
            }
            String length = arbitrary(value, "length");
            return length == null || isColor(length) ? null : declarations(length, "font-size");
        }));
        list.add(new Family("font", false, "", (value, negative) -> {
            String weight = FONT_WEIGHTS.get(value);
            if (weight != null) {
                return declarations(weight, "font-weight");
            }
            String family = theme.fontFamily().get(value);
            if (family != null) {
                return declarations(family, "font-family");
            }
            String arbitrary = arbitrary(value);
            return arbitrary == null ? null : declarations(arbitrary, "font-weight");
        }));
        list.add(new Family("leading", false, "", (value, negative) -> {
            String height = LINE_HEIGHTS.get(value);
            if (height == null) {
                height = spacingValue(value, Map.of(), false);
            }
            return height == null ? null : declarations(height, "line-height");
        }));
        list.add(new Family("tracking", true, "", (value, negative) -> {
            String spacing = LETTER_SPACING.get(value);
            if (spacing == null) {
                spacing = arbitrary(value);
            }
            if (spacing == null) {
                return null;
            }
            return declarations(negative ? negate(spacing) : spacing, "letter-spacing");
        }));
        list.add(new Family("line-clamp", false, "", (value, negative) -> {
            String lines = integerIn(value, 1, 10);
            if (lines == null) {
                lines = arbitrary(value);
            }
            if (lines == null) {
                return null;
            }
            return List.of(new Declaration("overflow", "hidden"), new Declaration("display", "-webkit-box"),
                    new Declaration("-webkit-box-orient", "vertical"),
                    new Declaration("-webkit-line-clamp", lines));
        }));

        list.add(new Family("border", false, "", (value, negative) -> borderWidth(value, "border-width")));
        for (String side : List.of("x", "y", "t", "r", "b", "l", "s", "e")) {
            List<String> properties = borderSideProperties(side, "-width");
            list.add(new Family("border-" + side, false, "",
                    (value, negative) -> borderWidth(value, properties.toArray(new String[0]))));
        }
        list.add(new Family("rounded", false, "", (value, negative) -> radius(value, "border-radius")));
        for (String corner : List.of("t", "r", "b", "l", "tl", "tr", "br", "bl", "s", "e")) {
            List<String> properties = radiusProperties(corner);
            list.add(new Family("rounded-" + corner, false, "",
                    (value, negative) -> radius(value, properties.toArray(new String[0]))));
        }
        list.add(new Family("ring", false, "", (value, negative) -> {
            String width = RING_WIDTHS.contains(value) ? value + "px" : arbitrary(value, "length");
            if (width == null || isColor(width)) {
                return null;
            }
            return declarations("0 0 0 " + width + " var(--tw-ring-color, rgb(59 130 246 / 0.5))", "box-shadow");
        }));
        list.add(new Family("outline", false, "", (value, negative) -> {
            String width = List.of("0", "1", "2", "4", "8").contains(value) ? value + "px" : null;
            return width == null ? null : declarations(width, "outline-width");
        }));

        list.add(new Family("opacity", false, "", (value, negative) -> {
            String percent = integerIn(value, 0, 100);
            if (percent != null) {
                return declarations(fraction(Integer.parseInt(percent), 100), "opacity");
            }
            String arbitrary = arbitrary(value);
            return arbitrary == null ? null : declarations(arbitrary, "opacity");
        }));
        list.add(new Family("z", true, "", (value, negative) -> {
            if (value.equals("auto")) {
                return negative ? null : declarations("auto", "z-index");
            }
            String index = List.of("0", "10", "20", "30", "40", "50").contains(value) ? value : arbitrary(value);
            if (index == null) {
                return null;
            }
            return declarations(negative ? negate(index) : index, "z-index");
        }));
        list.add(new Family("order", true, "", (value, negative) -> {
            String order = switch (value) {
                case "first" -> negative ? null : "-9999";
                case "last" -> negative ? null : "9999";
                case "none" -> negative ? null : "0";
                default -> {
                    String n = integerIn(value, 1, 12);
                    yield n == null ? arbitrary(value) : n;
                }
            };
            if (order == null) {
                return null;
            }
            return declarations(negative ? negate(order) : order, "order");
        }));

        list.add(new Family("grid-cols", false, "", (value, negative) -> gridTemplate(value, "grid-template-columns")));
        list.add(new Family("grid-rows", false, "", (value, negative) -> gridTemplate(value, "grid-template-rows")));
        list.add(new Family("col-span", false, "", (value, negative) -> span(value, "grid-column")));
        list.add(new Family("row-span", false, "", (value, negative) -> span(value, "grid-row")));
        list.add(new Family("col-start", false, "", (value, negative) -> line(value, "grid-column-start")));
        list.add(new Family("col-end", false, "", (value, negative) -> line(value, "grid-column-end")));
        list.add(new Family("row-start", false, "", (value, negative) -> line(value, "grid-row-start")));
        list.add(new Family("row-end", false, "", (value, negative) -> line(value, "grid-row-end")));
        list.add(new Family("aspect", false, "", (value, negative) -> {
            String ratio = arbitrary(value);
            return ratio == null ? null : declarations(ratio.replace("/", " / "), "aspect-ratio");
        }));

        list.add(new Family("duration", false, "", (value, negative) -> timing(value, "transition-duration")));
        list.add(new Family("delay", false, "", (value, negative) -> timing(value, "transition-delay")));
        list.add(new Family("scale", true, "", (value, negative) -> transform(value, negative, "scale")));
        list.add(new Family("scale-x", true, "", (value, negative) -> transform(value, negative, "scaleX")));
        list.add(new Family("scale-y", true, "", (value, negative) -> transform(value, negative, "scaleY")));
        list.add(new Family("rotate", true, "", (value, negative) -> transform(value, negative, "rotate")));
        list.add(new Family("skew-x", true, "", (value, negative) -> transform(value, negative, "skewX")));
        list.add(new Family("skew-y", true, "", (value, negative) -> transform(value, negative, "skewY")));

        // Longest prefix first so "border-t-2" is not read as border color "t-2".
        list.sort(Comparator.comparingInt((Family f) -> f.prefix().length()).reversed());
        return List.copyOf(list);
    }

    private void spacingFamily(List<Family> list, String prefix, boolean negatable, Map<String, String> extras,
            String... properties) {
        list.add(new Family(prefix, negatable, "", (value, negative) -> {
            String length = spacingValue(value, extras, negative);
            return length == null ? null : declarations(length, properties);
        }));
    }

    private void colorFamily(List<Family> list, String prefix, String selectorSuffix, String property) {
        list.add(new Family(prefix, false, selectorSuffix, (value, negative) -> {
            String color = colorValue(value);
            return color == null ? null : declarations(color, property);
        }));
    }

    /**
     * Spacing scale, keyword extras, fractions ({@code 1/2}) and arbitrary
     * values, optionally negated.
     */
    private String spacingValue(String value, Map<String, String> extras, boolean negative) {
        String length = theme.spacing().get(value);
        if (length != null) {
            return negative ? negate(length) : length;
        }
        String extra = extras.get(value);
        if (extra != null) {
            return negative ? null : extra;
        }
        String percent = fractionPercent(value);
        if (percent != null) {
            return negative ? negate(percent) : percent;
        }
        String arbitrary = arbitrary(value, "length");
        if (arbitrary == null || isColor(arbitrary)) {
            return null;
        }
        return negative ? "calc(" + arbitrary + " * -1)" : arbitrary;
    }

    /**
     * Theme color or arbitrary color, with an optional {@code /NN} opacity.
     */
    private String colorValue(String value) {
        String key = value;
        String alpha = null;
        int slash = value.lastIndexOf('/');
        if (slash > 0 && value.indexOf(']', slash) < 0) {
            key = value.substring(0, slash);
            String opacity = value.substring(slash + 1);
            String percent = integerIn(opacity, 0, 100);
            if (percent != null) {
                alpha = fraction(Integer.parseInt(percent), 100);
            } else {
                alpha = arbitrary(opacity);
            }
            if (alpha == null) {
                return null;
            }
        }
        String color = theme.colors().get(key);
        if (color == null) {
            String arbitrary = arbitrary(key, "color");
            if (arbitrary == null || !(isColor(arbitrary) || key.startsWith("[color:"))) {
                return null;
            }
            color = arbitrary;
        }
        return alpha == null ? color : withAlpha(color, alpha);
    }

    private static String withAlpha(String color, String alpha) {
        if (color.startsWith("#") && (color.length() == 7 || color.length() == 4)) {
            String hex = color.length() == 4
                    ? "" + color.charAt(1) + color.charAt(1) + color.charAt(2) + color.charAt(2) + color.charAt(3)
                            + color.charAt(3)
                    : color.substring(1);
            int rgb = Integer.parseInt(hex, 16);
            return "rgb(" + ((rgb >> 16) & 0xff) + " " + ((rgb >> 8) & 0xff) + " " + (rgb & 0xff) + " / " + alpha
                    + ")";
        }
        if (color.equals("transparent") || color.equals("inherit")) {
            return color;
        }
        return "color-mix(in srgb, " + color + " calc(" + alpha + " * 100%), transparent)";
    }

    private static boolean isColor(String value) {
        return value.startsWith("#") || value.startsWith("rgb") || value.startsWith("hsl")
                || value.startsWith("oklch") || value.startsWith("color(") || value.startsWith("var(--color");
    }

    private static List<Declaration> borderWidth(String value, String... properties) {
        String width = BORDER_WIDTHS.contains(value) ? value + "px" : arbitrary(value, "length");
        if (width == null || isColor(width)) {
            return null;
        }
        return declarations(width, properties);
    }

    private static List<Declaration> radius(String value, String... properties) {
        String radius = RADII.get(value);
        if (radius == null || value.equals("DEFAULT")) {
            radius = arbitrary(value);
        }
        return radius == null ? null : declarations(radius, properties);
    }

    private static List<Declaration> gridTemplate(String value, String property) {
        String count = integerIn(value, 1, 12);
        if (count != null) {
            return declarations("repeat(" + count + ", minmax(0, 1fr))", property);
        }
        if (value.equals("subgrid")) {
            return declarations("subgrid", property);
        }
        String arbitrary = arbitrary(value);
        return arbitrary == null ? null : declarations(arbitrary, property);
    }

    private static List<Declaration> span(String value, String property) {
        String count = integerIn(value, 1, 12);
        if (count == null) {
            return null;
        }
        return declarations("span " + count + " / span " + count, property);
    }

    private static List<Declaration> line(String value, String property) {
        if (value.equals("auto")) {
            return declarations("auto", property);
        }
        String line = integerIn(value, 1, 13);
        if (line == null) {
            line = arbitrary(value);
        }
        return line == null ? null : declarations(line, property);
    }

    private static List<Declaration> timing(String value, String property) {
        String ms = TIMINGS.contains(value) ? value + "ms" : arbitrary(value);
        return ms == null ? null : declarations(ms, property);
    }

    private static List<Declaration> transform(String value, boolean negative, String function) {
        String argument;
        if (function.startsWith("scale")) {
            argument = SCALES.contains(value) ? fraction(Integer.parseInt(value), 100) : arbitrary(value);
        } else {
            List<String> allowed = function.startsWith("skew") ? ROTATIONS.subList(0, 6) : ROTATIONS;
            argument = allowed.contains(value) ? value + "deg" : arbitrary(value);
        }
        if (argument == null) {
            return null;
        }
        if (negative) {
            argument = negate(argument);
        }
        return declarations(function + "(" + argument + ")", "transform");
    }

    /**
     * {@code [mask-type:luminance]} style utilities that name the property
     * themselves.
     */
    private static Resolved arbitraryProperty(String base) {
        if (!base.startsWith("[") || !base.endsWith("]")) {
            return null;
        }
        String inner = base.substring(1, base.length() - 1);
        int colon = inner.indexOf(':');
        if (colon <= 0 || colon == inner.length() - 1) {
            return null;
        }
        String property = inner.substring(0, colon);
        if (!property.matches("-{0,2}[a-zA-Z][a-zA-Z0-9-]*")) {
            return null;
        }
        String value = cleanArbitrary(inner.substring(colon + 1));
        return value == null ? null : new Resolved(List.of(new Declaration(property, value)), "");
    }

    private static String arbitrary(String value) {
        return arbitrary(value, null);
    }

    /**
     * Content of a bracketed value with underscores turned into spaces. A
     * leading type hint ({@code length:}, {@code color:}) is honoured when it
     * matches {@code hint} and rejected otherwise.
     */
    private static String arbitrary(String value, String hint) {
        if (value.length() < 3 || !value.startsWith("[") || !value.endsWith("]")) {
            return null;
        }
        String inner = value.substring(1, value.length() - 1);
        int colon = inner.indexOf(':');
        if (colon > 0 && inner.substring(0, colon).matches("[a-z-]+")) {
            String declared = inner.substring(0, colon);
            if (!declared.equals(hint)) {
                return null;
            }
            inner = inner.substring(colon + 1);
        }
        return cleanArbitrary(inner);
    }

    private static String cleanArbitrary(String inner) {
        if (inner.isEmpty() || inner.indexOf(';') >= 0 || inner.indexOf('{') >= 0 || inner.indexOf('}') >= 0) {
            return null;
        }
        return inner.replace('_', ' ');
    }

    private static String fractionPercent(String value) {
        int slash = value.indexOf('/');
        if (slash <= 0 || slash == value.length() - 1) {
            return null;
        }
        String numerator = integerIn(value.substring(0, slash), 1, 11);
        String denominator = integerIn(value.substring(slash + 1), 2, 12);
        if (numerator == null || denominator == null) {
            return null;
        }
        int n = Integer.parseInt(numerator);
        int d = Integer.parseInt(denominator);
        if (n >= d) {
            return null;
        }
        BigDecimal percent = BigDecimal.valueOf(n * 100L).divide(BigDecimal.valueOf(d), 6, RoundingMode.HALF_UP);
        return percent.stripTrailingZeros().toPlainString() + "%";
    }

    private static String fraction(int numerator, int denominator) {
        return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), 2, RoundingMode.HALF_UP)
                .stripTrailingZeros().toPlainString();
    }

    private static String integerIn(String value, int min, int max) {
        if (value.isEmpty() || value.length() > 4) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return null;
            }
        }
        int n = Integer.parseInt(value);
        if (n < min || n > max || (value.length() > 1 && value.charAt(0) == '0')) {
            return null;
        }
        return value;
    }

    private static String negate(String value) {
        if (value.equals("0") || value.equals("0px") || value.equals("0em") || value.equals("0deg")) {
            return value;
        }
        return value.startsWith("-") ? value.substring(1) : "-" + value;
    }

    private static List<Declaration> declarations(String value, String... properties) {
        List<Declaration> list = new ArrayList<>(properties.length);
        for (String property : properties) {
            list.add(new Declaration(property, value));
        }
        return List.copyOf(list);
    }

    private static Map<String, String> with(Map<String, String> base, String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(base);
        copy.put(key, value);
        return copy;
    }

    private static List<String> borderSideProperties(String side, String suffix) {
        List<String> names = switch (side) {
            case "x" -> List.of("border-left", "border-right");
            case "y" -> List.of("border-top", "border-bottom");
            case "t" -> List.of("border-top");
            case "r" -> List.of("border-right");
            case "b" -> List.of("border-bottom");
            case "l" -> List.of("border-left");
            case "s" -> List.of("border-inline-start");
            default -> List.of("border-inline-end");
        };
        return names.stream().map(n -> n + suffix).toList();
    }

    private static List<String> radiusProperties(String corner) {
        return switch (corner) {
            case "t" -> List.of("border-top-left-radius", "border-top-right-radius");
            case "r" -> List.of("border-top-right-radius", "border-bottom-right-radius");
            case "b" -> List.of("border-bottom-right-radius", "border-bottom-left-radius");
            case "l" -> List.of("border-top-left-radius", "border-bottom-left-radius");
            case "tl" -> List.of("border-top-left-radius");
            case "tr" -> List.of("border-top-right-radius");
            case "br" -> List.of("border-bottom-right-radius");
            case "bl" -> List.of("border-bottom-left-radius");
            case "s" -> List.of("border-start-start-radius", "border-end-start-radius");
            default -> List.of("border-start-end-radius", "border-end-end-radius");
        };
    }

    private static void keyword(String name, String... propertyValuePairs) {
        List<Declaration> list = new ArrayList<>();
        for (int i = 0; i < propertyValuePairs.length; i += 2) {
            list.add(new Declaration(propertyValuePairs[i], propertyValuePairs[i + 1]));
        }
        KEYWORDS.put(name, List.copyOf(list));
    }
}
