package com.raditha.twx.css;

import com.raditha.twx.exceptions.BundleException;
import com.raditha.twx.exceptions.ClassifyException;
import com.raditha.twx.obfuscation.ObfuscationMapper;
import com.raditha.twx.util.ClassTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Table driven utility-class compiler.
 * <p>
 * In {@link Mode#PASS_THROUGH} unknown tokens come back unchanged from
 * {@link #classify}; in {@link Mode#STRICT} they raise
 * {@link ClassifyException}. Bundling ignores unknown tokens in both modes.
 * Rules are ordered plain utilities first, then state variants, then media
 * queries by breakpoint; names sort alphabetically inside each group so the
 * output does not depend on the order classes were found in.
 */
public class UtilityClassCompiler implements ClassCompiler {

    private static final Logger logger = LoggerFactory.getLogger(UtilityClassCompiler.class);

    private static final Pattern CSS_IDENTIFIER = Pattern.compile("-?[A-Za-z_][A-Za-z0-9_-]*");

    public enum Mode {
        PASS_THROUGH,
        STRICT
    }

    private record CompiledRule(String className, String selector, List<Declaration> declarations,
            String media, int mediaRank, boolean stateVariant) {
    }

    private final Theme theme;
    private final UtilityResolver resolver;
    private final ObfuscationMapper mapper;
    private final Mode mode;

    public UtilityClassCompiler() {
        this(Theme.defaults(), new ObfuscationMapper(), Mode.PASS_THROUGH);
    }

    public UtilityClassCompiler(Theme theme, ObfuscationMapper mapper, Mode mode) {
        this.theme = theme;
        this.resolver = new UtilityResolver(theme);
        this.mapper = mapper;
        this.mode = mode;
    }

    public UtilityClassCompiler withMode(Mode newMode) {
        return newMode == mode ? this : new UtilityClassCompiler(theme, mapper, newMode);
    }

    public Mode getMode() {
        return mode;
    }

    public Theme getTheme() {
        return theme;
    }

    @Override
    public String classify(String classes, boolean obfuscate) throws ClassifyException {
        List<String> out = new ArrayList<>();
        for (String token : ClassTokens.split(classes)) {
            if (isUtility(token)) {
                out.add(obfuscate ? mapper.alias(token) : token);
            } else if (mode == Mode.STRICT) {
                throw new ClassifyException(token);
            } else {
                out.add(token);
            }
        }
        return String.join(" ", out);
    }

    @Override
    public boolean isUtility(String token) {
        return compile(token, token) != null;
    }

    @Override
    public String bundle(Collection<String> classes, BundleOptions options) throws BundleException {
        List<CompiledRule> rules = new ArrayList<>();
        for (String className : new TreeSet<>(classes)) {
            String selectorName = options.selectorAliases().getOrDefault(className, className);
            if (!selectorName.equals(className) && !CSS_IDENTIFIER.matcher(selectorName).matches()) {
                throw new BundleException("Invalid selector alias '" + selectorName + "' for class " + className,
                        null);
            }
            CompiledRule rule = compile(className, selectorName);
            if (rule == null) {
                logger.debug("No CSS for {}", className);
                continue;
            }
            rules.add(rule);
        }

        StringBuilder css = new StringBuilder();
        if (!options.disableReset()) {
            css.append(Preflight.CSS);
        }
        for (CompiledRule rule : rules) {
            if (rule.media() == null && !rule.stateVariant()) {
                appendRule(css, rule, "");
            }
        }
        for (CompiledRule rule : rules) {
            if (rule.media() == null && rule.stateVariant()) {
                appendRule(css, rule, "");
            }
        }
        Map<String, List<CompiledRule>> buckets = new TreeMap<>();
        Map<String, Integer> ranks = new TreeMap<>();
        for (CompiledRule rule : rules) {
            if (rule.media() != null) {
                buckets.computeIfAbsent(rule.media(), k -> new ArrayList<>()).add(rule);
                ranks.merge(rule.media(), rule.mediaRank(), Math::min);
            }
        }
        List<String> mediaOrder = new ArrayList<>(buckets.keySet());
        mediaOrder.sort(Comparator.comparing((String m) -> ranks.get(m)).thenComparing(m -> m));
        for (String media : mediaOrder) {
            css.append("@media ").append(media).append(" {\n");
            List<CompiledRule> bucket = buckets.get(media);
            bucket.sort(Comparator.comparing(CompiledRule::stateVariant).thenComparing(CompiledRule::className));
            for (CompiledRule rule : bucket) {
                appendRule(css, rule, "  ");
            }
            css.append("}\n");
        }
        return css.toString();
    }

    private static void appendRule(StringBuilder css, CompiledRule rule, String indent) {
        css.append(indent).append(rule.selector()).append(" {\n");
        for (Declaration declaration : rule.declarations()) {
            css.append(indent).append("  ").append(declaration).append(";\n");
        }
        css.append(indent).append("}\n");
    }

    private CompiledRule compile(String className, String selectorName) {
        UtilityClass utility = UtilityClass.parse(className);
        if (utility == null) {
            return null;
        }
        UtilityResolver.Resolved resolved = resolver.resolve(utility.base(), utility.negative());
        if (resolved == null) {
            return null;
        }

        StringBuilder pseudo = new StringBuilder();
        String group = "";
        List<String> media = new ArrayList<>();
        int mediaRank = Integer.MAX_VALUE;
        boolean pseudoElement = false;
        for (String variant : utility.variants()) {
            if (!Variants.isKnown(variant)) {
                return null;
            }
            if (Variants.isMedia(variant)) {
                media.add(Variants.mediaCondition(variant));
                mediaRank = Math.min(mediaRank, Variants.mediaRank(variant));
            } else if (Variants.groupPrefix(variant) != null) {
                group = Variants.groupPrefix(variant) + " ";
            } else {
                pseudo.append(Variants.pseudo(variant));
                pseudoElement |= Variants.isPseudoElement(variant);
            }
        }

        List<Declaration> declarations = new ArrayList<>();
        if (pseudoElement) {
            declarations.add(new Declaration("content", "var(--tw-content)"));
        }
        for (Declaration declaration : resolved.declarations()) {
            declarations.add(utility.important() ? declaration.important() : declaration);
        }

        String selector = group + "." + escape(selectorName) + pseudo + resolved.selectorSuffix();
        String mediaQuery = null;
        if (!media.isEmpty()) {
            // "print" is a media type and has to come before the conditions
            media.sort(Comparator.comparing((String m) -> !m.equals("print")));
            mediaQuery = String.join(" and ", media);
        }
        boolean stateVariant = pseudo.length() > 0 || !group.isEmpty();
        return new CompiledRule(className, selector, List.copyOf(declarations), mediaQuery, mediaRank,
                stateVariant);
    }

    /**
     * Escape a class name for use in a selector.
     */
    static String escape(String className) {
        StringBuilder sb = new StringBuilder(className.length() + 8);
        for (int i = 0; i < className.length(); i++) {
            char c = className.charAt(i);
            boolean leadingDigit = Character.isDigit(c)
                    && (i == 0 || (i == 1 && className.charAt(0) == '-'));
            if (leadingDigit) {
                sb.append('\\').append(Integer.toHexString(c)).append(' ');
            } else if (c == '-' && i == 0 && className.length() == 1) {
                sb.append("\\-");
            } else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-'
                    || c == '_' || c >= 0x80) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        return sb.toString();
    }
}
