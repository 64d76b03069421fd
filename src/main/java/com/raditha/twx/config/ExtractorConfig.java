package com.raditha.twx.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Complete configuration for an extraction or transform run.
 *
 * @param content      include globs, absolute or relative to the security root
 * @param exclude      globs removed from the discovered set
 * @param helpers      call names whose arguments hold class lists
 * @param theme        theme additions
 * @param obfuscation  alias settings
 * @param security     path and size limits
 * @param jobs         worker threads, at least 1
 * @param onParseError what to do when a file does not parse
 * @param minify       minify the generated CSS
 * @param preflight    prepend the reset stylesheet
 * @param buildMode    free-form label copied into the manifest, may be null
 */
public record ExtractorConfig(
        List<String> content,
        List<String> exclude,
        List<String> helpers,
        ThemeExtension theme,
        ObfuscationSettings obfuscation,
        SecurityPolicy security,
        int jobs,
        ParseErrorPolicy onParseError,
        boolean minify,
        boolean preflight,
        String buildMode) {

    public static final List<String> DEFAULT_CONTENT = List.of(
            "src/**/*.res.mjs",
            "src/**/*.js",
            "src/**/*.jsx",
            "src/**/*.ts",
            "src/**/*.tsx");

    public static final List<String> DEFAULT_EXCLUDE = List.of(
            "**/node_modules/**",
            "**/.git/**");

    public ExtractorConfig {
        content = content == null ? List.of() : List.copyOf(content);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
        helpers = helpers == null ? List.of() : List.copyOf(helpers);
        if (theme == null) {
            theme = ThemeExtension.empty();
        }
        if (obfuscation == null) {
            obfuscation = ObfuscationSettings.disabled();
        }
        if (security == null) {
            security = SecurityPolicy.defaults();
        }
        if (jobs < 1) {
            throw new IllegalArgumentException("jobs must be >= 1, got: " + jobs);
        }
        if (onParseError == null) {
            onParseError = ParseErrorPolicy.FAIL;
        }
    }

    public static ExtractorConfig defaults() {
        return new ExtractorConfig(
                DEFAULT_CONTENT,
                DEFAULT_EXCLUDE,
                List.of(),
                ThemeExtension.empty(),
                ObfuscationSettings.disabled(),
                SecurityPolicy.defaults(),
                defaultJobs(),
                ParseErrorPolicy.FAIL,
                false,
                true,
                null);
    }

    public static int defaultJobs() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Combine two configurations: content and exclude globs are united, theme
     * entries of {@code other} override, and the obfuscation block of
     * {@code other} replaces this one when it is enabled. Everything else is
     * taken from {@code other}.
     */
    public ExtractorConfig merge(ExtractorConfig other) {
        LinkedHashSet<String> mergedContent = new LinkedHashSet<>(content);
        mergedContent.addAll(other.content);
        LinkedHashSet<String> mergedExclude = new LinkedHashSet<>(exclude);
        mergedExclude.addAll(other.exclude);
        LinkedHashSet<String> mergedHelpers = new LinkedHashSet<>(helpers);
        mergedHelpers.addAll(other.helpers);
        return new ExtractorConfig(
                new ArrayList<>(mergedContent),
                new ArrayList<>(mergedExclude),
                new ArrayList<>(mergedHelpers),
                theme.overriddenBy(other.theme),
                other.obfuscation.enabled() ? other.obfuscation : obfuscation,
                other.security,
                other.jobs,
                other.onParseError,
                other.minify,
                other.preflight,
                other.buildMode != null ? other.buildMode : buildMode);
    }

    public ExtractorConfig withContent(List<String> value) {
        return new ExtractorConfig(value, exclude, helpers, theme, obfuscation, security, jobs, onParseError,
                minify, preflight, buildMode);
    }

    public ExtractorConfig withExclude(List<String> value) {
        return new ExtractorConfig(content, value, helpers, theme, obfuscation, security, jobs, onParseError,
                minify, preflight, buildMode);
    }

    public ExtractorConfig withObfuscation(ObfuscationSettings value) {
        return new ExtractorConfig(content, exclude, helpers, theme, value, security, jobs, onParseError,
                minify, preflight, buildMode);
    }

    public ExtractorConfig withSecurity(SecurityPolicy value) {
        return new ExtractorConfig(content, exclude, helpers, theme, obfuscation, value, jobs, onParseError,
                minify, preflight, buildMode);
    }

    public ExtractorConfig withJobs(int value) {
        return new ExtractorConfig(content, exclude, helpers, theme, obfuscation, security, value, onParseError,
                minify, preflight, buildMode);
    }

    public ExtractorConfig withOnParseError(ParseErrorPolicy value) {
        return new ExtractorConfig(content, exclude, helpers, theme, obfuscation, security, jobs, value,
                minify, preflight, buildMode);
    }

    public ExtractorConfig withMinify(boolean value) {
        return new ExtractorConfig(content, exclude, helpers, theme, obfuscation, security, jobs, onParseError,
                value, preflight, buildMode);
    }

    public ExtractorConfig withPreflight(boolean value) {
        return new ExtractorConfig(content, exclude, helpers, theme, obfuscation, security, jobs, onParseError,
                minify, value, buildMode);
    }

    public ExtractorConfig withBuildMode(String value) {
        return new ExtractorConfig(content, exclude, helpers, theme, obfuscation, security, jobs, onParseError,
                minify, preflight, value);
    }
}
