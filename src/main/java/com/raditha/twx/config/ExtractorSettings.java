package com.raditha.twx.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.twx.exceptions.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads extractor configuration from a YAML or JSON file with command-line
 * overrides.
 * <p>
 * Configuration priority: CLI arguments > configuration file > defaults
 */
public class ExtractorSettings {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorSettings.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    /**
     * Values given on the command line. {@code null} (or an empty list) means
     * "not given" so the file or the default applies.
     */
    public record Overrides(
            List<String> input,
            List<String> exclude,
            Integer jobs,
            Boolean obfuscate,
            Boolean minify,
            Boolean noPreflight,
            ParseErrorPolicy onParseError,
            Path root) {

        public static Overrides none() {
            return new Overrides(null, null, null, null, null, null, null, null);
        }
    }

    private ExtractorSettings() {
    }

    /**
     * Load configuration from a file, applying CLI overrides where provided.
     *
     * @param configFile configuration file, or {@code null} to start from defaults
     * @param overrides  command-line values
     * @return complete configuration
     * @throws ConfigException if the file cannot be read or holds invalid values
     */
    public static ExtractorConfig loadConfig(Path configFile, Overrides overrides) throws ConfigException {
        ExtractorConfig config = configFile == null ? ExtractorConfig.defaults() : loadConfig(configFile);
        try {
            return applyOverrides(config, overrides == null ? Overrides.none() : overrides);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
    }

    /**
     * Load a configuration file. The format follows the extension:
     * {@code .yaml}/{@code .yml} or {@code .json}.
     */
    public static ExtractorConfig loadConfig(Path configFile) throws ConfigException {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigException("Config file not found: " + configFile);
        }
        ObjectMapper mapper = mapperFor(configFile);
        Map<String, Object> raw;
        try {
            raw = mapper.readValue(configFile.toFile(), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to parse config file " + configFile + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + configFile + ": " + e.getMessage(), e);
        }
        logger.debug("Loaded configuration from {}", configFile);
        return fromMap(raw == null ? Map.of() : raw);
    }

    private static ObjectMapper mapperFor(Path configFile) throws ConfigException {
        String name = configFile.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return new ObjectMapper(new YAMLFactory());
        }
        if (name.endsWith(".json")) {
            return new ObjectMapper();
        }
        throw new ConfigException("Unsupported config format (expected .yaml, .yml or .json): " + configFile);
    }

    /**
     * Map a parsed configuration document onto a validated config. Missing
     * keys keep their defaults.
     */
    public static ExtractorConfig fromMap(Map<String, Object> config) throws ConfigException {
        ExtractorConfig defaults = ExtractorConfig.defaults();
        try {
            List<String> content = getListString(config, "content", defaults.content());
            List<String> exclude = getListString(config, "exclude", defaults.exclude());
            List<String> helpers = getListString(config, "helpers", defaults.helpers());
            ThemeExtension theme = buildTheme(getMap(config, "theme"));
            ObfuscationSettings obfuscation = buildObfuscation(getMap(config, "obfuscation"));
            SecurityPolicy security = buildSecurity(getMap(config, "security"));
            int jobs = getInt(config, "jobs", defaults.jobs());
            String policy = getString(config, "onParseError", null);
            ParseErrorPolicy onParseError = policy == null ? defaults.onParseError() : ParseErrorPolicy.fromString(policy);
            boolean minify = getBoolean(config, "minify", defaults.minify());
            boolean preflight = getBoolean(config, "preflight", defaults.preflight());
            String buildMode = getString(config, "buildMode", null);
            return new ExtractorConfig(content, exclude, helpers, theme, obfuscation, security, jobs, onParseError,
                    minify, preflight, buildMode);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static ExtractorConfig applyOverrides(ExtractorConfig config, Overrides overrides) {
        ExtractorConfig result = config;
        if (overrides.input() != null && !overrides.input().isEmpty()) {
            result = result.withContent(overrides.input());
        }
        if (overrides.exclude() != null && !overrides.exclude().isEmpty()) {
            List<String> exclude = new ArrayList<>(result.exclude());
            exclude.addAll(overrides.exclude());
            result = result.withExclude(exclude);
        }
        if (overrides.jobs() != null) {
            result = result.withJobs(overrides.jobs());
        }
        if (Boolean.TRUE.equals(overrides.obfuscate())) {
            result = result.withObfuscation(result.obfuscation().withEnabled(true));
        }
        if (Boolean.TRUE.equals(overrides.minify())) {
            result = result.withMinify(true);
        }
        if (Boolean.TRUE.equals(overrides.noPreflight())) {
            result = result.withPreflight(false);
        }
        if (overrides.onParseError() != null) {
            result = result.withOnParseError(overrides.onParseError());
        }
        if (overrides.root() != null) {
            result = result.withSecurity(result.security().withRoot(overrides.root()));
        }
        return result;
    }

    private static ThemeExtension buildTheme(Map<String, Object> theme) {
        Map<String, Object> extend = getMap(theme, "extend");
        Map<String, String> colors = ThemeExtension.flattenColors(getMap(extend, "colors"));
        Map<String, String> spacing = new LinkedHashMap<>();
        getMap(extend, "spacing").forEach((key, value) -> spacing.put(key, scalar("spacing." + key, value)));
        Map<String, Object> fonts = getMap(extend, "fontFamily");
        if (fonts.isEmpty()) {
            fonts = getMap(extend, "font_family");
        }
        Map<String, List<String>> fontFamily = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fonts.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof List<?> list) {
                fontFamily.put(entry.getKey(), list.stream().map(String::valueOf).toList());
            } else {
                fontFamily.put(entry.getKey(), List.of(scalar("fontFamily." + entry.getKey(), value)));
            }
        }
        return new ThemeExtension(colors, spacing, fontFamily);
    }

    private static ObfuscationSettings buildObfuscation(Map<String, Object> obfuscation) {
        ObfuscationSettings defaults = ObfuscationSettings.disabled();
        boolean enabled = getBoolean(obfuscation, "enabled", defaults.enabled());
        String prefix = getString(obfuscation, "prefix", defaults.prefix());
        long seed = obfuscation.containsKey("seed") ? parseSeed(obfuscation.get("seed")) : defaults.seed();
        return new ObfuscationSettings(enabled, prefix, seed);
    }

    private static SecurityPolicy buildSecurity(Map<String, Object> security) {
        SecurityPolicy defaults = SecurityPolicy.defaults();
        Object maxSize = security.get("maxFileSize");
        long maxFileSize = defaults.maxFileSize();
        if (maxSize instanceof Number number) {
            maxFileSize = number.longValue();
        } else if (maxSize != null) {
            throw new IllegalArgumentException("security.maxFileSize must be a number, got: " + maxSize);
        }
        boolean allowSymlinks = getBoolean(security, "allowSymlinks", defaults.allowSymlinks());
        String root = getString(security, "root", null);
        return new SecurityPolicy(maxFileSize, allowSymlinks, root == null ? null : Path.of(root));
    }

    /**
     * Seeds may be written as a number, a decimal string or a {@code 0x} hex
     * string; all 64 bits are kept.
     */
    static long parseSeed(Object value) {
        if (value instanceof BigInteger big) {
            return big.longValue();
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            String trimmed = text.trim().replace("_", "");
            try {
                if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                    return Long.parseUnsignedLong(trimmed.substring(2), 16);
                }
                return Long.parseUnsignedLong(trimmed);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("obfuscation.seed is not a valid number: " + text, e);
            }
        }
        throw new IllegalArgumentException("obfuscation.seed must be a number, got: " + value);
    }

    private static String scalar(String key, Object value) {
        if (value instanceof String || value instanceof Number) {
            return value.toString();
        }
        throw new IllegalArgumentException(key + " must be a string, got: " + value);
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalArgumentException(key + " must be a number, got: " + value);
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new IllegalArgumentException(key + " must be true or false, got: " + value);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String single) {
            return List.of(single);
        }
        throw new IllegalArgumentException(key + " must be a list, got: " + value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new IllegalArgumentException(key + " must be a mapping, got: " + value);
    }
}
