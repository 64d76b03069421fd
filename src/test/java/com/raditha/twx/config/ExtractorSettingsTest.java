package com.raditha.twx.config;

import com.raditha.twx.exceptions.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtractorSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadConfig_Defaults() throws ConfigException {
        // No config file and no CLI args
        ExtractorConfig config = ExtractorSettings.loadConfig(null, ExtractorSettings.Overrides.none());

        assertEquals(ExtractorConfig.DEFAULT_CONTENT, config.content());
        assertEquals(ExtractorConfig.DEFAULT_EXCLUDE, config.exclude());
        assertFalse(config.obfuscation().enabled());
        assertEquals(ParseErrorPolicy.FAIL, config.onParseError());
        assertTrue(config.preflight());
        assertFalse(config.minify());
        assertEquals(SecurityPolicy.DEFAULT_MAX_FILE_SIZE, config.security().maxFileSize());
    }

    @Test
    void testLoadConfig_Yaml() throws IOException, ConfigException {
        Path file = tempDir.resolve("twx.yaml");
        Files.writeString(file, """
                content:
                  - "app/**/*.jsx"
                exclude:
                  - "**/*.test.jsx"
                helpers: [cn, styles]
                jobs: 3
                onParseError: skip
                minify: true
                preflight: false
                buildMode: production
                theme:
                  extend:
                    colors:
                      brand:
                        DEFAULT: "#0044ff"
                        500: "#0033cc"
                      accent: "#ff00aa"
                    spacing:
                      "128": 32rem
                    fontFamily:
                      display: ["Inter Var", sans-serif]
                obfuscation:
                  enabled: true
                  prefix: x
                  seed: "0xCAFE"
                security:
                  maxFileSize: 2048
                  allowSymlinks: true
                """);

        ExtractorConfig config = ExtractorSettings.loadConfig(file);

        assertEquals(List.of("app/**/*.jsx"), config.content());
        assertEquals(List.of("**/*.test.jsx"), config.exclude());
        assertEquals(List.of("cn", "styles"), config.helpers());
        assertEquals(3, config.jobs());
        assertEquals(ParseErrorPolicy.SKIP, config.onParseError());
        assertTrue(config.minify());
        assertFalse(config.preflight());
        assertEquals("production", config.buildMode());

        assertEquals("#0044ff", config.theme().colors().get("brand"));
        assertEquals("#0033cc", config.theme().colors().get("brand-500"));
        assertEquals("#ff00aa", config.theme().colors().get("accent"));
        assertEquals("32rem", config.theme().spacing().get("128"));
        assertEquals(List.of("Inter Var", "sans-serif"), config.theme().fontFamily().get("display"));

        assertTrue(config.obfuscation().enabled());
        assertEquals("x", config.obfuscation().prefix());
        assertEquals(0xCAFEL, config.obfuscation().seed());
        assertEquals(2048, config.security().maxFileSize());
        assertTrue(config.security().allowSymlinks());
    }

    @Test
    void testLoadConfig_Json() throws IOException, ConfigException {
        Path file = tempDir.resolve("twx.json");
        Files.writeString(file, "{\"content\": \"src/*.js\", \"obfuscation\": {\"seed\": 42}}");

        ExtractorConfig config = ExtractorSettings.loadConfig(file);
        assertEquals(List.of("src/*.js"), config.content());
        assertEquals(42L, config.obfuscation().seed());
        assertFalse(config.obfuscation().enabled());
    }

    @Test
    void testLoadConfig_CliOverrides() throws IOException, ConfigException {
        Path file = tempDir.resolve("twx.yml");
        Files.writeString(file, "content: [\"a/**/*.js\"]\njobs: 2\n");

        ExtractorSettings.Overrides overrides = new ExtractorSettings.Overrides(
                List.of("b/**/*.tsx"), List.of("**/gen/**"), 5, true, true, true, ParseErrorPolicy.SKIP, tempDir);
        ExtractorConfig config = ExtractorSettings.loadConfig(file, overrides);

        assertEquals(List.of("b/**/*.tsx"), config.content());
        // CLI excludes are added to the configured ones
        assertTrue(config.exclude().containsAll(ExtractorConfig.DEFAULT_EXCLUDE));
        assertTrue(config.exclude().contains("**/gen/**"));
        assertEquals(5, config.jobs());
        assertTrue(config.obfuscation().enabled());
        assertTrue(config.minify());
        assertFalse(config.preflight());
        assertEquals(ParseErrorPolicy.SKIP, config.onParseError());
        assertEquals(tempDir.toAbsolutePath().normalize(), config.security().root());
    }

    @Test
    void testLoadConfig_MissingFile() {
        ConfigException ex = assertThrows(ConfigException.class,
                () -> ExtractorSettings.loadConfig(tempDir.resolve("missing.yaml")));
        assertTrue(ex.getMessage().contains("not found"));
    }

    @Test
    void testLoadConfig_UnsupportedExtension() throws IOException {
        Path file = tempDir.resolve("twx.toml");
        Files.writeString(file, "jobs = 2\n");
        assertThrows(ConfigException.class, () -> ExtractorSettings.loadConfig(file));
    }

    @Test
    void testLoadConfig_Malformed() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{\"content\": [");
        ConfigException ex = assertThrows(ConfigException.class, () -> ExtractorSettings.loadConfig(file));
        assertTrue(ex.getMessage().startsWith("Failed to parse config file"));
    }

    @Test
    void testFromMap_InvalidValues() {
        assertThrows(ConfigException.class, () -> ExtractorSettings.fromMap(Map.of("jobs", "many")));
        assertThrows(ConfigException.class, () -> ExtractorSettings.fromMap(Map.of("jobs", 0)));
        assertThrows(ConfigException.class, () -> ExtractorSettings.fromMap(Map.of("minify", "yes")));
        assertThrows(ConfigException.class, () -> ExtractorSettings.fromMap(Map.of("onParseError", "ignore")));
        assertThrows(ConfigException.class,
                () -> ExtractorSettings.fromMap(Map.of("obfuscation", Map.of("prefix", "9x"))));
        assertThrows(ConfigException.class,
                () -> ExtractorSettings.fromMap(Map.of("security", Map.of("maxFileSize", "big"))));
        assertThrows(ConfigException.class,
                () -> ExtractorSettings.fromMap(Map.of("theme", Map.of("extend", Map.of("colors", Map.of("a", List.of()))))));
    }

    @Test
    void testFromMap_SnakeCaseFontFamily() throws ConfigException {
        ExtractorConfig config = ExtractorSettings.fromMap(
                Map.of("theme", Map.of("extend", Map.of("font_family", Map.of("body", "Georgia")))));
        assertEquals(List.of("Georgia"), config.theme().fontFamily().get("body"));
    }

    @Test
    void testParseSeed() {
        assertEquals(42L, ExtractorSettings.parseSeed(42));
        assertEquals(42L, ExtractorSettings.parseSeed("42"));
        assertEquals(0x1337BEEFCAFEBABEL, ExtractorSettings.parseSeed("0x1337_BEEF_CAFE_BABE"));
        assertEquals(-1L, ExtractorSettings.parseSeed(new java.math.BigInteger("18446744073709551615")));
        assertThrows(IllegalArgumentException.class, () -> ExtractorSettings.parseSeed("seed"));
        assertThrows(IllegalArgumentException.class, () -> ExtractorSettings.parseSeed(true));
    }
}
