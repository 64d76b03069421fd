package com.raditha.twx.pipeline;

import com.raditha.twx.config.ExtractorConfig;
import com.raditha.twx.config.ObfuscationSettings;
import com.raditha.twx.config.ParseErrorPolicy;
import com.raditha.twx.config.SecurityPolicy;
import com.raditha.twx.exceptions.ConfigException;
import com.raditha.twx.exceptions.NoFilesFoundException;
import com.raditha.twx.exceptions.ParseException;
import com.raditha.twx.exceptions.SecurityException;
import com.raditha.twx.manifest.Manifest;
import com.raditha.twx.manifest.ManifestWriter;
import com.raditha.twx.model.ExtractionResult;
import com.raditha.twx.model.SourceUnit;
import com.raditha.twx.obfuscation.ObfuscationMapper;
import com.raditha.twx.parser.JsParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionPipelineTest {

    private static final String APP = """
            import clsx from "clsx";

            export function App({ active }) {
              return (
                <div className="flex p-4">
                  <span className={clsx("font-bold", active && "text-white")}>Hi</span>
                </div>
              );
            }
            """;

    private static final String CARD = """
            export const Card = () => <section className="flex items-center p-4" title="Click me!" />;
            """;

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-04T05:06:07Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private ExtractorConfig config() {
        return ExtractorConfig.defaults()
                .withSecurity(new SecurityPolicy(SecurityPolicy.DEFAULT_MAX_FILE_SIZE, false, tempDir))
                .withJobs(2)
                .withPreflight(false);
    }

    private ExtractionPipeline pipeline(ExtractorConfig config) {
        return new ExtractionPipeline(config, new JsParser(), null, CLOCK);
    }

    @Test
    void testExtract_WritesCssAndManifest() throws Exception {
        write("src/App.jsx", APP);
        write("src/components/Card.jsx", CARD);

        ExtractionResult result = pipeline(config()).extract(Path.of("dist/out.css"), Path.of("dist/manifest.json"),
                false);

        assertTrue(result.written());
        assertEquals(2, result.filesMatched());
        assertEquals(2, result.filesProcessed());
        assertEquals(0, result.filesSkipped());
        assertEquals(List.of("flex", "font-bold", "items-center", "p-4", "text-white"),
                result.registry().classNames().stream().sorted().toList());
        assertEquals(2, result.registry().get("flex").getCount());
        assertTrue(result.mappings().isEmpty());

        String css = Files.readString(tempDir.resolve("dist/out.css"));
        assertEquals(result.css(), css);
        assertTrue(css.contains("display: flex"));
        assertTrue(css.contains("padding: 1rem"));
        assertTrue(css.contains("Generation time: 2024-03-04 05:06:07 UTC"));

        Manifest manifest = new ManifestWriter().read(tempDir.resolve("dist/manifest.json"));
        assertEquals(result.manifest(), manifest);
        assertEquals(5, manifest.metadata().classesExtracted());
        // files follow completion order, which varies between runs
        assertEquals(Set.of("src/App.jsx", "src/components/Card.jsx"),
                Set.copyOf(manifest.classes().get("flex").files()));
        assertEquals(2, manifest.statistics().filesMatched());
        assertNull(manifest.statistics().minifiedSizeBytes());
        assertEquals("flex", manifest.statistics().topClasses().get(0).name());
    }

    @Test
    void testExtract_OversizedFileSkipped() throws Exception {
        write("src/App.jsx", APP);
        write("src/Big.jsx", CARD + "// " + "x".repeat(4096) + "\n");
        ExtractorConfig config = config().withSecurity(new SecurityPolicy(1024, false, tempDir));

        ExtractionResult result = pipeline(config).extract(Path.of("out.css"), Path.of("manifest.json"), false);

        assertEquals(2, result.filesMatched());
        assertEquals(1, result.filesProcessed());
        assertEquals(1, result.filesSkipped());
        assertTrue(result.skippedFiles().get(0).startsWith("src/Big.jsx: "), result.skippedFiles().toString());
        assertFalse(result.registry().contains("items-center"));
        assertTrue(result.registry().contains("font-bold"));
        assertEquals(1, result.manifest().statistics().filesSkipped());
    }

    @Test
    void testExtract_AllFilesRejected() throws Exception {
        write("src/Big.jsx", "x".repeat(2048));
        ExtractorConfig config = config().withSecurity(new SecurityPolicy(1024, false, tempDir));

        NoFilesFoundException ex = assertThrows(NoFilesFoundException.class,
                () -> pipeline(config).extract(Path.of("out.css"), Path.of("manifest.json"), false));
        assertTrue(ex.getMessage().contains("1 rejected"));
    }

    @Test
    void testExtract_ParseErrorFails() throws Exception {
        write("src/App.jsx", APP);
        write("src/Broken.js", "const a = \"oops;\n");

        ParseException ex = assertThrows(ParseException.class,
                () -> pipeline(config()).extract(Path.of("out.css"), Path.of("manifest.json"), false));
        assertEquals("src/Broken.js", ex.getPath());
        assertFalse(Files.exists(tempDir.resolve("out.css")));
        assertFalse(Files.exists(tempDir.resolve("manifest.json")));
    }

    @Test
    void testExtract_ParseErrorSkipped() throws Exception {
        write("src/App.jsx", APP);
        write("src/Broken.js", "const a = \"oops;\n");
        ExtractorConfig config = config().withOnParseError(ParseErrorPolicy.SKIP);

        ExtractionResult result = pipeline(config).extract(Path.of("out.css"), Path.of("manifest.json"), false);

        assertEquals(1, result.filesProcessed());
        assertEquals(1, result.filesSkipped());
        assertTrue(result.skippedFiles().get(0).startsWith("src/Broken.js"));
        assertTrue(Files.exists(tempDir.resolve("out.css")));
    }

    @Test
    void testExtract_DryRun() throws Exception {
        write("src/App.jsx", APP);

        ExtractionResult result = pipeline(config()).extract(Path.of("out.css"), Path.of("manifest.json"), true);

        assertFalse(result.written());
        assertTrue(result.css().contains("display: flex"));
        assertFalse(Files.exists(tempDir.resolve("out.css")));
        assertFalse(Files.exists(tempDir.resolve("manifest.json")));
    }

    @Test
    void testExtract_OutputChecks() throws Exception {
        write("src/App.jsx", APP);
        ExtractionPipeline pipeline = pipeline(config());

        assertThrows(ConfigException.class,
                () -> pipeline.extract(Path.of("same.css"), Path.of("./same.css"), false));
        assertThrows(SecurityException.class,
                () -> pipeline.extract(Path.of("../out.css"), Path.of("manifest.json"), false));
    }

    @Test
    void testExtract_ObfuscatedAndMinified() throws Exception {
        write("src/App.jsx", APP);
        ExtractorConfig config = config()
                .withObfuscation(new ObfuscationSettings(true, "tw", 42L))
                .withMinify(true);
        ObfuscationMapper mapper = new ObfuscationMapper(42L, "tw");

        ExtractionResult result = pipeline(config).extract(Path.of("out.css"), Path.of("manifest.json"), false);

        assertEquals(mapper.alias("flex"), result.mappings().get("flex"));
        assertEquals(4, result.mappings().size());
        assertEquals(mapper.alias("flex"), result.registry().get("flex").getObfuscated());
        String css = Files.readString(tempDir.resolve("out.css"));
        assertTrue(css.startsWith("/* Generated by twx"));
        assertTrue(css.contains("." + mapper.alias("flex") + "{display:flex}"), css);
        assertFalse(css.contains(".flex{"));

        Manifest manifest = result.manifest();
        assertTrue(manifest.metadata().obfuscationEnabled());
        assertEquals(List.of("flex", "font-bold", "p-4", "text-white"), List.copyOf(manifest.mappings().keySet()));
        assertNotNull(manifest.statistics().minifiedSizeBytes());
        assertTrue(manifest.statistics().minifiedSizeBytes() < manifest.statistics().cssSizeBytes());
    }

    @Test
    void testTransform_InPlace() throws Exception {
        Path app = write("src/App.jsx", APP);
        Path plain = write("src/plain.js", "export const answer = 42;\n");
        ExtractorConfig config = config().withObfuscation(new ObfuscationSettings(true, "tw", 7L));
        ObfuscationMapper mapper = new ObfuscationMapper(7L, "tw");

        TransformReport report = pipeline(config).transform(null, false);

        assertTrue(report.written());
        assertEquals(2, report.filesProcessed());
        assertEquals(1, report.changes().size());
        assertEquals("src/App.jsx", report.changes().get(0).identity());
        assertEquals(3, report.literalsChanged());

        String rewritten = Files.readString(app);
        assertTrue(rewritten.contains("className=\"" + mapper.alias("flex") + " " + mapper.alias("p-4") + "\""),
                rewritten);
        assertTrue(rewritten.contains("clsx(\"" + mapper.alias("font-bold") + "\""));
        assertEquals("export const answer = 42;\n", Files.readString(plain));
        // the registry keeps the original names
        assertTrue(report.registry().contains("flex"));
    }

    @Test
    void testTransform_DryRunProducesDiffs() throws Exception {
        Path app = write("src/App.jsx", APP);
        ExtractorConfig config = config().withObfuscation(new ObfuscationSettings(true, "tw", 7L));

        TransformReport report = pipeline(config).transform(null, true);

        assertFalse(report.written());
        assertEquals(APP, Files.readString(app));
        TransformReport.FileChange change = report.changes().get(0);
        assertTrue(change.diff().startsWith("--- a/src/App.jsx"));
        assertTrue(change.diff().contains("-    <div className=\"flex p-4\">"));
    }

    @Test
    void testTransform_IntoOutputDirectory() throws Exception {
        Path app = write("src/App.jsx", APP);
        write("src/plain.js", "export const answer = 42;\n");
        ExtractorConfig config = config().withObfuscation(new ObfuscationSettings(true, "tw", 7L));

        TransformReport report = pipeline(config).transform(Path.of("build"), false);

        assertEquals(APP, Files.readString(app));
        assertNotEquals(APP, Files.readString(tempDir.resolve("build/src/App.jsx")));
        // unchanged files are copied too so the output tree is complete
        assertEquals("export const answer = 42;\n", Files.readString(tempDir.resolve("build/src/plain.js")));
        assertEquals(1, report.changes().size());
    }

    @Test
    void testSingleUnit() throws Exception {
        ExtractionPipeline pipeline = pipeline(config().withObfuscation(new ObfuscationSettings(true, "tw", 7L)));
        SourceUnit unit = SourceUnit.stdin("<p className=\"flex p-4\" />;");

        String css = pipeline.cssFor(unit);
        assertTrue(css.contains("." + new ObfuscationMapper(7L, "tw").alias("p-4") + " {"), css);

        String code = pipeline.transformSource(unit).code();
        assertFalse(code.contains("flex"));
    }
}
