package com.raditha.twx.pipeline;

import com.raditha.twx.config.ExtractorConfig;
import com.raditha.twx.config.ParseErrorPolicy;
import com.raditha.twx.css.BundleOptions;
import com.raditha.twx.css.ClassCompiler;
import com.raditha.twx.css.Theme;
import com.raditha.twx.css.UtilityClassCompiler;
import com.raditha.twx.exceptions.BundleException;
import com.raditha.twx.exceptions.ConfigException;
import com.raditha.twx.exceptions.ExtractorException;
import com.raditha.twx.exceptions.NoFilesFoundException;
import com.raditha.twx.exceptions.ParseException;
import com.raditha.twx.exceptions.SecurityException;
import com.raditha.twx.extraction.ClassRegistry;
import com.raditha.twx.extraction.FileAnalyzer;
import com.raditha.twx.manifest.CssOutput;
import com.raditha.twx.manifest.Manifest;
import com.raditha.twx.manifest.ManifestBuilder;
import com.raditha.twx.manifest.ManifestWriter;
import com.raditha.twx.model.ExtractionResult;
import com.raditha.twx.model.FileExtraction;
import com.raditha.twx.model.SourceUnit;
import com.raditha.twx.model.TransformResult;
import com.raditha.twx.obfuscation.ObfuscationMapper;
import com.raditha.twx.parser.JsParser;
import com.raditha.twx.parser.SyntaxTreeParser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main orchestrator for multi-file runs.
 * <p>
 * Discover, validate, dispatch to the shared worker pool, merge, then either
 * generate and write CSS plus manifest ({@link #extract}) or write the
 * rewritten sources ({@link #transform}). Workers only share the run registry,
 * and only inside one lock.
 */
public class ExtractionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final ExtractorConfig config;
    private final ObfuscationMapper mapper;
    private final ClassCompiler compiler;
    private final FileAnalyzer analyzer;
    private final SecurityGate gate;
    private final FileDiscovery discovery;
    private final ManifestBuilder manifestBuilder;
    private final ManifestWriter manifestWriter;
    private final DiffGenerator diffGenerator;
    private final Clock clock;

    /**
     * Result of one worker task. Exactly one of {@code extraction} and
     * {@code skipReason} is set; {@code original} is kept for transform runs only.
     */
    private record Outcome(Path file, String identity, String original, FileExtraction extraction,
            String skipReason) {

        static Outcome skipped(Path file, String identity, String reason) {
            return new Outcome(file, identity, null, null, reason);
        }
    }

    private record Batch(int matched, List<Outcome> outcomes, List<String> skipped, ClassRegistry registry) {
    }

    public ExtractionPipeline(ExtractorConfig config) {
        this(config, new JsParser(), null, Clock.systemUTC());
    }

    /**
     * @param compiler oracle to use, or {@code null} for the built-in compiler
     *                 with the configured theme
     */
    public ExtractionPipeline(ExtractorConfig config, SyntaxTreeParser parser, @Nullable ClassCompiler compiler,
            Clock clock) {
        this.config = config;
        this.mapper = config.obfuscation().toMapper();
        if (compiler == null) {
            Theme theme = config.theme().applyTo(Theme.defaults());
            compiler = new UtilityClassCompiler(theme, mapper, UtilityClassCompiler.Mode.PASS_THROUGH);
        }
        this.compiler = compiler;
        this.analyzer = new FileAnalyzer(parser, compiler, config.helpers());
        this.gate = new SecurityGate(config.security());
        this.discovery = new FileDiscovery(config.security().root());
        this.manifestBuilder = new ManifestBuilder(clock, ManifestBuilder.DEFAULT_TOP_N);
        this.manifestWriter = new ManifestWriter();
        this.diffGenerator = new DiffGenerator();
        this.clock = clock;
    }

    /**
     * Extract classes from every configured file and write the CSS bundle and
     * the manifest.
     *
     * @param dryRun do everything except writing the two files
     */
    public ExtractionResult extract(Path cssOutput, Path manifestOutput, boolean dryRun)
            throws ExtractorException, IOException, InterruptedException {
        long start = System.nanoTime();
        Path cssTarget = gate.checkOutput(cssOutput);
        Path manifestTarget = gate.checkOutput(manifestOutput);
        if (cssTarget.equals(manifestTarget)) {
            throw new ConfigException("Output CSS and manifest paths must be different: " + cssTarget);
        }

        Batch batch = collect(false, false);
        ClassRegistry registry = batch.registry();

        Map<String, String> mappings = mappingsFor(registry);
        String bundle = bundle(registry, mappings);
        Instant now = Instant.now(clock);
        String fullCss = CssOutput.render(bundle, false, now);
        String css = config.minify() ? CssOutput.render(bundle, true, now) : fullCss;

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        int processed = batch.outcomes().size();
        ManifestBuilder.RunStats stats = new ManifestBuilder.RunStats(
                batch.matched(),
                processed,
                batch.skipped().size(),
                byteSize(fullCss),
                config.minify() ? Long.valueOf(byteSize(css)) : null,
                elapsed.toMillis());
        Manifest manifest = manifestBuilder.build(registry, mappings, stats, config.buildMode());

        if (dryRun) {
            logger.info("Dry run: skipping write of {} and {}", cssTarget, manifestTarget);
        } else {
            AtomicFileWriter.write(cssTarget, css);
            manifestWriter.write(manifest, manifestTarget);
        }
        logger.info("Processed {} file(s), extracted {} unique classes ({} skipped) in {} ms",
                processed, registry.uniqueCount(), batch.skipped().size(), elapsed.toMillis());
        return new ExtractionResult(registry, css, manifest, mappings, batch.matched(), processed, batch.skipped(),
                elapsed, !dryRun);
    }

    /**
     * Rewrite the class strings of every configured file.
     *
     * @param outputDirectory where rewritten files go, mirroring their place
     *                        under the root; {@code null} rewrites in place
     *                        (only files that changed are touched)
     * @param dryRun          compute unified diffs instead of writing
     */
    public TransformReport transform(@Nullable Path outputDirectory, boolean dryRun)
            throws ExtractorException, IOException, InterruptedException {
        long start = System.nanoTime();
        Path outputRoot = outputDirectory == null ? null : gate.checkOutputDirectory(outputDirectory);

        Batch batch = collect(true, config.obfuscation().enabled());
        ClassRegistry registry = batch.registry();

        List<TransformReport.FileChange> changes = new ArrayList<>();
        for (Outcome outcome : batch.outcomes()) {
            FileExtraction extraction = outcome.extraction();
            String rewritten = extraction.transformedCode();
            boolean changed = !rewritten.equals(outcome.original());
            if (outputRoot == null && !changed) {
                continue;
            }
            Path target = outputRoot == null
                    ? outcome.file()
                    : outputRoot.resolve(discovery.relativeTarget(outcome.file())).normalize();
            if (dryRun) {
                if (changed) {
                    String diff = diffGenerator.generateUnifiedDiff(outcome.identity(), outcome.original(), rewritten);
                    changes.add(new TransformReport.FileChange(outcome.identity(), target,
                            extraction.transformedCount(), diff));
                }
                continue;
            }
            if (outputRoot != null) {
                target = gate.checkOutput(target);
            }
            AtomicFileWriter.write(target, rewritten);
            if (changed) {
                changes.add(new TransformReport.FileChange(outcome.identity(), target,
                        extraction.transformedCount(), null));
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        logger.info("Rewrote {} of {} file(s) ({} skipped) in {} ms", changes.size(), batch.outcomes().size(),
                batch.skipped().size(), elapsed.toMillis());
        return new TransformReport(registry, changes, batch.matched(), batch.outcomes().size(), batch.skipped(),
                elapsed, !dryRun);
    }

    /**
     * CSS for a single unit, as the {@code pipe} command prints it.
     */
    public String cssFor(SourceUnit unit) throws ParseException, BundleException {
        ClassRegistry registry = FileAnalyzer.registryOf(analyzer.analyze(unit));
        String bundle = bundle(registry, mappingsFor(registry));
        return CssOutput.render(bundle, config.minify(), Instant.now(clock));
    }

    /**
     * Rewritten source for a single unit.
     */
    public TransformResult transformSource(SourceUnit unit) throws ParseException {
        return analyzer.transform(unit, config.obfuscation().enabled()).toTransformResult(unit.content());
    }

    /**
     * Aliases for the recognized utilities of the registry, or {@code null}
     * when obfuscation is off. The registry records the aliases.
     */
    private @Nullable Map<String, String> mappingsFor(ClassRegistry registry) {
        if (!config.obfuscation().enabled()) {
            return null;
        }
        List<String> recognized = registry.classNames().stream().filter(compiler::isUtility).toList();
        Map<String, String> mappings = mapper.mapAll(recognized);
        registry.applyMapping(mappings);
        return mappings;
    }

    private String bundle(ClassRegistry registry, Map<String, String> mappings) throws BundleException {
        if (registry.isEmpty()) {
            return "";
        }
        return compiler.bundle(registry.classNames(), new BundleOptions(!config.preflight(), mappings));
    }

    /**
     * Discover, validate and process every file. Partial registries are merged
     * as soon as each task finishes.
     */
    private Batch collect(boolean rewrite, boolean obfuscate)
            throws ExtractorException, IOException, InterruptedException {
        List<Path> matched = discovery.discover(config.content(), config.exclude());
        List<Path> accepted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Path file : matched) {
            try {
                gate.checkInput(file);
                accepted.add(file);
            } catch (SecurityException | IOException e) {
                String identity = discovery.identityOf(file);
                logger.warn("Skipping {}: {}", identity, e.getMessage());
                skipped.add(identity + ": " + e.getMessage());
            }
        }
        if (accepted.isEmpty()) {
            throw new NoFilesFoundException(config.content(), skipped.size());
        }

        ClassRegistry registry = new ClassRegistry();
        Object mergeLock = new Object();
        AtomicInteger progress = new AtomicInteger();
        int total = accepted.size();

        CompletionService<Outcome> completion = new ExecutorCompletionService<>(WorkerPools.shared(config.jobs()));
        List<Future<Outcome>> futures = new ArrayList<>();
        for (Path file : accepted) {
            futures.add(completion.submit(() -> {
                Outcome outcome = process(file, rewrite, obfuscate);
                if (outcome.extraction() != null) {
                    ClassRegistry partial = FileAnalyzer.registryOf(outcome.extraction());
                    synchronized (mergeLock) {
                        registry.merge(partial);
                    }
                }
                logger.debug("[{}/{}] {}", progress.incrementAndGet(), total, outcome.identity());
                return outcome;
            }));
        }

        List<Outcome> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                Future<Outcome> future = completion.take();
                try {
                    Outcome outcome = future.get();
                    if (outcome.skipReason() != null) {
                        skipped.add(outcome.identity() + ": " + outcome.skipReason());
                    } else {
                        outcomes.add(outcome);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof ParseException parseError && config.onParseError() == ParseErrorPolicy.SKIP) {
                        logger.warn("Skipping {}", parseError.getMessage());
                        skipped.add(parseError.getPath() + ": " + parseError.getMessage());
                        continue;
                    }
                    cancel(futures);
                    if (cause instanceof ExtractorException extractorError) {
                        throw extractorError;
                    }
                    if (cause instanceof IOException ioError) {
                        throw ioError;
                    }
                    if (cause instanceof RuntimeException runtimeError) {
                        throw runtimeError;
                    }
                    if (cause instanceof Error error) {
                        throw error;
                    }
                    throw new IllegalStateException("Worker task failed", cause);
                }
            }
        } catch (InterruptedException e) {
            cancel(futures);
            throw e;
        }

        outcomes.sort(Comparator.comparing(Outcome::file));
        return new Batch(matched.size(), outcomes, skipped, registry);
    }

    private Outcome process(Path file, boolean rewrite, boolean obfuscate) throws ParseException {
        String identity = discovery.identityOf(file);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            logger.warn("Skipping {}: not valid UTF-8", identity);
            return Outcome.skipped(file, identity, "not valid UTF-8");
        } catch (IOException e) {
            logger.warn("Skipping {}: {}", identity, e.getMessage());
            return Outcome.skipped(file, identity, "unreadable (" + e.getMessage() + ")");
        }
        SourceUnit unit = SourceUnit.of(identity, content);
        FileExtraction extraction = rewrite ? analyzer.transform(unit, obfuscate) : analyzer.analyze(unit);
        return new Outcome(file, identity, rewrite ? content : null, extraction, null);
    }

    private static void cancel(List<Future<Outcome>> futures) {
        // running tasks finish on their own; only queued ones are dropped
        for (Future<Outcome> future : futures) {
            future.cancel(false);
        }
    }

    private static long byteSize(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    public ClassCompiler getCompiler() {
        return compiler;
    }

    public ExtractorConfig getConfig() {
        return config;
    }
}
