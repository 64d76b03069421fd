package com.raditha.twx.extraction;

import com.raditha.twx.classify.ClassLikenessClassifier;
import com.raditha.twx.classify.VariableAliasTable;
import com.raditha.twx.css.ClassCompiler;
import com.raditha.twx.css.UtilityClassCompiler;
import com.raditha.twx.exceptions.ParseException;
import com.raditha.twx.model.FileExtraction;
import com.raditha.twx.model.SourceUnit;
import com.raditha.twx.model.TransformResult;
import com.raditha.twx.parser.JsParser;
import com.raditha.twx.parser.SyntaxTree;
import com.raditha.twx.parser.SyntaxTreeParser;
import com.raditha.twx.rewrite.TieredRewriter;
import com.raditha.twx.visitor.ClassContextVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs one source unit through parsing, traversal and (optionally) rewriting.
 * <p>
 * Every call builds its own tree, context stack and alias table, so a single
 * analyzer can be shared by all workers.
 */
public class FileAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(FileAnalyzer.class);

    private final SyntaxTreeParser parser;
    private final ClassLikenessClassifier classifier;
    private final List<String> helpers;
    private final TieredRewriter rewriter;

    /**
     * Create analyzer with the built-in parser and compiler.
     */
    public FileAnalyzer() {
        this(new JsParser(), new UtilityClassCompiler(), List.of());
    }

    /**
     * @param parser   tree collaborator
     * @param compiler oracle used by the rewriter; a {@link UtilityClassCompiler}
     *                 is switched to strict mode so unknown tokens fall through
     *                 the rewrite tiers instead of being copied silently
     * @param helpers  call names whose arguments hold class lists; empty for the defaults
     */
    public FileAnalyzer(SyntaxTreeParser parser, ClassCompiler compiler, List<String> helpers) {
        this.parser = parser;
        this.classifier = new ClassLikenessClassifier();
        this.helpers = helpers == null ? List.of() : List.copyOf(helpers);
        this.rewriter = new TieredRewriter(strict(compiler));
    }

    private static ClassCompiler strict(ClassCompiler compiler) {
        if (compiler instanceof UtilityClassCompiler utility) {
            return utility.withMode(UtilityClassCompiler.Mode.STRICT);
        }
        return compiler;
    }

    /**
     * Collect the class tokens of one unit without changing it.
     */
    public FileExtraction analyze(SourceUnit unit) throws ParseException {
        return run(unit, false, false);
    }

    /**
     * Collect the class tokens of one unit and rewrite its class strings.
     * Tokens are recorded with their original values.
     */
    public FileExtraction transform(SourceUnit unit, boolean obfuscate) throws ParseException {
        return run(unit, true, obfuscate);
    }

    /**
     * Rewrite a piece of source text.
     *
     * @param identity file name used for positions and to pick the dialect
     */
    public TransformResult transformSource(String code, String identity, boolean obfuscate) throws ParseException {
        return transform(SourceUnit.of(identity, code), obfuscate).toTransformResult(code);
    }

    private FileExtraction run(SourceUnit unit, boolean rewrite, boolean obfuscate) throws ParseException {
        long start = System.nanoTime();
        SyntaxTree tree = parser.parse(unit);
        ClassContextVisitor visitor = new ClassContextVisitor(tree, classifier, new VariableAliasTable(helpers),
                rewrite ? rewriter : null, obfuscate);
        visitor.run();

        String code = rewrite ? tree.serialize() : null;
        long elapsed = System.nanoTime() - start;
        logger.debug("{}: {} class tokens, {} literals rewritten", unit.identity(), visitor.getTokens().size(),
                visitor.getTransformedCount());
        return new FileExtraction(unit.identity(), visitor.getTokens(), code, visitor.getTransformedCount(), elapsed);
    }

    /**
     * Partial registry holding the tokens of one file.
     */
    public static ClassRegistry registryOf(FileExtraction extraction) {
        ClassRegistry registry = new ClassRegistry();
        registry.addAll(extraction.tokens());
        return registry;
    }
}
