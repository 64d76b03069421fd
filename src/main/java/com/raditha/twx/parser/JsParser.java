package com.raditha.twx.parser;

import com.raditha.twx.exceptions.ParseException;
import com.raditha.twx.model.Dialect;
import com.raditha.twx.model.SourceUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTsx;
import org.treesitter.TreeSitterTypescript;

/**
 * Parser for JavaScript, TypeScript and JSX sources built on tree-sitter.
 * The grammar follows the unit's dialect: plain scripts (JSX included) use the
 * JavaScript grammar, {@code .ts} the TypeScript one and {@code .tsx} the TSX
 * one. A tree with any error or missing node is rejected.
 * <p>
 * A {@link TSParser} is not thread safe, so every call creates its own.
 */
public class JsParser implements SyntaxTreeParser {

    private static final Logger logger = LoggerFactory.getLogger(JsParser.class);

    private static final TSLanguage JAVASCRIPT = new TreeSitterJavascript();
    private static final TSLanguage TYPESCRIPT = new TreeSitterTypescript();
    private static final TSLanguage TSX = new TreeSitterTsx();

    private static final int SNIPPET_LENGTH = 20;

    @Override
    public SyntaxTree parse(SourceUnit unit) throws ParseException {
        String src = unit.content();
        TSParser parser = new TSParser();
        parser.setLanguage(languageFor(unit.dialect()));
        TSTree tree = parser.parseString(null, src);
        TSNode root = tree.getRootNode();

        LineMap lines = new LineMap(src);
        ByteOffsets offsets = new ByteOffsets(src);
        try {
            if (root.hasError()) {
                throw syntaxError(unit, root, offsets, lines);
            }
            SyntaxTree result = new TreeConverter(unit, offsets, lines).convert(root);
            logger.debug("Parsed {} ({} literal(s))", unit.identity(), result.getLiterals().size());
            return result;
        } catch (StackOverflowError e) {
            throw new ParseException(unit.identity(), 1, 0, "Nesting too deep");
        }
    }

    static TSLanguage languageFor(Dialect dialect) {
        if (!dialect.typed()) {
            return JAVASCRIPT;
        }
        return dialect.jsx() ? TSX : TYPESCRIPT;
    }

    private static ParseException syntaxError(SourceUnit unit, TSNode root, ByteOffsets offsets, LineMap lines) {
        TSNode bad = firstError(root);
        if (bad == null) {
            return new ParseException(unit.identity(), 1, 0, "Syntax error");
        }
        int at = offsets.toChar(bad.getStartByte());
        String message;
        if (bad.isMissing()) {
            message = "Missing '" + bad.getType() + "'";
        } else {
            int end = Math.max(at, offsets.toChar(bad.getEndByte()));
            message = "Unexpected " + describe(unit.content().substring(at, end));
        }
        return new ParseException(unit.identity(), lines.line(at), lines.column(at), message);
    }

    /**
     * The first error or missing node in document order.
     */
    private static TSNode firstError(TSNode node) {
        if (node.isError() || node.isMissing()) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.hasError() || child.isMissing()) {
                TSNode found = firstError(child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static String describe(String text) {
        String firstLine = text.strip().lines().findFirst().orElse("");
        if (firstLine.isEmpty()) {
            return "end of input";
        }
        if (firstLine.length() > SNIPPET_LENGTH) {
            firstLine = firstLine.substring(0, SNIPPET_LENGTH) + "...";
        }
        return "'" + firstLine + "'";
    }
}
