package com.raditha.twx.rewrite;

import com.raditha.twx.css.ClassCompiler;
import com.raditha.twx.exceptions.ClassifyException;
import com.raditha.twx.util.ClassTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a class string through a {@link ClassCompiler}, degrading
 * gracefully when the compiler rejects part of it.
 * <p>
 * Tiers, in order: the whole string; all tokens but the first (first kept
 * verbatim); all but the last; finally each token on its own, falling back to
 * the token itself. Leading and trailing whitespace is kept exactly, inner
 * whitespace becomes single spaces, and the number and order of tokens never
 * change.
 */
public class TieredRewriter {

    private static final Logger logger = LoggerFactory.getLogger(TieredRewriter.class);

    private final ClassCompiler compiler;

    public TieredRewriter(ClassCompiler compiler) {
        this.compiler = compiler;
    }

    public String rewrite(String classString, boolean obfuscate) {
        if (classString.isEmpty() || ClassTokens.isBlank(classString)) {
            return classString;
        }
        int start = 0;
        while (ClassTokens.isWhitespace(classString.charAt(start))) {
            start++;
        }
        int end = classString.length();
        while (ClassTokens.isWhitespace(classString.charAt(end - 1))) {
            end--;
        }
        String leading = classString.substring(0, start);
        String trailing = classString.substring(end);
        List<String> tokens = ClassTokens.split(classString.substring(start, end));
        return leading + rewriteTokens(tokens, obfuscate) + trailing;
    }

    private String rewriteTokens(List<String> tokens, boolean obfuscate) {
        String whole = attempt(tokens, obfuscate);
        if (whole != null) {
            return whole;
        }
        if (tokens.size() == 1) {
            return tokens.get(0);
        }

        String tail = attempt(tokens.subList(1, tokens.size()), obfuscate);
        if (tail != null) {
            return tokens.get(0) + " " + tail;
        }
        String head = attempt(tokens.subList(0, tokens.size() - 1), obfuscate);
        if (head != null) {
            return head + " " + tokens.get(tokens.size() - 1);
        }

        List<String> out = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            String single = attempt(List.of(token), obfuscate);
            out.add(single != null ? single : token);
        }
        return String.join(" ", out);
    }

    /**
     * Classify the joined tokens; {@code null} when the compiler refuses or
     * returns a different number of tokens.
     */
    private String attempt(List<String> tokens, boolean obfuscate) {
        String joined = String.join(" ", tokens);
        try {
            String result = compiler.classify(joined, obfuscate);
            if (result == null || ClassTokens.count(result) != tokens.size()) {
                logger.debug("Discarding rewrite of '{}': token count changed", joined);
                return null;
            }
            return ClassTokens.normalize(result);
        } catch (ClassifyException e) {
            logger.trace("'{}' rejected: {}", joined, e.getMessage());
            return null;
        }
    }
}
