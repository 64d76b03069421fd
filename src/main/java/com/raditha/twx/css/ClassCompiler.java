package com.raditha.twx.css;

import com.raditha.twx.exceptions.BundleException;
import com.raditha.twx.exceptions.ClassifyException;

import java.util.Collection;

/**
 * Knows which utility classes exist and how to turn them into CSS.
 */
public interface ClassCompiler {

    /**
     * Rewrite a whitespace separated class list. Without obfuscation the
     * result is the normalized list; with it, recognised utilities are
     * replaced by their aliases.
     *
     * @throws ClassifyException when a token is not a known utility and the
     *                           compiler does not pass unknown tokens through
     */
    String classify(String classes, boolean obfuscate) throws ClassifyException;

    /**
     * Produce the stylesheet for the given class names. Unknown names are
     * ignored.
     */
    String bundle(Collection<String> classes, BundleOptions options) throws BundleException;

    boolean isUtility(String token);
}
