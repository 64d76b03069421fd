package com.raditha.twx.exceptions;

/**
 * Base type for every failure the extractor reports.
 * <p>
 * Subclasses carry the offending path, pattern or token in their message so
 * the command line can print them without further context.
 */
public class ExtractorException extends Exception {

    public ExtractorException(String message) {
        super(message);
    }

    public ExtractorException(String message, Throwable cause) {
        super(message, cause);
    }
}
