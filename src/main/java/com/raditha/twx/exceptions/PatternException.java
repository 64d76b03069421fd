package com.raditha.twx.exceptions;

public class PatternException extends ExtractorException {

    private final String pattern;

    public PatternException(String pattern, Throwable cause) {
        super("Invalid glob pattern '" + pattern + "': " + cause.getMessage(), cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
