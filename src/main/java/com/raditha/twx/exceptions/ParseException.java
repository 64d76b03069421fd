package com.raditha.twx.exceptions;

/**
 * A source file could not be parsed.
 */
public class ParseException extends ExtractorException {

    private final String path;
    private final int line;
    private final int column;

    public ParseException(String path, int line, int column, String message) {
        super(String.format("Parse error in %s:%d:%d: %s", path, line, column, message));
        this.path = path;
        this.line = line;
        this.column = column;
    }

    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
