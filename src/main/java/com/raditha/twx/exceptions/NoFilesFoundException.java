package com.raditha.twx.exceptions;

import java.util.List;

public class NoFilesFoundException extends ExtractorException {

    public NoFilesFoundException(List<String> patterns) {
        super("No files found matching patterns: " + String.join(", ", patterns));
    }

    public NoFilesFoundException(List<String> patterns, int rejected) {
        super("No processable files matching patterns: " + String.join(", ", patterns)
                + " (" + rejected + " rejected by security checks)");
    }
}
