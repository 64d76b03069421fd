package com.raditha.twx.exceptions;

/**
 * The class compiler did not recognise a token. Thrown only in strict mode;
 * the rewriter recovers from it token by token.
 */
public class ClassifyException extends ExtractorException {

    private final String token;

    public ClassifyException(String token) {
        super("Unrecognised utility class: " + token);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
