package com.raditha.twx.exceptions;

public class BundleException extends ExtractorException {

    public BundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
