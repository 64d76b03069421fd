package com.raditha.twx.exceptions;

public class ConfigException extends ExtractorException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
