package com.raditha.twx.css;

/**
 * One {@code property: value} pair.
 */
public record Declaration(String property, String value) {

    public Declaration important() {
        return new Declaration(property, value + " !important");
    }

    @Override
    public String toString() {
        return property + ": " + value;
    }
}
