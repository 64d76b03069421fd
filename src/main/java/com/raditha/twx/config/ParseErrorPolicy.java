package com.raditha.twx.config;

/**
 * What a multi-file run does when one file fails to parse.
 */
public enum ParseErrorPolicy {
    /**
     * Abort the run on the first parse error. Tasks that have not started yet
     * are cancelled and nothing is written.
     */
    FAIL,

    /**
     * Log a warning, count the file as skipped and carry on.
     */
    SKIP;

    /**
     * Convert a string value to a policy.
     *
     * @param value {@code fail} or {@code skip}, case-insensitive
     * @throws IllegalArgumentException if the value is not a valid policy
     */
    public static ParseErrorPolicy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ParseErrorPolicy value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "fail" -> FAIL;
            case "skip" -> SKIP;
            default -> throw new IllegalArgumentException(
                    "Invalid parse error policy: " + value + ". Must be: fail or skip");
        };
    }

    public String toCliString() {
        return switch (this) {
            case FAIL -> "fail";
            case SKIP -> "skip";
        };
    }
}
