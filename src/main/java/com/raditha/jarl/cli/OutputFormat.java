package com.raditha.jarl.cli;

/**
 * How diagnostics are written to standard output.
 */
public enum OutputFormat {
    /**
     * One line per diagnostic.
     */
    CONCISE,

    /**
     * Diagnostic with the offending source line underlined. The default.
     */
    FULL,

    /**
     * Machine readable JSON document.
     */
    JSON,

    /**
     * GitHub Actions workflow commands, rendered as annotations.
     */
    GITHUB;

    /**
     * Convert a string value to OutputFormat enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding OutputFormat
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static OutputFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OutputFormat value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "concise" -> CONCISE;
            case "full" -> FULL;
            case "json" -> JSON;
            case "github" -> GITHUB;
            default -> throw new IllegalArgumentException(
                    "Invalid output format: " + value + ". Must be: concise, full, json, or github");
        };
    }

    /**
     * Get the string representation of this format for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case CONCISE -> "concise";
            case FULL -> "full";
            case JSON -> "json";
            case GITHUB -> "github";
        };
    }
}
