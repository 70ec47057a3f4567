package com.example.chronology.domain.model;

import java.util.Locale;

/**
 * Domain enumeration describing how the chronology table is serialized.
 */
public enum OutputFormat {
    CSV("text/csv", "csv"),
    JSON("application/json", "json");

    private final String mediaType;
    private final String extension;

    OutputFormat(String mediaType, String extension) {
        this.mediaType = mediaType;
        this.extension = extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public String extension() {
        return extension;
    }

	/**
	 * Parses a request parameter into an {@link OutputFormat}.
	 * Invalid or missing values fall back to {@link #CSV}.
	 *
	 * @param rawValue value supplied by the caller
	 * @return parsed format
	 */
    public static OutputFormat fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return CSV;
        }
        try {
            return OutputFormat.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return CSV;
        }
    }

	/**
	 * Picks the format from an output file name: {@code .json} selects JSON, anything else CSV.
	 *
	 * @param fileName output file name or path
	 * @return format implied by the extension
	 */
    public static OutputFormat fromFileName(String fileName) {
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return JSON;
        }
        return CSV;
    }
}
