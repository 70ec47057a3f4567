package com.example.chronology.application.exception;

/**
 * Signals that a secondary-extractor response did not have the expected {@code {"rows":[...]}} shape.
 * The whole response is discarded for that chunk.
 */
public class ExtractionResponseException extends ApplicationException {

    public ExtractionResponseException(String message) {
        super(message);
    }

    public ExtractionResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
