package com.example.chronology.application.exception;

/**
 * Thrown when a chronology table cannot be exported, typically because nothing has been extracted yet.
 */
public class ChronologyExportValidationException extends UseCaseValidationException {

	/**
	 * Creates a new exception describing why the export request is invalid.
	 *
	 * @param message validation message suitable for display
	 */
    public ChronologyExportValidationException(String message) {
        super(message);
    }
}
