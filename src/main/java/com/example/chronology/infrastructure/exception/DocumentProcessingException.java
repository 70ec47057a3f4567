package com.example.chronology.infrastructure.exception;

/**
 * Signals that a document could not be read by PDFBox, POI or the text decoder.
 */
public class DocumentProcessingException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from the parsing library.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level parsing exception
	 */
    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
