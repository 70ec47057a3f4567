package com.example.chronology.domain.exception;

/**
 * Raised when no loader accepts a file's extension.
 * The batch pipeline records it as a skipped document rather than failing the whole request.
 */
public class UnsupportedDocumentFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedDocumentFormatException(String fileName) {
        super("Only PDF, DOCX and TXT documents are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
