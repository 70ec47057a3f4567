package com.example.chronology.domain.exception;

/**
 * Raised when a chronology request arrives without any uploaded document.
 */
public class DocumentFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public DocumentFileRequiredException() {
        super("Please choose at least one PDF, DOCX or TXT document to upload.");
    }
}
