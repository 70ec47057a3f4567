package com.example.chronology.domain.exception;

/**
 * Raised when a referenced file or directory does not exist on disk.
 */
public class DocumentNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public DocumentNotFoundException(String path) {
        super("Document not found: " + path);
    }
}
