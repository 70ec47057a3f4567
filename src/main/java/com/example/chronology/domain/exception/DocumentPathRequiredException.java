package com.example.chronology.domain.exception;

/**
 * Raised when a caller asks for a chronology of a null {@link java.nio.file.Path}.
 */
public class DocumentPathRequiredException extends DomainException {

    public DocumentPathRequiredException() {
        super("Document path is required.");
    }
}
