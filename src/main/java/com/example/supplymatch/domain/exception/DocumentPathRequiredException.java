package com.example.supplymatch.domain.exception;

/**
 * Raised when a caller asks to parse a {@code null} {@link java.nio.file.Path}.
 */
public class DocumentPathRequiredException extends DomainException {

    public DocumentPathRequiredException() {
        super("Document path is required.");
    }
}
