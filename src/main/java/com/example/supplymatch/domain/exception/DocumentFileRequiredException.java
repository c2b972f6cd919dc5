package com.example.supplymatch.domain.exception;

/**
 * Raised when an upload flow runs without an invoice file attached.
 */
public class DocumentFileRequiredException extends DomainException {

    public DocumentFileRequiredException() {
        super("Please choose an invoice file (PDF or Excel) to upload.");
    }
}
