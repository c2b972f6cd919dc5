package com.example.supplymatch.infrastructure.exception;

/**
 * Signals that an invoice could not be read at all, for example a corrupt PDF or workbook.
 */
public class DocumentProcessingException extends InfrastructureException {

    /**
     * @param message description shared with the application layer
     * @param cause   low-level PDFBox, POI or IO exception
     */
    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
