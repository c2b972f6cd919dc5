package com.example.supplymatch.domain.exception;

/**
 * Raised when the uploaded file is neither a PDF nor a spreadsheet we know how to read.
 */
public class UnsupportedDocumentFormatException extends DomainException {

    /**
     * @param fileName original file name supplied by the client
     */
    public UnsupportedDocumentFormatException(String fileName) {
        super("Only PDF and Excel invoices are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
