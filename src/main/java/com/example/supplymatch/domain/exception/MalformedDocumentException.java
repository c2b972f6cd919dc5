package com.example.supplymatch.domain.exception;

/**
 * Raised when a document was readable but no line items could be extracted from it,
 * typically because no table header was recognized.
 */
public class MalformedDocumentException extends DomainException {

    /**
     * @param fileName name of the document that produced no line items
     */
    public MalformedDocumentException(String fileName) {
        super("No product lines could be extracted from " + (fileName != null ? fileName : "the document")
                + ". Check that the invoice contains a product table.");
    }
}
