package com.example.supplymatch.application.port;

import com.example.supplymatch.domain.model.DocumentFormat;
import com.example.supplymatch.domain.model.ParsedDocument;

/**
 * Reads one invoice format into line items and the printed supplier name.
 */
public interface DocumentAdapter {

    DocumentFormat format();

    /**
     * @param fileName    original file name, may be {@code null}
     * @param contentType MIME type reported by the client, may be {@code null}
     * @return {@code true} when this adapter can read the document
     */
    boolean supports(String fileName, String contentType);

    /**
     * Parses the document. A document without a recognizable product table yields an empty
     * line item list rather than an error.
     *
     * @param content  raw document bytes
     * @param fileName logical name used for display and logging
     * @return parsed document
     * @throws com.example.supplymatch.infrastructure.exception.DocumentProcessingException when the bytes cannot be read
     */
    ParsedDocument read(byte[] content, String fileName);
}
