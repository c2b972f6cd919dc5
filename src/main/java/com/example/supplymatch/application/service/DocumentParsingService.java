package com.example.supplymatch.application.service;

import com.example.supplymatch.application.port.DocumentAdapter;
import com.example.supplymatch.domain.exception.DocumentFileRequiredException;
import com.example.supplymatch.domain.exception.DocumentNotFoundException;
import com.example.supplymatch.domain.exception.DocumentPathRequiredException;
import com.example.supplymatch.domain.exception.UnsupportedDocumentFormatException;
import com.example.supplymatch.domain.model.ParsedDocument;
import com.example.supplymatch.infrastructure.exception.DocumentProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Application-layer service that turns an uploaded or on-disk invoice into a {@link ParsedDocument}.
 * It validates inputs and picks the {@link DocumentAdapter} that understands the file.
 */
@Service
public class DocumentParsingService {

    private static final Logger log = LoggerFactory.getLogger(DocumentParsingService.class);

    private final List<DocumentAdapter> adapters;

    public DocumentParsingService(List<DocumentAdapter> adapters) {
        this.adapters = List.copyOf(adapters);
    }

    /**
     * Parses an uploaded invoice.
     *
     * @param file uploaded PDF or spreadsheet
     * @return parsed document, possibly without line items
     * @throws DocumentFileRequiredException       when the file is null or empty
     * @throws UnsupportedDocumentFormatException  when no adapter accepts the file
     * @throws DocumentProcessingException         when the bytes cannot be read
     */
    public ParsedDocument parseDocument(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DocumentFileRequiredException();
        }
        String fileName = resolveFileName(file.getOriginalFilename());
        DocumentAdapter adapter = findAdapter(file.getOriginalFilename(), file.getContentType())
                .orElseThrow(() -> new UnsupportedDocumentFormatException(file.getOriginalFilename()));
        try {
            return parse(adapter, file.getBytes(), fileName);
        } catch (IOException e) {
            throw new DocumentProcessingException("Unable to read the uploaded file.", e);
        }
    }

    /**
     * Parses an invoice stored on disk.
     *
     * @param documentPath path of a PDF or spreadsheet
     * @return parsed document, possibly without line items
     * @throws DocumentPathRequiredException when {@code documentPath} is null
     * @throws DocumentNotFoundException     when the path does not exist
     */
    public ParsedDocument parseDocument(Path documentPath) {
        if (documentPath == null) {
            throw new DocumentPathRequiredException();
        }
        if (!Files.exists(documentPath)) {
            throw new DocumentNotFoundException(documentPath.toAbsolutePath().toString());
        }
        String fileName = documentPath.getFileName() != null ? documentPath.getFileName().toString() : null;
        DocumentAdapter adapter = findAdapter(fileName, null)
                .orElseThrow(() -> new UnsupportedDocumentFormatException(fileName));
        try {
            return parse(adapter, Files.readAllBytes(documentPath), resolveFileName(fileName));
        } catch (IOException e) {
            throw new DocumentProcessingException("Unable to read the document at " + documentPath, e);
        }
    }

    private ParsedDocument parse(DocumentAdapter adapter, byte[] content, String fileName) {
        ParsedDocument document = adapter.read(content, fileName);
        log.info("Parsed {} as {}: {} line item(s), supplier {}", fileName, adapter.format(),
                document.lineItems().size(), document.supplierName() != null ? "'" + document.supplierName() + "'" : "not found");
        return document;
    }

    private Optional<DocumentAdapter> findAdapter(String fileName, String contentType) {
        return adapters.stream()
                .filter(adapter -> adapter.supports(fileName, contentType))
                .findFirst();
    }

    private String resolveFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "uploaded-invoice";
        }
        return fileName;
    }
}
