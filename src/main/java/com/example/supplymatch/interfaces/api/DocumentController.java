package com.example.supplymatch.interfaces.api;

import com.example.supplymatch.application.service.DocumentParsingService;
import com.example.supplymatch.application.service.ReconciliationService;
import com.example.supplymatch.domain.model.DocumentReconciliation;
import com.example.supplymatch.domain.model.ParsedDocument;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Interfaces-layer REST controller for invoice uploads.
 */
@RestController
@RequestMapping(value = "/api/documents", produces = MediaType.APPLICATION_JSON_VALUE)
public class DocumentController {

    private final DocumentParsingService documentParsingService;
    private final ReconciliationService reconciliationService;

    public DocumentController(DocumentParsingService documentParsingService, ReconciliationService reconciliationService) {
        this.documentParsingService = documentParsingService;
        this.reconciliationService = reconciliationService;
    }

    /**
     * Extracts line items and the supplier name without touching the catalog.
     *
     * @param file uploaded PDF or spreadsheet
     * @return parsed document; an empty line item list means no product table was recognized
     */
    @PostMapping("/parse")
    public ResponseEntity<ParsedDocument> parse(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(documentParsingService.parseDocument(file));
    }

    /**
     * Extracts line items and proposes a catalog item for each of them.
     *
     * @param file uploaded PDF or spreadsheet
     * @return proposals for every line plus the matched supplier
     */
    @PostMapping("/reconcile")
    public ResponseEntity<DocumentReconciliation> reconcile(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(reconciliationService.processDocument(file));
    }
}
