package com.example.supplymatch.infrastructure.pdf;

import com.example.supplymatch.application.port.DocumentAdapter;
import com.example.supplymatch.domain.model.DocumentFormat;
import com.example.supplymatch.domain.model.LineItem;
import com.example.supplymatch.domain.model.ParsedDocument;
import com.example.supplymatch.domain.parsing.ExtractionProfile;
import com.example.supplymatch.domain.parsing.SourcePage;
import com.example.supplymatch.domain.parsing.SourceTable;
import com.example.supplymatch.domain.parsing.SupplierNameExtractor;
import com.example.supplymatch.domain.parsing.TableExtractor;
import com.example.supplymatch.infrastructure.exception.DocumentProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads tabular invoice PDFs (счёт-фактура, УПД) with PDFBox.
 */
public class PdfInvoiceAdapter implements DocumentAdapter {

    private final PdfTableReader tableReader;
    private final TableLineAssembler assembler;
    private final TableExtractor extractor;

    public PdfInvoiceAdapter(ExtractionProfile profile) {
        this(new PdfTableReader(), profile);
    }

    PdfInvoiceAdapter(PdfTableReader tableReader, ExtractionProfile profile) {
        this.tableReader = tableReader;
        this.assembler = new TableLineAssembler(profile.vocabulary());
        this.extractor = new TableExtractor(profile);
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PDF;
    }

    @Override
    public boolean supports(String fileName, String contentType) {
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public ParsedDocument read(byte[] content, String fileName) {
        try (PDDocument document = Loader.loadPDF(content)) {
            String supplierName = SupplierNameExtractor.fromText(tableReader.readPageText(document, 1)).orElse(null);
            List<SourceTable> tables = assembler.assemble(tableReader.readPages(document));
            List<SourcePage> pages = new ArrayList<>(tables.size());
            for (int i = 0; i < tables.size(); i++) {
                pages.add(new SourcePage(i + 1, List.of(tables.get(i))));
            }
            List<LineItem> items = extractor.extract(pages);
            return new ParsedDocument(fileName, DocumentFormat.PDF, items, supplierName);
        } catch (IOException e) {
            throw new DocumentProcessingException("Unable to process the PDF " + fileName + ".", e);
        }
    }
}
