package com.example.supplymatch.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects positioned words from every page of a PDF, grouped into {@link TableLine}s by their
 * vertical position.
 */
public class PdfTableReader {

    /**
     * Reads all pages.
     *
     * @param document loaded PDF document
     * @return one list of lines per page, each sorted top to bottom
     * @throws IOException when PDFBox cannot read the page content
     */
    public List<List<TableLine>> readPages(PDDocument document) throws IOException {
        LineCollectingStripper stripper = new LineCollectingStripper();
        configureStripper(stripper);
        stripper.setStartPage(1);
        stripper.setEndPage(document.getNumberOfPages());
        stripper.getText(document);
        return stripper.pages();
    }

    /**
     * Plain text of one page, used to find the seller block.
     *
     * @param document   loaded PDF document
     * @param pageNumber 1-based page number
     * @return page text with lines separated by {@code \n}
     * @throws IOException when PDFBox cannot read the page content
     */
    public String readPageText(PDDocument document, int pageNumber) throws IOException {
        if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
            return "";
        }
        PDFTextStripper stripper = new PDFTextStripper();
        configureStripper(stripper);
        stripper.setLineSeparator("\n");
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        return stripper.getText(document);
    }

    private void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
    }

    /**
     * Records every word with its position instead of only writing text.
     */
    private static final class LineCollectingStripper extends PDFTextStripper {
        private static final float Y_TOLERANCE = 1.5f;
        private static final float MIN_WIDTH = 0.5f;
        private final List<List<TableLine>> pages = new ArrayList<>();
        private List<TableLine> currentPage = new ArrayList<>();

        LineCollectingStripper() throws IOException {
            super();
        }

        List<List<TableLine>> pages() {
            return pages;
        }

        @Override
        protected void startPage(PDPage page) throws IOException {
            currentPage = new ArrayList<>();
            super.startPage(page);
        }

        @Override
        protected void endPage(PDPage page) throws IOException {
            currentPage.removeIf(TableLine::isEmpty);
            currentPage.sort(Comparator.comparing(TableLine::y));
            pages.add(currentPage);
            super.endPage(page);
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            List<TextPosition> word = new ArrayList<>();
            for (TextPosition position : textPositions) {
                String unicode = position.getUnicode();
                if (unicode == null || unicode.isBlank()) {
                    addToken(word);
                    word = new ArrayList<>();
                } else {
                    word.add(position);
                }
            }
            addToken(word);
            super.writeString(text, textPositions);
        }

        private void addToken(List<TextPosition> word) {
            if (word.isEmpty()) {
                return;
            }
            StringBuilder builder = new StringBuilder();
            float startX = Float.MAX_VALUE;
            float endX = -Float.MAX_VALUE;
            float y = Float.MAX_VALUE;
            for (TextPosition position : word) {
                builder.append(position.getUnicode());
                startX = Math.min(startX, position.getXDirAdj());
                endX = Math.max(endX, position.getXDirAdj() + Math.max(position.getWidthDirAdj(), MIN_WIDTH));
                y = Math.min(y, position.getYDirAdj());
            }
            resolveLine(y).addToken(new PositionedToken(startX, endX, builder.toString()));
        }

        private TableLine resolveLine(float y) {
            for (TableLine line : currentPage) {
                if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                    return line;
                }
            }
            TableLine line = new TableLine(y);
            currentPage.add(line);
            return line;
        }
    }
}
