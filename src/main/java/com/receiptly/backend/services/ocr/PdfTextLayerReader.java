package com.receiptly.backend.services.ocr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the embedded text of digitally generated PDF receipts so they skip OCR.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfTextLayerReader {

    public static final String PROVIDER = "pdf-text";

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final OcrProperties ocrProperties;

    public static boolean isPdf(byte[] bytes) {
        if (bytes == null || bytes.length < PDF_MAGIC.length) return false;
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (bytes[i] != PDF_MAGIC[i]) return false;
        }
        return true;
    }

    /**
     * @return the text layer when the document is a PDF whose text is long enough to parse
     */
    public Optional<String> readTextLayer(byte[] bytes) {
        if (!isPdf(bytes)) return Optional.empty();

        int maxPages = Math.max(1, ocrProperties.getPdf().getMaxPages());
        int minTextLength = Math.max(1, ocrProperties.getPdf().getMinTextLength());

        try (PDDocument document = PDDocument.load(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(1);
            stripper.setEndPage(Math.min(maxPages, document.getNumberOfPages()));
            String text = stripper.getText(document);
            int length = text == null ? 0 : text.trim().length();
            if (length < minTextLength) {
                log.debug("[OCR] PDF text layer too short ({} chars), falling back to OCR", length);
                return Optional.empty();
            }
            return Optional.of(text);
        } catch (IOException e) {
            log.info("[OCR] PDF text layer unreadable, falling back to OCR: {}", e.toString());
            return Optional.empty();
        }
    }
}
