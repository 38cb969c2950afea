package com.receiptly.backend.services.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.receiptly.backend.classification.CategoryResult;
import com.receiptly.backend.classification.ClassificationService;
import com.receiptly.backend.config.ExtractionProperties;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.enums.ReviewStatus;
import com.receiptly.backend.services.ocr.PdfTextLayerReader;
import com.receiptly.backend.services.ocr.TextExtractionResult;
import com.receiptly.backend.services.ocr.TextExtractor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bytes in, reviewable fields out: text, field heuristics, quality score and category.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceiptExtractionPipeline {

    private final TextExtractor textExtractor;
    private final PdfTextLayerReader pdfTextLayerReader;
    private final ExtractionQualityEvaluator qualityEvaluator;
    private final ClassificationService classificationService;
    private final ExtractionProperties extractionProperties;

    /**
     * @throws com.receiptly.backend.services.ocr.ExtractionException when the OCR provider fails
     */
    public ExtractedFields process(byte[] bytes, String filename, UUID ownerId) {
        TextExtractionResult ocr = readText(bytes);
        String text = ocr.text();

        BigDecimal totalAmount = ReceiptFieldExtractor.extractTotalAmount(text).orElse(null);
        LocalDate transactionDate = ReceiptFieldExtractor.extractTransactionDate(text).orElse(null);
        String vendorName = ReceiptFieldExtractor.inferVendorName(text, filename).orElse(null);
        String excerpt = ReceiptFieldExtractor.buildTextExcerpt(text, extractionProperties.getExcerptLimit()).orElse(null);

        ExtractionQuality quality = qualityEvaluator.evaluate(text, totalAmount, transactionDate, vendorName);
        CategoryResult category = classificationService.categorize(vendorName, describe(vendorName, filename), ownerId);

        log.info("[Extraction] provider={} filename='{}' vendor='{}' amount={} date={} confidence={} category={} ({})",
                ocr.provider(), filename, vendorName, totalAmount, transactionDate,
                quality.confidence(), category.category(), category.source());

        return ExtractedFields.builder()
                .vendorName(vendorName)
                .totalAmount(totalAmount)
                .transactionDate(transactionDate)
                .textExcerpt(excerpt)
                .currency(extractionProperties.getDefaultCurrency())
                .suggestedCategory(category.category())
                .expenseArticle(category.expenseArticle())
                .potentiallyDeductible(category.potentiallyDeductible())
                .categorySource(category.source())
                .reviewStatus(ReviewStatus.PENDING)
                .ocrProvider(ocr.provider())
                .ocrConfidence(quality.confidence())
                .needsReview(quality.needsReview())
                .reviewReason(quality.reason())
                .build();
    }

    private TextExtractionResult readText(byte[] bytes) {
        return pdfTextLayerReader.readTextLayer(bytes)
                .map(text -> new TextExtractionResult(PdfTextLayerReader.PROVIDER, text))
                .orElseGet(() -> textExtractor.extract(bytes));
    }

    private static String describe(String vendorName, String filename) {
        StringBuilder sb = new StringBuilder();
        if (vendorName != null) sb.append(vendorName);
        if (filename != null && !filename.isBlank()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(filename);
        }
        return sb.toString();
    }
}
