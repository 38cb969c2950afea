package com.receiptly.backend.services.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.receiptly.backend.config.ExtractionProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores how complete an extraction is and decides whether it goes to the review queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExtractionQualityEvaluator {

    private static final double TEXT_WEIGHT = 0.2;
    private static final double AMOUNT_WEIGHT = 0.35;
    private static final double DATE_WEIGHT = 0.25;
    private static final double VENDOR_WEIGHT = 0.2;

    private final ExtractionProperties extractionProperties;

    public ExtractionQuality evaluate(String text, BigDecimal totalAmount, LocalDate transactionDate, String vendorName) {
        double score = 0.0;
        if (text != null && !text.isBlank()) score += TEXT_WEIGHT;
        if (totalAmount != null) score += AMOUNT_WEIGHT;
        if (transactionDate != null) score += DATE_WEIGHT;
        if (vendorName != null && !vendorName.isBlank()) score += VENDOR_WEIGHT;
        double confidence = Math.round(Math.min(score, 1.0) * 1000.0) / 1000.0;

        List<String> missing = new ArrayList<>();
        if (totalAmount == null) missing.add("total_amount");
        if (transactionDate == null) missing.add("transaction_date");
        if (vendorName == null || vendorName.isBlank()) missing.add("vendor_name");

        boolean needsReview = confidence < extractionProperties.getReviewThreshold() || !missing.isEmpty();
        String reason;
        if (!missing.isEmpty()) {
            reason = "missing_fields:" + String.join(",", missing);
        } else if (needsReview) {
            reason = "low_confidence";
        } else {
            reason = "high_confidence";
        }

        log.debug("[ExtractionQuality] confidence={} needsReview={} reason={}", confidence, needsReview, reason);
        return new ExtractionQuality(confidence, needsReview, reason);
    }
}
