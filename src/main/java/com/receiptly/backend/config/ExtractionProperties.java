package com.receiptly.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Field extraction settings, prefix "receiptly.extraction".
 *
 * Example:
 * receiptly.extraction.excerpt-limit=320
 * receiptly.extraction.review-threshold=0.75
 * receiptly.extraction.default-currency=GBP
 */
@Data
@Component
@ConfigurationProperties(prefix = "receiptly.extraction")
public class ExtractionProperties {

    /**
     * Maximum length of the stored text excerpt, ellipsis included.
     */
    private int excerptLimit = 320;

    /**
     * Below this confidence a document is queued for human review.
     */
    private double reviewThreshold = 0.75;

    /**
     * Passed through to drafts; no conversion is done.
     */
    private String defaultCurrency = "GBP";
}
