package com.receiptly.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Candidate matching settings, prefix "receiptly.reconciliation".
 */
@Data
@Component
@ConfigurationProperties(prefix = "receiptly.reconciliation")
public class ReconciliationProperties {

    private int candidateLimit = 3;

    private int maxCandidateLimit = 20;

    /**
     * Relative tolerance on the absolute amount (0.05 = 5%).
     */
    private BigDecimal amountTolerance = new BigDecimal("0.05");

    /**
     * Floor for the amount tolerance, in currency units.
     */
    private BigDecimal minAmountTolerance = new BigDecimal("1.00");

    private int dateWindowDays = 7;

    private String draftIdPrefix = "receipt-";
}
