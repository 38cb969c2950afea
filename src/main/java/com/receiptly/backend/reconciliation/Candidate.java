package com.receiptly.backend.reconciliation;

import java.math.BigDecimal;

import com.receiptly.backend.entities.LedgerTransaction;

/**
 * A bank-feed transaction proposed as the counterpart of a receipt draft.
 *
 * @param amountDelta candidate amount minus draft amount
 * @param dayDelta    days from the draft date to the candidate date
 * @param score       1.0 for an exact amount and date, falling towards 0 at the tolerance edges
 */
public record Candidate(LedgerTransaction transaction, BigDecimal amountDelta, long dayDelta, double score) {
}
