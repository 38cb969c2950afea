package com.receiptly.backend.reconciliation;

import com.receiptly.backend.entities.LedgerTransaction;

/**
 * @param duplicated true when the draft already existed and nothing was inserted
 */
public record ReceiptDraftResult(LedgerTransaction transaction, boolean duplicated) {
}
