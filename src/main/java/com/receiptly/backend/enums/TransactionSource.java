package com.receiptly.backend.enums;

/**
 * Where a ledger row came from: the bank-feed importer or a processed receipt.
 */
public enum TransactionSource {
    BANK_FEED,
    RECEIPT_DRAFT
}
