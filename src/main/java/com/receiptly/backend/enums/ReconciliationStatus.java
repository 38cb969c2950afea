package com.receiptly.backend.enums;

public enum ReconciliationStatus {
    UNRECONCILED,
    MATCHED,
    IGNORED
}
