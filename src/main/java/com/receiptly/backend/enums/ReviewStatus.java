package com.receiptly.backend.enums;

public enum ReviewStatus {
    PENDING,
    CONFIRMED,
    CORRECTED
}
