package com.receiptly.backend.services.extraction;

public record ExtractionQuality(double confidence, boolean needsReview, String reason) {
}
