package com.receiptly.backend.services.ocr;

/**
 * Turns document bytes into raw text using one OCR provider.
 *
 * Implementations make a single provider call with no retries and report provider
 * failures as {@link ExtractionException}. Empty input yields empty text.
 */
public interface TextExtractor {

    String providerName();

    TextExtractionResult extract(byte[] documentBytes);
}
