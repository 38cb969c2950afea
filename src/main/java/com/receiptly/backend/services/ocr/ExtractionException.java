package com.receiptly.backend.services.ocr;

/**
 * The OCR provider could not return text for a document (network, auth, quota, bad input...).
 */
public class ExtractionException extends RuntimeException {

    private final String provider;

    public ExtractionException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ExtractionException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
