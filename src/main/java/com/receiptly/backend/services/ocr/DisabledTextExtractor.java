package com.receiptly.backend.services.ocr;

public class DisabledTextExtractor implements TextExtractor {

    @Override
    public String providerName() {
        return "disabled";
    }

    @Override
    public TextExtractionResult extract(byte[] documentBytes) {
        throw new ExtractionException(providerName(), "OCR is disabled. Enable it with receiptly.ocr.enabled=true");
    }
}
