package com.receiptly.backend.services.ocr;

public record TextExtractionResult(String provider, String text) {

    public TextExtractionResult {
        text = text == null ? "" : text;
    }
}
