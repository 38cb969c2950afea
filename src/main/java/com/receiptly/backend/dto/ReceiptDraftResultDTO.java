package com.receiptly.backend.dto;

public record ReceiptDraftResultDTO(TransactionResponseDTO transaction, boolean duplicated) {
}
