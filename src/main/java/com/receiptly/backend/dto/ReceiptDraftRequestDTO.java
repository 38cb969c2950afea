package com.receiptly.backend.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ReceiptDraftRequestDTO(@NotNull UUID documentId) {
}
