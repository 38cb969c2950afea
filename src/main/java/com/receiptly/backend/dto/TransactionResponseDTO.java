package com.receiptly.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.UUID;

import com.receiptly.backend.enums.ReconciliationStatus;
import com.receiptly.backend.enums.TransactionSource;

public record TransactionResponseDTO(
        UUID id,
        String providerTransactionId,
        BigDecimal amount,
        String currency,
        LocalDate transactionDate,
        String description,
        String category,
        TransactionSource source,
        UUID documentId,
        ReconciliationStatus reconciliationStatus,
        UUID matchedTransactionId,
        Set<String> ignoredCandidateIds,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
