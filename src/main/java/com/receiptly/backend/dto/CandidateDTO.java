package com.receiptly.backend.dto;

import java.math.BigDecimal;

public record CandidateDTO(
        TransactionResponseDTO transaction,
        BigDecimal amountDelta,
        long dayDelta,
        double score
) {
}
