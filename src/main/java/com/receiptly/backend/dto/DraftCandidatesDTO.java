package com.receiptly.backend.dto;

import java.util.List;

public record DraftCandidatesDTO(TransactionResponseDTO draft, List<CandidateDTO> candidates) {
}
