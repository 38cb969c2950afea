package com.receiptly.backend.mappers;

import java.util.LinkedHashSet;

import com.receiptly.backend.dto.CandidateDTO;
import com.receiptly.backend.dto.DraftCandidatesDTO;
import com.receiptly.backend.dto.ReceiptDraftResultDTO;
import com.receiptly.backend.dto.TransactionResponseDTO;
import com.receiptly.backend.entities.LedgerTransaction;
import com.receiptly.backend.reconciliation.Candidate;
import com.receiptly.backend.reconciliation.DraftCandidates;
import com.receiptly.backend.reconciliation.ReceiptDraftResult;

public class TransactionMapper {

    private TransactionMapper() {}

    public static TransactionResponseDTO toResponseDTO(LedgerTransaction entity) {
        return new TransactionResponseDTO(
                entity.getId(),
                entity.getProviderTransactionId(),
                entity.getAmount(),
                entity.getCurrency(),
                entity.getTransactionDate(),
                entity.getDescription(),
                entity.getCategory(),
                entity.getSource(),
                entity.getDocumentId(),
                entity.getReconciliationStatus(),
                entity.getMatchedTransactionId(),
                new LinkedHashSet<>(entity.getIgnoredCandidateIds()),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    public static CandidateDTO toCandidateDTO(Candidate candidate) {
        return new CandidateDTO(
                toResponseDTO(candidate.transaction()),
                candidate.amountDelta(),
                candidate.dayDelta(),
                candidate.score()
        );
    }

    public static DraftCandidatesDTO toDraftCandidatesDTO(DraftCandidates draftCandidates) {
        return new DraftCandidatesDTO(
                toResponseDTO(draftCandidates.draft()),
                draftCandidates.candidates().stream().map(TransactionMapper::toCandidateDTO).toList()
        );
    }

    public static ReceiptDraftResultDTO toDraftResultDTO(ReceiptDraftResult result) {
        return new ReceiptDraftResultDTO(toResponseDTO(result.transaction()), result.duplicated());
    }
}
