package com.receiptly.backend.reconciliation;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.receiptly.backend.config.ReconciliationProperties;
import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.entities.LedgerTransaction;
import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.enums.ReconciliationStatus;
import com.receiptly.backend.enums.TransactionSource;
import com.receiptly.backend.exceptions.BadRequestException;
import com.receiptly.backend.exceptions.BusinessException;
import com.receiptly.backend.exceptions.ResourceNotFoundException;
import com.receiptly.backend.repositories.DocumentRepository;
import com.receiptly.backend.repositories.LedgerTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a processed receipt into exactly one draft transaction per (owner, document).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceiptDraftService {

    static final String UNKNOWN_VENDOR = "Unknown vendor";

    private final LedgerTransactionRepository transactionRepository;
    private final DocumentRepository documentRepository;
    private final ReceiptDraftWriter draftWriter;
    private final ReconciliationProperties reconciliationProperties;

    /**
     * Creates the draft or returns the existing one. Repeating the call, concurrently or not,
     * never inserts a second row.
     *
     * @throws BadRequestException when the fields carry no amount or no date
     */
    public ReceiptDraftResult createReceiptDraft(UUID ownerId, UUID documentId, ExtractedFields fields) {
        if (ownerId == null || documentId == null) {
            throw new BadRequestException("ownerId and documentId are required");
        }
        if (fields == null || fields.getTotalAmount() == null) {
            throw new BadRequestException("Receipt has no total amount; review it before creating a draft");
        }
        if (fields.getTransactionDate() == null) {
            throw new BadRequestException("Receipt has no transaction date; review it before creating a draft");
        }

        String providerTransactionId = draftProviderTransactionId(ownerId, documentId);

        Optional<LedgerTransaction> existing = transactionRepository
                .findByOwnerIdAndProviderTransactionId(ownerId, providerTransactionId);
        if (existing.isPresent()) {
            log.debug("[ReceiptDraft] Existing draft {} for documentId={}", existing.get().getId(), documentId);
            return new ReceiptDraftResult(existing.get(), true);
        }

        LedgerTransaction draft = LedgerTransaction.builder()
                .ownerId(ownerId)
                .providerTransactionId(providerTransactionId)
                .amount(draftAmount(fields.getTotalAmount()))
                .currency(fields.getCurrency())
                .transactionDate(fields.getTransactionDate())
                .description(describe(fields.getVendorName()))
                .category(fields.getSuggestedCategory())
                .source(TransactionSource.RECEIPT_DRAFT)
                .documentId(documentId)
                .reconciliationStatus(ReconciliationStatus.UNRECONCILED)
                .build();

        try {
            LedgerTransaction saved = draftWriter.insert(draft);
            log.info("[ReceiptDraft] Created draft {} for documentId={} amount={}",
                    saved.getId(), documentId, saved.getAmount());
            return new ReceiptDraftResult(saved, false);
        } catch (DataIntegrityViolationException e) {
            // lost the insert race; the winner's row is committed
            LedgerTransaction winner = transactionRepository
                    .findByOwnerIdAndProviderTransactionId(ownerId, providerTransactionId)
                    .orElseThrow(() -> e);
            log.info("[ReceiptDraft] Concurrent insert for documentId={}, reusing draft {}", documentId, winner.getId());
            return new ReceiptDraftResult(winner, true);
        }
    }

    /**
     * Creates the draft from the stored fields of a completed document and records the link on it.
     */
    public ReceiptDraftResult createReceiptDraftForDocument(UUID ownerId, UUID documentId) {
        Document document = documentRepository.findByIdAndOwnerId(documentId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Document not found"));
        if (document.getStatus() != DocumentStatus.COMPLETED) {
            throw new BusinessException("Document is not processed yet (status " + document.getStatus() + ")");
        }

        ExtractedFields fields = document.getExtractedFields();
        ReceiptDraftResult result = createReceiptDraft(ownerId, documentId, fields);

        if (!result.transaction().getId().equals(fields.getReceiptDraftTransactionId())) {
            fields.setReceiptDraftTransactionId(result.transaction().getId());
            fields.setReceiptDraftDuplicated(result.duplicated());
            documentRepository.save(document);
        }
        return result;
    }

    /**
     * Deterministic per (owner, document), so the unique constraint on
     * (owner_id, provider_transaction_id) deduplicates drafts.
     */
    public String draftProviderTransactionId(UUID ownerId, UUID documentId) {
        String seed = ownerId + ":" + documentId;
        return reconciliationProperties.getDraftIdPrefix()
                + UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    static String describe(String vendorName) {
        String vendor = vendorName == null ? "" : vendorName.trim();
        return "Receipt draft: " + (vendor.isEmpty() ? UNKNOWN_VENDOR : vendor);
    }

    /** Drafts are expenses: always negative. */
    static BigDecimal draftAmount(BigDecimal total) {
        return total.abs().negate();
    }
}
