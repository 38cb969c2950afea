package com.receiptly.backend.services;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.exceptions.BadRequestException;
import com.receiptly.backend.reconciliation.ReceiptDraftResult;
import com.receiptly.backend.reconciliation.ReceiptDraftService;
import com.receiptly.backend.repositories.DocumentRepository;
import com.receiptly.backend.services.extraction.ReceiptExtractionPipeline;
import com.receiptly.backend.services.ocr.ExtractionException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a document from UPLOADED through PROCESSING to COMPLETED or FAILED.
 *
 * The uploaded bytes are not persisted here; they travel with the dispatch call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

    static final int MAX_ERROR_LENGTH = 2000;

    private final DocumentRepository documentRepository;
    private final ReceiptExtractionPipeline extractionPipeline;
    private final ReceiptDraftService receiptDraftService;

    @Transactional
    public Document createDocument(UUID ownerId, String filename, String contentType) {
        if (ownerId == null) {
            throw new BadRequestException("Owner is required");
        }
        String name = filename == null || filename.isBlank() ? "upload" : filename.trim();

        Document document = new Document();
        document.setOwnerId(ownerId);
        document.setFilename(name);
        document.setContentType(contentType);
        document.setStatus(DocumentStatus.UPLOADED);
        return documentRepository.save(document);
    }

    public Optional<Document> findByIdForOwner(UUID documentId, UUID ownerId) {
        return documentRepository.findByIdAndOwnerId(documentId, ownerId);
    }

    public List<Document> listForOwner(UUID ownerId) {
        return documentRepository.findByOwnerIdOrderByUploadedAtDesc(ownerId);
    }

    @Async("documentProcessingTaskExecutor")
    public void startProcessing(UUID documentId, byte[] bytes) {
        if (documentId == null) return;
        processDocument(documentId, bytes);
    }

    /**
     * Runs extraction for one document. Never leaves it PROCESSING: any failure, OCR or
     * otherwise, ends in FAILED with the error message kept on the document.
     *
     * OCR runs outside any database transaction; each status write commits on its own.
     */
    public void processDocument(UUID documentId, byte[] bytes) {
        Document document = documentRepository.findById(documentId).orElse(null);
        if (document == null) {
            log.warn("[DocumentProcessing] document not found: {}", documentId);
            return;
        }

        if (document.getStatus() == DocumentStatus.COMPLETED
                || document.getStatus() == DocumentStatus.PROCESSING) {
            log.debug("[DocumentProcessing] skipping documentId={} status={}", documentId, document.getStatus());
            return;
        }

        document.setStatus(DocumentStatus.PROCESSING);
        document.setErrorMessage(null);
        document = documentRepository.save(document);

        try {
            ExtractedFields fields = extractionPipeline.process(bytes, document.getFilename(), document.getOwnerId());
            attachReceiptDraft(document, fields);

            document.setExtractedFields(fields);
            document.setStatus(DocumentStatus.COMPLETED);
            document.setProcessedAt(LocalDateTime.now());
            documentRepository.save(document);
            log.info("[DocumentProcessing] completed documentId={} needsReview={}", documentId, fields.getNeedsReview());

        } catch (ExtractionException e) {
            log.warn("[DocumentProcessing] OCR failed documentId={} provider={}: {}", documentId, e.getProvider(), e.getMessage());
            markFailed(document, e);
        } catch (Exception e) {
            log.error("[DocumentProcessing] failed documentId={}", documentId, e);
            markFailed(document, e);
        }
    }

    private void attachReceiptDraft(Document document, ExtractedFields fields) {
        if (fields.getTotalAmount() == null || fields.getTransactionDate() == null) {
            log.debug("[DocumentProcessing] no draft for documentId={}: amount or date missing", document.getId());
            return;
        }
        try {
            ReceiptDraftResult draft = receiptDraftService.createReceiptDraft(document.getOwnerId(), document.getId(), fields);
            fields.setReceiptDraftTransactionId(draft.transaction().getId());
            fields.setReceiptDraftDuplicated(draft.duplicated());
        } catch (RuntimeException e) {
            // the draft can be created later from the review screen
            log.warn("[DocumentProcessing] receipt draft failed for documentId={}: {}", document.getId(), e.getMessage());
        }
    }

    private void markFailed(Document document, Exception e) {
        document.setStatus(DocumentStatus.FAILED);
        document.setErrorMessage(trimError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        document.setProcessedAt(LocalDateTime.now());
        documentRepository.save(document);
    }

    static String trimError(String message) {
        if (message == null) return null;
        String m = message.trim();
        if (m.length() <= MAX_ERROR_LENGTH) return m;
        return m.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
