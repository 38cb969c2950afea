package com.receiptly.backend.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.entities.LedgerTransaction;
import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.enums.ReviewStatus;
import com.receiptly.backend.exceptions.BadRequestException;
import com.receiptly.backend.reconciliation.ReceiptDraftResult;
import com.receiptly.backend.reconciliation.ReceiptDraftService;
import com.receiptly.backend.repositories.DocumentRepository;
import com.receiptly.backend.services.extraction.ReceiptExtractionPipeline;
import com.receiptly.backend.services.ocr.ExtractionException;

@SuppressWarnings("null")
class DocumentProcessingServiceTest {

    private final DocumentRepository documentRepository = Mockito.mock(DocumentRepository.class);
    private final ReceiptExtractionPipeline pipeline = Mockito.mock(ReceiptExtractionPipeline.class);
    private final ReceiptDraftService receiptDraftService = Mockito.mock(ReceiptDraftService.class);

    private final DocumentProcessingService service = new DocumentProcessingService(
            documentRepository,
            pipeline,
            receiptDraftService
    );

    private final byte[] bytes = "image".getBytes(StandardCharsets.UTF_8);
    private Document document;

    @BeforeEach
    void setUp() {
        document = new Document();
        document.setId(UUID.randomUUID());
        document.setOwnerId(UUID.randomUUID());
        document.setFilename("costa.jpg");
        document.setStatus(DocumentStatus.UPLOADED);

        when(documentRepository.findById(document.getId())).thenReturn(Optional.of(document));
        when(documentRepository.save(any(Document.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void processDocument_success_completesAndLinksDraft() {
        ExtractedFields fields = ExtractedFields.builder()
                .vendorName("Costa")
                .totalAmount(new BigDecimal("4.20"))
                .transactionDate(LocalDate.of(2026, 2, 13))
                .reviewStatus(ReviewStatus.PENDING)
                .needsReview(false)
                .build();
        when(pipeline.process(bytes, "costa.jpg", document.getOwnerId())).thenReturn(fields);
        LedgerTransaction draft = LedgerTransaction.builder().id(UUID.randomUUID()).build();
        when(receiptDraftService.createReceiptDraft(document.getOwnerId(), document.getId(), fields))
                .thenReturn(new ReceiptDraftResult(draft, false));

        service.processDocument(document.getId(), bytes);

        assertThat(document.getStatus()).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(document.getProcessedAt()).isNotNull();
        assertThat(document.getErrorMessage()).isNull();
        assertThat(document.getExtractedFields().getReceiptDraftTransactionId()).isEqualTo(draft.getId());
        assertThat(document.getExtractedFields().getReceiptDraftDuplicated()).isFalse();
    }

    @Test
    void processDocument_ocrFailure_marksFailed() {
        when(pipeline.process(any(), any(), any()))
                .thenThrow(new ExtractionException("google-vision", "google_vision_failed: PERMISSION_DENIED"));

        service.processDocument(document.getId(), bytes);

        assertThat(document.getStatus()).isEqualTo(DocumentStatus.FAILED);
        assertThat(document.getErrorMessage()).isEqualTo("google_vision_failed: PERMISSION_DENIED");
        assertThat(document.getExtractedFields()).isNull();
        verify(receiptDraftService, never()).createReceiptDraft(any(), any(), any());
    }

    @Test
    void processDocument_unexpectedFailure_marksFailedWithTrimmedMessage() {
        when(pipeline.process(any(), any(), any())).thenThrow(new IllegalStateException("x".repeat(5000)));

        service.processDocument(document.getId(), bytes);

        assertThat(document.getStatus()).isEqualTo(DocumentStatus.FAILED);
        assertThat(document.getErrorMessage()).hasSize(2000).endsWith("...");
    }

    @Test
    void processDocument_draftFailureDoesNotFailDocument() {
        ExtractedFields fields = ExtractedFields.builder()
                .totalAmount(new BigDecimal("4.20"))
                .transactionDate(LocalDate.of(2026, 2, 13))
                .build();
        when(pipeline.process(any(), any(), any())).thenReturn(fields);
        when(receiptDraftService.createReceiptDraft(any(), any(), any())).thenThrow(new BadRequestException("nope"));

        service.processDocument(document.getId(), bytes);

        assertThat(document.getStatus()).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(document.getExtractedFields().getReceiptDraftTransactionId()).isNull();
    }

    @Test
    void processDocument_missingAmount_skipsDraft() {
        ExtractedFields fields = ExtractedFields.builder().vendorName("Costa").build();
        when(pipeline.process(any(), any(), any())).thenReturn(fields);

        service.processDocument(document.getId(), bytes);

        assertThat(document.getStatus()).isEqualTo(DocumentStatus.COMPLETED);
        verify(receiptDraftService, never()).createReceiptDraft(any(), any(), any());
    }

    @Test
    void processDocument_skipsCompletedAndRunningDocuments() {
        document.setStatus(DocumentStatus.COMPLETED);
        service.processDocument(document.getId(), bytes);

        document.setStatus(DocumentStatus.PROCESSING);
        service.processDocument(document.getId(), bytes);

        verify(pipeline, never()).process(any(), any(), any());
        verify(documentRepository, never()).save(any());
    }

    @Test
    void processDocument_failedDocumentCanBeRetried() {
        document.setStatus(DocumentStatus.FAILED);
        document.setErrorMessage("previous");
        when(pipeline.process(any(), any(), any())).thenReturn(ExtractedFields.builder().build());

        service.processDocument(document.getId(), bytes);

        assertThat(document.getStatus()).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(document.getErrorMessage()).isNull();
    }

    @Test
    void createDocument_defaultsFilenameAndStatus() {
        UUID ownerId = UUID.randomUUID();

        Document created = service.createDocument(ownerId, "  ", "image/jpeg");

        assertThat(created.getFilename()).isEqualTo("upload");
        assertThat(created.getStatus()).isEqualTo(DocumentStatus.UPLOADED);
        verify(documentRepository).save(eq(created));
    }
}
