package com.receiptly.backend.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;

import com.receiptly.backend.config.ReconciliationProperties;
import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.entities.LedgerTransaction;
import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.enums.ReconciliationStatus;
import com.receiptly.backend.enums.TransactionSource;
import com.receiptly.backend.exceptions.BadRequestException;
import com.receiptly.backend.exceptions.BusinessException;
import com.receiptly.backend.repositories.DocumentRepository;
import com.receiptly.backend.repositories.LedgerTransactionRepository;

@SuppressWarnings("null")
class ReceiptDraftServiceTest {

    private final LedgerTransactionRepository transactionRepository = Mockito.mock(LedgerTransactionRepository.class);
    private final DocumentRepository documentRepository = Mockito.mock(DocumentRepository.class);
    private final ReceiptDraftWriter draftWriter = Mockito.mock(ReceiptDraftWriter.class);

    private final ReceiptDraftService service = new ReceiptDraftService(
            transactionRepository,
            documentRepository,
            draftWriter,
            new ReconciliationProperties()
    );

    private final UUID ownerId = UUID.randomUUID();
    private final UUID documentId = UUID.randomUUID();

    private final ExtractedFields fields = ExtractedFields.builder()
            .vendorName("Ryman")
            .totalAmount(new BigDecimal("18.40"))
            .transactionDate(LocalDate.of(2026, 2, 13))
            .currency("GBP")
            .suggestedCategory("office_supplies")
            .build();

    @Test
    void createReceiptDraft_secondCallReturnsSameTransactionAsDuplicate() {
        // in-memory stand-in for the unique (owner, provider_transaction_id) row
        AtomicReference<LedgerTransaction> stored = new AtomicReference<>();
        when(transactionRepository.findByOwnerIdAndProviderTransactionId(eq(ownerId), anyString()))
                .thenAnswer(inv -> Optional.ofNullable(stored.get()));
        when(draftWriter.insert(any(LedgerTransaction.class))).thenAnswer(inv -> {
            LedgerTransaction t = inv.getArgument(0);
            t.setId(UUID.randomUUID());
            stored.set(t);
            return t;
        });

        ReceiptDraftResult first = service.createReceiptDraft(ownerId, documentId, fields);
        ReceiptDraftResult second = service.createReceiptDraft(ownerId, documentId, fields);

        assertThat(first.duplicated()).isFalse();
        assertThat(second.duplicated()).isTrue();
        assertThat(second.transaction().getId()).isEqualTo(first.transaction().getId());
        verify(draftWriter, times(1)).insert(any());
    }

    @Test
    void createReceiptDraft_buildsNegativeDraftWithDeterministicId() {
        when(transactionRepository.findByOwnerIdAndProviderTransactionId(any(), any())).thenReturn(Optional.empty());
        when(draftWriter.insert(any(LedgerTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

        service.createReceiptDraft(ownerId, documentId, fields);

        ArgumentCaptor<LedgerTransaction> captor = ArgumentCaptor.forClass(LedgerTransaction.class);
        verify(draftWriter).insert(captor.capture());
        LedgerTransaction draft = captor.getValue();

        assertThat(draft.getAmount()).isEqualByComparingTo("-18.40");
        assertThat(draft.getDescription()).isEqualTo("Receipt draft: Ryman");
        assertThat(draft.getCategory()).isEqualTo("office_supplies");
        assertThat(draft.getSource()).isEqualTo(TransactionSource.RECEIPT_DRAFT);
        assertThat(draft.getReconciliationStatus()).isEqualTo(ReconciliationStatus.UNRECONCILED);
        assertThat(draft.getDocumentId()).isEqualTo(documentId);
        assertThat(draft.getProviderTransactionId())
                .startsWith("receipt-")
                .isEqualTo(service.draftProviderTransactionId(ownerId, documentId))
                .isNotEqualTo(service.draftProviderTransactionId(UUID.randomUUID(), documentId));
    }

    @Test
    void createReceiptDraft_lostInsertRace_returnsWinnerAsDuplicate() {
        LedgerTransaction winner = LedgerTransaction.builder().id(UUID.randomUUID()).ownerId(ownerId).build();
        when(transactionRepository.findByOwnerIdAndProviderTransactionId(eq(ownerId), anyString()))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(draftWriter.insert(any())).thenThrow(new DataIntegrityViolationException("uq_transactions_owner_provider_tx"));

        ReceiptDraftResult result = service.createReceiptDraft(ownerId, documentId, fields);

        assertThat(result.duplicated()).isTrue();
        assertThat(result.transaction()).isSameAs(winner);
    }

    @Test
    void createReceiptDraft_requiresAmountAndDate() {
        ExtractedFields noAmount = fields.toBuilder().totalAmount(null).build();
        ExtractedFields noDate = fields.toBuilder().transactionDate(null).build();

        assertThatThrownBy(() -> service.createReceiptDraft(ownerId, documentId, noAmount))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> service.createReceiptDraft(ownerId, documentId, noDate))
                .isInstanceOf(BadRequestException.class);
        verify(draftWriter, never()).insert(any());
    }

    @Test
    void describe_unknownVendor() {
        assertThat(ReceiptDraftService.describe(null)).isEqualTo("Receipt draft: Unknown vendor");
        assertThat(ReceiptDraftService.describe("  ")).isEqualTo("Receipt draft: Unknown vendor");
    }

    @Test
    void createReceiptDraftForDocument_linksDraftOnDocument() {
        Document document = new Document();
        document.setId(documentId);
        document.setOwnerId(ownerId);
        document.setStatus(DocumentStatus.COMPLETED);
        document.setExtractedFields(fields.toBuilder().build());
        when(documentRepository.findByIdAndOwnerId(documentId, ownerId)).thenReturn(Optional.of(document));
        when(transactionRepository.findByOwnerIdAndProviderTransactionId(any(), any())).thenReturn(Optional.empty());
        UUID draftId = UUID.randomUUID();
        when(draftWriter.insert(any(LedgerTransaction.class))).thenAnswer(inv -> {
            LedgerTransaction t = inv.getArgument(0);
            t.setId(draftId);
            return t;
        });

        ReceiptDraftResult result = service.createReceiptDraftForDocument(ownerId, documentId);

        assertThat(result.duplicated()).isFalse();
        assertThat(document.getExtractedFields().getReceiptDraftTransactionId()).isEqualTo(draftId);
        assertThat(document.getExtractedFields().getReceiptDraftDuplicated()).isFalse();
        verify(documentRepository).save(document);
    }

    @Test
    void createReceiptDraftForDocument_failedDocumentIsRejected() {
        Document document = new Document();
        document.setId(documentId);
        document.setOwnerId(ownerId);
        document.setStatus(DocumentStatus.FAILED);
        when(documentRepository.findByIdAndOwnerId(documentId, ownerId)).thenReturn(Optional.of(document));

        assertThatThrownBy(() -> service.createReceiptDraftForDocument(ownerId, documentId))
                .isInstanceOf(BusinessException.class);
    }
}
