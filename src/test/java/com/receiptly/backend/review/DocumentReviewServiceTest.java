package com.receiptly.backend.review;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import com.receiptly.backend.dto.ReviewRequestDTO;
import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.enums.ReviewField;
import com.receiptly.backend.enums.ReviewStatus;
import com.receiptly.backend.exceptions.BusinessException;
import com.receiptly.backend.exceptions.ResourceNotFoundException;
import com.receiptly.backend.repositories.DocumentRepository;

@SuppressWarnings("null")
class DocumentReviewServiceTest {

    private final DocumentRepository documentRepository = Mockito.mock(DocumentRepository.class);

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private final DocumentReviewService service =
            new DocumentReviewService(documentRepository, new ReviewDiffer(), new ReviewMetrics(meterRegistry));

    private final UUID ownerId = UUID.randomUUID();
    private Document document;

    @BeforeEach
    void setUp() {
        document = new Document();
        document.setId(UUID.randomUUID());
        document.setOwnerId(ownerId);
        document.setFilename("tesco.jpg");
        document.setStatus(DocumentStatus.COMPLETED);
        document.setUploadedAt(LocalDateTime.of(2026, 2, 13, 9, 0));
        document.setExtractedFields(ExtractedFields.builder()
                .vendorName("Tesco Stores UK")
                .totalAmount(new BigDecimal("14.40"))
                .transactionDate(LocalDate.of(2026, 2, 13))
                .suggestedCategory("groceries")
                .expenseArticle("other")
                .potentiallyDeductible(false)
                .categorySource("keyword_rules")
                .reviewStatus(ReviewStatus.PENDING)
                .needsReview(true)
                .build());

        when(documentRepository.findByIdAndOwnerId(document.getId(), ownerId)).thenReturn(Optional.of(document));
        when(documentRepository.save(any(Document.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void review_withoutChanges_isConfirmed() {
        ReviewRequestDTO request = ReviewRequestDTO.builder()
                .totalAmount(new BigDecimal("14.4"))
                .reviewStatus(ReviewStatus.CORRECTED)
                .build();

        Document saved = service.review(ownerId, document.getId(), request);

        assertThat(saved.getExtractedFields().getReviewStatus()).isEqualTo(ReviewStatus.CONFIRMED);
        assertThat(saved.getExtractedFields().getReviewChanges()).isEmpty();
        assertThat(saved.getExtractedFields().getNeedsReview()).isFalse();
    }

    @Test
    void review_categoryChange_rederivesTaxonomyAndIsCorrected() {
        ReviewRequestDTO request = ReviewRequestDTO.builder()
                .suggestedCategory("food_and_drink")
                .reviewNotes("  lunch meeting ")
                .build();

        Document saved = service.review(ownerId, document.getId(), request);

        ExtractedFields fields = saved.getExtractedFields();
        assertThat(fields.getReviewStatus()).isEqualTo(ReviewStatus.CORRECTED);
        assertThat(fields.getSuggestedCategory()).isEqualTo("food_and_drink");
        assertThat(fields.getExpenseArticle()).isEqualTo("meals_and_entertainment");
        assertThat(fields.getCategorySource()).isEqualTo("manual_review");
        assertThat(fields.getReviewNotes()).isEqualTo("lunch meeting");
        assertThat(fields.getReviewChanges()).extracting(FieldChange::field)
                .containsExactly(ReviewField.SUGGESTED_CATEGORY, ReviewField.EXPENSE_ARTICLE);
        assertThat(ChangeSet.hasTaxonomyChange(fields.getReviewChanges())).isTrue();
        assertThat(fields.getTaxonomyCorrected()).isTrue();
    }

    @Test
    void review_explicitTaxonomyIsKept() {
        ReviewRequestDTO request = ReviewRequestDTO.builder()
                .suggestedCategory("office_supplies")
                .expenseArticle("other")
                .potentiallyDeductible(true)
                .build();

        ExtractedFields fields = service.review(ownerId, document.getId(), request).getExtractedFields();

        assertThat(fields.getExpenseArticle()).isEqualTo("other");
        assertThat(fields.getPotentiallyDeductible()).isTrue();
        assertThat(fields.getReviewChanges()).extracting(FieldChange::field)
                .containsExactly(ReviewField.SUGGESTED_CATEGORY, ReviewField.IS_POTENTIALLY_DEDUCTIBLE);
    }

    @Test
    void review_secondReviewKeepsEarlierChanges() {
        service.review(ownerId, document.getId(), ReviewRequestDTO.builder()
                .totalAmount(new BigDecimal("15.00"))
                .build());

        ExtractedFields fields = service.review(ownerId, document.getId(), ReviewRequestDTO.builder()
                .vendorName("Tesco Express")
                .build()).getExtractedFields();

        assertThat(fields.getReviewStatus()).isEqualTo(ReviewStatus.CORRECTED);
        assertThat(fields.getReviewChanges()).extracting(FieldChange::field)
                .containsExactly(ReviewField.VENDOR_NAME, ReviewField.TOTAL_AMOUNT);
        FieldChange amount = new ChangeSet(fields.getReviewChanges()).get(ReviewField.TOTAL_AMOUNT).orElseThrow();
        assertThat(amount.before()).isEqualTo(new BigDecimal("14.40"));
        assertThat(amount.after()).isEqualTo(new BigDecimal("15.00"));
        assertThat(fields.getTaxonomyCorrected()).isFalse();
    }

    @Test
    void review_recordsCompletionTimeAndCountsCorrections() {
        document.setUploadedAt(LocalDateTime.now().minusMinutes(5));

        service.review(ownerId, document.getId(), ReviewRequestDTO.builder().build());
        service.review(ownerId, document.getId(), ReviewRequestDTO.builder().vendorName("Tesco Express").build());

        Timer completion = meterRegistry.get("ocr.review.completion").timer();
        assertThat(completion.count()).isEqualTo(2);
        assertThat(completion.totalTime(TimeUnit.SECONDS)).isGreaterThanOrEqualTo(600.0);
        assertThat(meterRegistry.get("ocr.manual.overrides").tag("review_status", "corrected").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.find("ocr.manual.overrides").tag("review_status", "confirmed").counter()).isNull();
    }

    @Test
    void review_revertingAnEditGoesBackToConfirmed() {
        service.review(ownerId, document.getId(), ReviewRequestDTO.builder().vendorName("Tesco Express").build());

        ExtractedFields fields = service.review(ownerId, document.getId(),
                ReviewRequestDTO.builder().vendorName("Tesco Stores UK").build()).getExtractedFields();

        assertThat(fields.getReviewStatus()).isEqualTo(ReviewStatus.CONFIRMED);
        assertThat(fields.getReviewChanges()).isEmpty();
    }

    @Test
    void review_onlyCompletedDocuments() {
        document.setStatus(DocumentStatus.PROCESSING);

        assertThatThrownBy(() -> service.review(ownerId, document.getId(), new ReviewRequestDTO()))
                .isInstanceOf(BusinessException.class);
        verify(documentRepository, never()).save(any());
    }

    @Test
    void review_otherOwner_isNotFound() {
        UUID stranger = UUID.randomUUID();
        when(documentRepository.findByIdAndOwnerId(document.getId(), stranger)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.review(stranger, document.getId(), new ReviewRequestDTO()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void listReviewQueue_convertsOffsetToPage() {
        when(documentRepository.findReviewQueue(eq(ownerId), eq(DocumentStatus.COMPLETED), any()))
                .thenReturn(new PageImpl<>(List.of(document), PageRequest.of(2, 10), 21));

        var page = service.listReviewQueue(ownerId, 10, 25);

        assertThat(page.getContent()).containsExactly(document);
        verify(documentRepository).findReviewQueue(ownerId, DocumentStatus.COMPLETED, PageRequest.of(2, 10));
    }
}
