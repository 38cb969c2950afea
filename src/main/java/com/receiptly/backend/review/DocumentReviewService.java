package com.receiptly.backend.review;

import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.receiptly.backend.classification.CategoryResult;
import com.receiptly.backend.classification.rules.ExpenseArticles;
import com.receiptly.backend.dto.ReviewRequestDTO;
import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.enums.ReviewField;
import com.receiptly.backend.enums.ReviewStatus;
import com.receiptly.backend.exceptions.BadRequestException;
import com.receiptly.backend.exceptions.BusinessException;
import com.receiptly.backend.exceptions.ResourceNotFoundException;
import com.receiptly.backend.repositories.DocumentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentReviewService {

    private final DocumentRepository documentRepository;
    private final ReviewDiffer reviewDiffer;
    private final ReviewMetrics reviewMetrics;

    /**
     * Applies a human review to a processed document.
     *
     * The stored change list always compares against the values extracted by the pipeline, so
     * reviewing the same document twice accumulates changes instead of forgetting the first
     * edit. A review that changes nothing is CONFIRMED, any change makes it CORRECTED.
     */
    @Transactional
    public Document review(UUID ownerId, UUID documentId, ReviewRequestDTO request) {
        if (request == null) {
            throw new BadRequestException("Review body is required");
        }
        if (request.getReviewStatus() == ReviewStatus.PENDING) {
            throw new BadRequestException("reviewStatus must be CONFIRMED or CORRECTED");
        }

        Document document = documentRepository.findByIdAndOwnerId(documentId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Document not found"));
        if (document.getStatus() != DocumentStatus.COMPLETED || document.getExtractedFields() == null) {
            throw new BusinessException("Only processed documents can be reviewed (status " + document.getStatus() + ")");
        }

        ExtractedFields current = document.getExtractedFields();
        ReviewSnapshot extracted = extractedSnapshot(current);
        ExtractedFields updated = applyRequest(current, request);

        ChangeSet changes = reviewDiffer.diff(extracted, ReviewSnapshot.of(updated));
        ReviewStatus status = changes.isEmpty() ? ReviewStatus.CONFIRMED : ReviewStatus.CORRECTED;
        if (request.getReviewStatus() != null && request.getReviewStatus() != status) {
            log.debug("[Review] documentId={} requested {} resolved to {}", documentId, request.getReviewStatus(), status);
        }

        updated.setReviewStatus(status);
        updated.setReviewChanges(changes.changes());
        updated.setTaxonomyCorrected(changes.feedsCorrectionLedger(status));
        updated.setNeedsReview(false);
        if (request.getReviewNotes() != null) {
            updated.setReviewNotes(ReviewValues.normalizeText(request.getReviewNotes()));
        }

        document.setExtractedFields(updated);
        Document saved = documentRepository.save(document);
        reviewMetrics.reviewCompleted(document.getUploadedAt(), LocalDateTime.now(), status);

        log.info("[Review] documentId={} status={} changedFields={} feedsLedger={}",
                documentId, status, changes.changes().size(), changes.feedsCorrectionLedger(status));
        return saved;
    }

    @Transactional(readOnly = true)
    public Page<Document> listReviewQueue(UUID ownerId, Integer limit, Integer offset) {
        int size = limit == null || limit <= 0 ? 20 : Math.min(limit, 100);
        int start = offset == null || offset < 0 ? 0 : offset;
        return documentRepository.findReviewQueue(ownerId, DocumentStatus.COMPLETED, PageRequest.of(start / size, size));
    }

    /**
     * Current values with earlier review edits rolled back to what extraction produced.
     */
    static ReviewSnapshot extractedSnapshot(ExtractedFields current) {
        ReviewSnapshot now = ReviewSnapshot.of(current);
        Map<String, Object> values = new HashMap<>();
        for (ReviewField field : ReviewField.values()) {
            values.put(field.key(), now.get(field));
        }
        for (FieldChange previous : current.getReviewChanges()) {
            values.put(previous.field().key(), previous.before());
        }
        return ReviewSnapshot.fromMap(values);
    }

    static ExtractedFields applyRequest(ExtractedFields current, ReviewRequestDTO request) {
        ExtractedFields.ExtractedFieldsBuilder b = current.toBuilder();

        if (request.getVendorName() != null) b.vendorName(ReviewValues.normalizeText(request.getVendorName()));
        if (request.getTotalAmount() != null) {
            b.totalAmount(request.getTotalAmount().setScale(2, RoundingMode.HALF_UP));
        }
        if (request.getTransactionDate() != null) b.transactionDate(request.getTransactionDate());

        String category = request.getSuggestedCategory() != null
                ? ReviewValues.normalizeText(request.getSuggestedCategory())
                : current.getSuggestedCategory();
        boolean categoryChanged = request.getSuggestedCategory() != null
                && !Objects.equals(category, ReviewValues.normalizeText(current.getSuggestedCategory()));
        b.suggestedCategory(category);

        if (categoryChanged && request.getExpenseArticle() == null && request.getPotentiallyDeductible() == null) {
            // taxonomy follows the new category unless the reviewer set it explicitly
            var article = ExpenseArticles.forCategory(category);
            b.expenseArticle(article.map(ExpenseArticles.ExpenseArticle::article).orElse(null));
            b.potentiallyDeductible(article.map(ExpenseArticles.ExpenseArticle::potentiallyDeductible).orElse(null));
        } else {
            if (request.getExpenseArticle() != null) b.expenseArticle(ReviewValues.normalizeText(request.getExpenseArticle()));
            if (request.getPotentiallyDeductible() != null) b.potentiallyDeductible(request.getPotentiallyDeductible());
        }
        if (categoryChanged) {
            b.categorySource(CategoryResult.SOURCE_MANUAL_REVIEW);
        }
        return b.build();
    }
}
