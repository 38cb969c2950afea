package com.receiptly.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.receiptly.backend.enums.ReviewStatus;
import com.receiptly.backend.review.FieldChange;
import com.receiptly.backend.review.ReviewChangesConverter;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Structured result of a processing pass, later edited by human review.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ExtractedFields {

    @Column(name = "vendor_name")
    private String vendorName;

    @Column(name = "total_amount", precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "transaction_date")
    private LocalDate transactionDate;

    @Column(name = "text_excerpt", length = 2000)
    private String textExcerpt;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "suggested_category")
    private String suggestedCategory;

    @Column(name = "expense_article")
    private String expenseArticle;

    @Column(name = "is_potentially_deductible")
    private Boolean potentiallyDeductible;

    /** manual_review when a past correction decided the category, keyword_rules otherwise. */
    @Column(name = "category_source", length = 32)
    private String categorySource;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_status", length = 16)
    private ReviewStatus reviewStatus;

    @Convert(converter = ReviewChangesConverter.class)
    @Column(name = "review_changes", length = 4000)
    @Builder.Default
    private List<FieldChange> reviewChanges = new ArrayList<>();

    /** Set when a CORRECTED review changed a taxonomy field; the correction ledger reads only these. */
    @Column(name = "taxonomy_corrected")
    private Boolean taxonomyCorrected;

    @Column(name = "review_notes", length = 1000)
    private String reviewNotes;

    @Column(name = "ocr_provider", length = 32)
    private String ocrProvider;

    @Column(name = "ocr_confidence")
    private Double ocrConfidence;

    @Column(name = "needs_review")
    private Boolean needsReview;

    @Column(name = "review_reason")
    private String reviewReason;

    @Column(name = "receipt_draft_transaction_id")
    private UUID receiptDraftTransactionId;

    @Column(name = "receipt_draft_duplicated")
    private Boolean receiptDraftDuplicated;

    public List<FieldChange> getReviewChanges() {
        return reviewChanges == null ? List.of() : reviewChanges;
    }
}
