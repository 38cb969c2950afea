package com.receiptly.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.enums.ReviewStatus;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DocumentResponseDTO {
    private UUID id;
    private UUID ownerId;
    private String filename;
    private String contentType;
    private DocumentStatus status;
    private LocalDateTime uploadedAt;
    private LocalDateTime processedAt;
    private String errorMessage;

    private String vendorName;
    private BigDecimal totalAmount;
    private LocalDate transactionDate;
    private String currency;
    private String textExcerpt;
    private String suggestedCategory;
    private String expenseArticle;
    private Boolean potentiallyDeductible;
    private String categorySource;

    private ReviewStatus reviewStatus;
    /** field key -> {before, after} */
    private Map<String, Map<String, Object>> reviewChanges;
    private String reviewNotes;

    private String ocrProvider;
    private Double ocrConfidence;
    private Boolean needsReview;
    private String reviewReason;

    private UUID receiptDraftTransactionId;
    private Boolean receiptDraftDuplicated;
}
