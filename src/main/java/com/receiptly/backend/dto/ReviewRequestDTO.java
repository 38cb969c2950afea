package com.receiptly.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.receiptly.backend.enums.ReviewStatus;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Human edit of an extracted document. Null fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequestDTO {

    @Size(max = 255)
    private String vendorName;

    @DecimalMin(value = "0.01", message = "Total amount must be positive")
    private BigDecimal totalAmount;

    private LocalDate transactionDate;

    @Size(max = 255)
    private String suggestedCategory;

    @Size(max = 255)
    private String expenseArticle;

    private Boolean potentiallyDeductible;

    @Size(max = 1000)
    private String reviewNotes;

    /** CONFIRMED or CORRECTED; resolved from the actual changes. */
    private ReviewStatus reviewStatus;
}
