package com.receiptly.backend.classification.ledger;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A human correction of a document's taxonomy, as seen by the categorizer.
 *
 * @param effectiveAt upload time of the originating document
 */
public record CorrectionRecord(
        UUID documentId,
        String vendorKey,
        String suggestedCategory,
        String expenseArticle,
        Boolean potentiallyDeductible,
        String source,
        LocalDateTime effectiveAt
) {
    public static final String SOURCE_MANUAL_REVIEW = "manual_review";
}
