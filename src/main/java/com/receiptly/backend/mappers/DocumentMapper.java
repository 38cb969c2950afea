package com.receiptly.backend.mappers;

import com.receiptly.backend.dto.DocumentResponseDTO;
import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.review.ChangeSet;

public class DocumentMapper {

    private DocumentMapper() {}

    public static DocumentResponseDTO toResponseDTO(Document document) {
        DocumentResponseDTO.DocumentResponseDTOBuilder b = DocumentResponseDTO.builder()
                .id(document.getId())
                .ownerId(document.getOwnerId())
                .filename(document.getFilename())
                .contentType(document.getContentType())
                .status(document.getStatus())
                .uploadedAt(document.getUploadedAt())
                .processedAt(document.getProcessedAt())
                .errorMessage(document.getErrorMessage());

        ExtractedFields fields = document.getExtractedFields();
        if (fields != null) {
            b.vendorName(fields.getVendorName())
                    .totalAmount(fields.getTotalAmount())
                    .transactionDate(fields.getTransactionDate())
                    .currency(fields.getCurrency())
                    .textExcerpt(fields.getTextExcerpt())
                    .suggestedCategory(fields.getSuggestedCategory())
                    .expenseArticle(fields.getExpenseArticle())
                    .potentiallyDeductible(fields.getPotentiallyDeductible())
                    .categorySource(fields.getCategorySource())
                    .reviewStatus(fields.getReviewStatus())
                    .reviewChanges(new ChangeSet(fields.getReviewChanges()).toMap())
                    .reviewNotes(fields.getReviewNotes())
                    .ocrProvider(fields.getOcrProvider())
                    .ocrConfidence(fields.getOcrConfidence())
                    .needsReview(fields.getNeedsReview())
                    .reviewReason(fields.getReviewReason())
                    .receiptDraftTransactionId(fields.getReceiptDraftTransactionId())
                    .receiptDraftDuplicated(fields.getReceiptDraftDuplicated());
        }
        return b.build();
    }
}
