package com.receiptly.backend.review;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.enums.ReviewField;

/**
 * The reviewable values of a record at one point in time. Missing fields read as null.
 */
public final class ReviewSnapshot {

    private final Map<ReviewField, Object> values;

    private ReviewSnapshot(Map<ReviewField, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ReviewSnapshot of(ExtractedFields fields) {
        Map<ReviewField, Object> values = new EnumMap<>(ReviewField.class);
        if (fields != null) {
            values.put(ReviewField.VENDOR_NAME, fields.getVendorName());
            values.put(ReviewField.TOTAL_AMOUNT, fields.getTotalAmount());
            values.put(ReviewField.TRANSACTION_DATE, fields.getTransactionDate());
            values.put(ReviewField.SUGGESTED_CATEGORY, fields.getSuggestedCategory());
            values.put(ReviewField.EXPENSE_ARTICLE, fields.getExpenseArticle());
            values.put(ReviewField.IS_POTENTIALLY_DEDUCTIBLE, fields.getPotentiallyDeductible());
        }
        return new ReviewSnapshot(values);
    }

    /**
     * Builds a snapshot from loosely typed values keyed by field key (e.g. {@code total_amount}).
     * Unknown keys are ignored.
     */
    public static ReviewSnapshot fromMap(Map<String, ?> raw) {
        Map<ReviewField, Object> values = new EnumMap<>(ReviewField.class);
        if (raw != null) {
            raw.forEach((key, value) -> ReviewField.fromKey(key).ifPresent(f -> values.put(f, value)));
        }
        return new ReviewSnapshot(values);
    }

    public Object get(ReviewField field) {
        return values.get(field);
    }
}
