package com.receiptly.backend.review;

import java.util.Objects;

import com.receiptly.backend.enums.ReviewField;

/**
 * One changed field of a reviewed record. Values are stored in their normalized form.
 */
public record FieldChange(ReviewField field, Object before, Object after) {

    public FieldChange {
        Objects.requireNonNull(field, "field is required");
        before = ReviewValues.normalize(field.kind(), before);
        after = ReviewValues.normalize(field.kind(), after);
    }
}
