package com.receiptly.backend.review;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.receiptly.backend.enums.ReviewField;

/**
 * Computes the before/after change set of a human review.
 *
 * Every {@link ReviewField} is evaluated, including the taxonomy fields that are usually
 * derived automatically. Representational differences ({@code 18.4} vs {@code "18.40"},
 * a date with or without a midnight time part) are not changes.
 */
@Component
public class ReviewDiffer {

    public ChangeSet diff(ReviewSnapshot before, ReviewSnapshot after) {
        List<FieldChange> changes = new ArrayList<>();
        for (ReviewField field : ReviewField.values()) {
            Object b = before == null ? null : before.get(field);
            Object a = after == null ? null : after.get(field);
            FieldChange candidate = new FieldChange(field, b, a);
            if (!Objects.equals(candidate.before(), candidate.after())) {
                changes.add(candidate);
            }
        }
        return new ChangeSet(changes);
    }
}
