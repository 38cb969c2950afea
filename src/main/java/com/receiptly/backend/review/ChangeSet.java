package com.receiptly.backend.review;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.receiptly.backend.enums.ReviewField;
import com.receiptly.backend.enums.ReviewStatus;

public record ChangeSet(List<FieldChange> changes) {

    public ChangeSet {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static ChangeSet empty() {
        return new ChangeSet(List.of());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public Optional<FieldChange> get(ReviewField field) {
        return changes.stream().filter(c -> c.field() == field).findFirst();
    }

    public boolean contains(ReviewField field) {
        return get(field).isPresent();
    }

    public boolean hasTaxonomyChange() {
        return hasTaxonomyChange(changes);
    }

    /**
     * A review teaches the correction ledger only when it was marked corrected and touched the taxonomy.
     */
    public boolean feedsCorrectionLedger(ReviewStatus status) {
        return status == ReviewStatus.CORRECTED && hasTaxonomyChange();
    }

    public static boolean hasTaxonomyChange(List<FieldChange> changes) {
        if (changes == null) return false;
        return changes.stream().anyMatch(c -> c != null && c.field() != null && c.field().isTaxonomy());
    }

    /** field key -> {before, after}; keeps nulls. */
    public Map<String, Map<String, Object>> toMap() {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        for (FieldChange c : changes) {
            Map<String, Object> pair = new LinkedHashMap<>();
            pair.put("before", c.before());
            pair.put("after", c.after());
            out.put(c.field().key(), pair);
        }
        return out;
    }
}
