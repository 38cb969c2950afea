package com.receiptly.backend.enums;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fields of an extracted record that a human review can change.
 */
public enum ReviewField {
    VENDOR_NAME("vendor_name", Kind.TEXT, false),
    TOTAL_AMOUNT("total_amount", Kind.AMOUNT, false),
    TRANSACTION_DATE("transaction_date", Kind.DATE, false),
    SUGGESTED_CATEGORY("suggested_category", Kind.TEXT, true),
    EXPENSE_ARTICLE("expense_article", Kind.TEXT, true),
    IS_POTENTIALLY_DEDUCTIBLE("is_potentially_deductible", Kind.BOOLEAN, true);

    public enum Kind {
        TEXT,
        AMOUNT,
        DATE,
        BOOLEAN
    }

    private final String key;
    private final Kind kind;
    private final boolean taxonomy;

    ReviewField(String key, Kind kind, boolean taxonomy) {
        this.key = key;
        this.kind = kind;
        this.taxonomy = taxonomy;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Kind kind() {
        return kind;
    }

    /** Taxonomy fields are the ones the correction ledger learns from. */
    public boolean isTaxonomy() {
        return taxonomy;
    }

    @JsonCreator
    public static ReviewField ofKey(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown review field: " + key));
    }

    public static Optional<ReviewField> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim();
        return Arrays.stream(values())
                .filter(f -> f.key.equalsIgnoreCase(k) || f.name().equalsIgnoreCase(k))
                .findFirst();
    }
}
