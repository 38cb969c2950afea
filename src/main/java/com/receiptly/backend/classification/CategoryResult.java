package com.receiptly.backend.classification;

public record CategoryResult(
        String category,
        String expenseArticle,
        Boolean potentiallyDeductible,
        String source
) {
    public static final String SOURCE_MANUAL_REVIEW = "manual_review";
    public static final String SOURCE_KEYWORD_RULES = "keyword_rules";

    public static CategoryResult none() {
        return new CategoryResult(null, null, null, null);
    }

    public boolean isEmpty() {
        return category == null;
    }
}
