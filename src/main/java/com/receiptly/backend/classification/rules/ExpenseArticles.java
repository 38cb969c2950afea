package com.receiptly.backend.classification.rules;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a spending category to its tax-taxonomy article and whether it is potentially deductible.
 */
public final class ExpenseArticles {

    private ExpenseArticles() {}

    public record ExpenseArticle(String article, boolean potentiallyDeductible) {}

    public static final String OTHER = "other";

    private static final Map<String, String> ARTICLE_BY_CATEGORY = Map.of(
            "transport", "travel_costs",
            "subscriptions", "software_subscriptions",
            "office_supplies", "office_supplies",
            "food_and_drink", "meals_and_entertainment",
            "income", "non_expense_income"
    );

    private static final Set<String> DEDUCTIBLE_CATEGORIES = Set.of("transport", "subscriptions", "office_supplies");

    public static Optional<ExpenseArticle> forCategory(String category) {
        if (category == null || category.isBlank()) return Optional.empty();
        String c = category.trim();
        return Optional.of(new ExpenseArticle(
                ARTICLE_BY_CATEGORY.getOrDefault(c, OTHER),
                DEDUCTIBLE_CATEGORIES.contains(c)
        ));
    }
}
