package com.receiptly.backend.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered keyword table used when no past correction applies. The first matching rule wins,
 * so the order of {@link #rules()} is the tie-break order.
 *
 * Keywords must be lowercase.
 */
public final class KeywordRules {

    public record KeywordRule(String category, List<String> keywords) {
        public KeywordRule {
            if (category == null || category.isBlank()) throw new IllegalArgumentException("category is required");
            if (keywords == null || keywords.isEmpty()) throw new IllegalArgumentException("keywords is required");
            keywords = List.copyOf(keywords);
        }

        public boolean matches(String lowerText) {
            for (String k : keywords) {
                if (lowerText.contains(k)) return true;
            }
            return false;
        }
    }

    public static final KeywordRules DEFAULT;

    static {
        List<KeywordRule> items = new ArrayList<>();

        items.add(new KeywordRule("groceries", List.of("tesco", "sainsbury", "lidl", "asda", "aldi", "waitrose")));
        items.add(new KeywordRule("transport", List.of("tfl", "trainline", "uber", "bolt")));
        items.add(new KeywordRule("food_and_drink", List.of("pret", "costa", "starbucks", "restaurant")));
        items.add(new KeywordRule("subscriptions", List.of(
                "amazon prime", "netflix", "spotify", "adobe", "notion", "xero",
                "quickbooks", "google workspace", "microsoft 365")));
        items.add(new KeywordRule("office_supplies", List.of("staples", "ryman", "amazon business")));
        items.add(new KeywordRule("income", List.of("salary", "payment")));

        DEFAULT = new KeywordRules(items);
    }

    private final List<KeywordRule> rules;

    public KeywordRules(List<KeywordRule> rules) {
        this.rules = rules == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public List<KeywordRule> rules() {
        return rules;
    }

    public Optional<String> firstMatch(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String lower = text.trim().toLowerCase(Locale.ROOT);
        return rules.stream()
                .filter(r -> r.matches(lower))
                .map(KeywordRule::category)
                .findFirst();
    }
}
