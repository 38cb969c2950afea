package com.receiptly.backend.classification;

import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.receiptly.backend.classification.ledger.CorrectionLedger;
import com.receiptly.backend.classification.ledger.CorrectionRecord;
import com.receiptly.backend.classification.rules.ExpenseArticles;
import com.receiptly.backend.classification.rules.KeywordRules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class ClassificationService {

    private final CorrectionLedger correctionLedger;
    private final KeywordRules keywordRules;

    /**
     * Category, expense article and deductibility for a receipt.
     *
     * A past manual correction for the same vendor wins over the keyword table; its stored
     * values are returned as-is.
     */
    public CategoryResult categorize(String vendorName, String description, UUID ownerId) {
        // 1) Latest human correction for this vendor
        Optional<CorrectionRecord> correction = findCorrection(ownerId, vendorName);
        if (correction.isPresent()) {
            CorrectionRecord c = correction.get();
            log.debug("[Classification] Matched correction documentId={} vendorKey='{}' -> category='{}'",
                    c.documentId(), c.vendorKey(), c.suggestedCategory());
            return new CategoryResult(
                    c.suggestedCategory(),
                    c.expenseArticle(),
                    c.potentiallyDeductible(),
                    CategoryResult.SOURCE_MANUAL_REVIEW
            );
        }

        // 2) Keyword table
        Optional<String> category = suggestCategoryFromRules(joinText(description, vendorName));
        if (category.isEmpty()) {
            log.debug("[Classification] No rule matched vendor='{}'", vendorName);
            return CategoryResult.none();
        }

        var article = ExpenseArticles.forCategory(category.get());
        log.debug("[Classification] Matched keyword rule -> category='{}'", category.get());
        return new CategoryResult(
                category.get(),
                article.map(ExpenseArticles.ExpenseArticle::article).orElse(null),
                article.map(ExpenseArticles.ExpenseArticle::potentiallyDeductible).orElse(null),
                CategoryResult.SOURCE_KEYWORD_RULES
        );
    }

    public Optional<String> suggestCategoryFromRules(String description) {
        return keywordRules.firstMatch(description);
    }

    private Optional<CorrectionRecord> findCorrection(UUID ownerId, String vendorName) {
        if (ownerId == null || vendorName == null || vendorName.isBlank()) {
            return Optional.empty();
        }
        try {
            return correctionLedger.latestCorrectionFor(ownerId, vendorName);
        } catch (DataAccessException e) {
            log.warn("[Classification] Correction lookup failed for ownerId={}, using keyword rules: {}", ownerId, e.getMessage());
            return Optional.empty();
        }
    }

    private static String joinText(String description, String vendorName) {
        String d = description == null ? "" : description.trim();
        String v = vendorName == null ? "" : vendorName.trim();
        if (d.isEmpty()) return v;
        if (v.isEmpty()) return d;
        return d + " " + v;
    }
}
