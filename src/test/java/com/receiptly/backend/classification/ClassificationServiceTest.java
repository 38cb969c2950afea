package com.receiptly.backend.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import com.receiptly.backend.classification.ledger.CorrectionLedger;
import com.receiptly.backend.classification.ledger.DocumentCorrectionLedger;
import com.receiptly.backend.classification.rules.ExpenseArticles;
import com.receiptly.backend.classification.rules.KeywordRules;
import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.enums.ReviewField;
import com.receiptly.backend.enums.ReviewStatus;
import com.receiptly.backend.repositories.DocumentRepository;
import com.receiptly.backend.review.FieldChange;

class ClassificationServiceTest {

    @Mock
    private DocumentRepository documentRepository;

    private ClassificationService service;

    private final UUID ownerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new ClassificationService(new DocumentCorrectionLedger(documentRepository), KeywordRules.DEFAULT);
    }

    @Test
    void correctedVendor_overridesKeywordRule() {
        Document corrected = correctedDocument("Tesco Stores UK", "food_and_drink", LocalDateTime.of(2026, 2, 1, 10, 0),
                new FieldChange(ReviewField.SUGGESTED_CATEGORY, "groceries", "food_and_drink"));
        when(documentRepository.findTaxonomyCorrections(eq(ownerId), eq(ReviewStatus.CORRECTED), any(Pageable.class)))
                .thenReturn(List.of(corrected));

        CategoryResult result = service.categorize("TESCO Stores UK LTD", "TESCO Stores UK LTD receipt.jpg", ownerId);

        assertEquals("food_and_drink", result.category());
        assertEquals("meals_and_entertainment", result.expenseArticle());
        assertFalse(result.potentiallyDeductible());
        assertEquals(CategoryResult.SOURCE_MANUAL_REVIEW, result.source());
    }

    @Test
    void latestCorrection_winsAmongSeveral() {
        Document older = correctedDocument("Costa", "food_and_drink", LocalDateTime.of(2026, 1, 1, 9, 0),
                new FieldChange(ReviewField.SUGGESTED_CATEGORY, null, "food_and_drink"));
        Document newer = correctedDocument("Costa Coffee", "office_supplies", LocalDateTime.of(2026, 2, 1, 9, 0),
                new FieldChange(ReviewField.SUGGESTED_CATEGORY, "food_and_drink", "office_supplies"));
        when(documentRepository.findTaxonomyCorrections(eq(ownerId), eq(ReviewStatus.CORRECTED), any(Pageable.class)))
                .thenReturn(List.of(older, newer));

        CategoryResult result = service.categorize("costa", "costa", ownerId);

        assertEquals("office_supplies", result.category());
    }

    @Test
    void amountOnlyCorrection_doesNotAlterCategorization() {
        Document amountOnly = correctedDocument("Tesco Stores UK", "food_and_drink", LocalDateTime.of(2026, 2, 1, 10, 0),
                new FieldChange(ReviewField.TOTAL_AMOUNT, new BigDecimal("10.00"), new BigDecimal("12.00")));
        when(documentRepository.findTaxonomyCorrections(eq(ownerId), eq(ReviewStatus.CORRECTED), any(Pageable.class)))
                .thenReturn(List.of(amountOnly));

        CategoryResult result = service.categorize("Tesco Stores UK", "Tesco Stores UK", ownerId);

        assertEquals("groceries", result.category());
        assertEquals("other", result.expenseArticle());
        assertFalse(result.potentiallyDeductible());
        assertEquals(CategoryResult.SOURCE_KEYWORD_RULES, result.source());
    }

    @Test
    void blankVendor_skipsLedger() {
        CategoryResult result = service.categorize("  ", "Uber trip", ownerId);

        assertEquals("transport", result.category());
        assertEquals("travel_costs", result.expenseArticle());
        assertTrue(result.potentiallyDeductible());
        verify(documentRepository, never()).findTaxonomyCorrections(any(), any(), any());
    }

    @Test
    void noMatch_returnsAllNull() {
        when(documentRepository.findTaxonomyCorrections(any(), any(), any())).thenReturn(List.of());

        CategoryResult result = service.categorize("Corner Shop", "misc", ownerId);

        assertTrue(result.isEmpty());
        assertNull(result.expenseArticle());
        assertNull(result.potentiallyDeductible());
        assertNull(result.source());
    }

    @Test
    void ledgerFailure_fallsBackToKeywordRules() {
        CorrectionLedger failing = Mockito.mock(CorrectionLedger.class);
        when(failing.latestCorrectionFor(any(), anyString())).thenThrow(new DataAccessResourceFailureException("db down"));
        ClassificationService withFailingLedger = new ClassificationService(failing, KeywordRules.DEFAULT);

        CategoryResult result = withFailingLedger.categorize("Netflix", "Netflix monthly", ownerId);

        assertEquals("subscriptions", result.category());
        assertEquals("software_subscriptions", result.expenseArticle());
    }

    @Test
    void suggestCategoryFromRules_firstRuleWins() {
        assertEquals("groceries", service.suggestCategoryFromRules("Tesco groceries order").orElse(null));
        // "uber" (transport) is listed before "restaurant" (food_and_drink)
        assertEquals("transport", service.suggestCategoryFromRules("Uber to restaurant").orElse(null));
        assertEquals("income", service.suggestCategoryFromRules("Salary February").orElse(null));
        assertTrue(service.suggestCategoryFromRules("hardware store").isEmpty());
        assertTrue(service.suggestCategoryFromRules(null).isEmpty());
    }

    private Document correctedDocument(String vendor, String category, LocalDateTime uploadedAt, FieldChange... changes) {
        Document document = new Document();
        document.setId(UUID.randomUUID());
        document.setOwnerId(ownerId);
        document.setFilename("receipt.jpg");
        document.setStatus(DocumentStatus.COMPLETED);
        document.setUploadedAt(uploadedAt);
        document.setExtractedFields(ExtractedFields.builder()
                .vendorName(vendor)
                .suggestedCategory(category)
                .expenseArticle(ExpenseArticles.forCategory(category).map(ExpenseArticles.ExpenseArticle::article).orElse(null))
                .potentiallyDeductible(false)
                .reviewStatus(ReviewStatus.CORRECTED)
                .reviewChanges(List.of(changes))
                .build());
        return document;
    }
}
