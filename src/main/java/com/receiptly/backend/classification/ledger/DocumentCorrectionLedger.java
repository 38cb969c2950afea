package com.receiptly.backend.classification.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.receiptly.backend.entities.Document;
import com.receiptly.backend.entities.ExtractedFields;
import com.receiptly.backend.enums.ReviewStatus;
import com.receiptly.backend.repositories.DocumentRepository;
import com.receiptly.backend.review.ChangeSet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Correction ledger backed by the documents table: every CORRECTED document whose review
 * changed the taxonomy is one correction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentCorrectionLedger implements CorrectionLedger {

    /** corrections read per query, newest first */
    static final int PAGE_SIZE = 200;

    private final DocumentRepository documentRepository;

    /**
     * Walks the owner's taxonomy corrections newest first, page by page, and stops at the first
     * page holding a match. Earlier pages are newer, so that match is the latest one.
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<CorrectionRecord> latestCorrectionFor(UUID ownerId, String vendorName) {
        if (ownerId == null || VendorKeys.normalize(vendorName).isEmpty()) {
            return Optional.empty();
        }

        int scanned = 0;
        for (int page = 0; ; page++) {
            List<Document> corrected = documentRepository.findTaxonomyCorrections(
                    ownerId,
                    ReviewStatus.CORRECTED,
                    PageRequest.of(page, PAGE_SIZE)
            );
            scanned += corrected.size();

            List<CorrectionRecord> records = new ArrayList<>();
            for (Document document : corrected) {
                toCorrection(document).ifPresent(records::add);
            }

            Optional<CorrectionRecord> match = CorrectionMatcher.selectLatest(vendorName, records);
            if (match.isPresent() || corrected.size() < PAGE_SIZE) {
                log.debug("[CorrectionLedger] ownerId={} vendor='{}' scanned={} matched={}",
                        ownerId, vendorName, scanned, match.map(CorrectionRecord::documentId).orElse(null));
                return match;
            }
        }
    }

    static Optional<CorrectionRecord> toCorrection(Document document) {
        if (document == null) return Optional.empty();
        ExtractedFields fields = document.getExtractedFields();
        if (fields == null || fields.getReviewStatus() != ReviewStatus.CORRECTED) return Optional.empty();
        if (VendorKeys.normalize(fields.getVendorName()).isEmpty()) return Optional.empty();
        if (!ChangeSet.hasTaxonomyChange(fields.getReviewChanges())) return Optional.empty();

        return Optional.of(new CorrectionRecord(
                document.getId(),
                VendorKeys.normalize(fields.getVendorName()),
                fields.getSuggestedCategory(),
                fields.getExpenseArticle(),
                fields.getPotentiallyDeductible(),
                CorrectionRecord.SOURCE_MANUAL_REVIEW,
                document.getUploadedAt()
        ));
    }
}
