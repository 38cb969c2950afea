package com.receiptly.backend.classification.ledger;

import java.util.Optional;
import java.util.UUID;

/**
 * Read model over past human corrections, always scoped to one owner.
 */
public interface CorrectionLedger {

    /**
     * Most recently uploaded correction whose vendor matches {@code vendorName}.
     */
    Optional<CorrectionRecord> latestCorrectionFor(UUID ownerId, String vendorName);
}
