package com.receiptly.backend.classification.ledger;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the correction that applies to a vendor, independent of storage.
 */
public final class CorrectionMatcher {

    private CorrectionMatcher() {}

    public static Optional<CorrectionRecord> selectLatest(String vendorName, Collection<CorrectionRecord> records) {
        if (records == null || records.isEmpty()) return Optional.empty();
        if (VendorKeys.normalize(vendorName).isEmpty()) return Optional.empty();

        return records.stream()
                .filter(r -> r != null && VendorKeys.matches(r.vendorKey(), vendorName))
                .max(Comparator.comparing(
                        (CorrectionRecord r) -> r.effectiveAt() != null ? r.effectiveAt() : LocalDateTime.MIN));
    }
}
