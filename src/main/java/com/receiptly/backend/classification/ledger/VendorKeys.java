package com.receiptly.backend.classification.ledger;

import java.text.Normalizer;
import java.util.Locale;

public final class VendorKeys {

    private VendorKeys() {}

    /**
     * Lowercase, accent-free, whitespace-collapsed vendor key. "  TESCO  Stores " => "tesco stores"
     */
    public static String normalize(String vendorName) {
        if (vendorName == null) return "";
        String s = vendorName.trim().toLowerCase(Locale.ROOT);
        s = Normalizer.normalize(s, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        s = s.replaceAll("\\s+", " ");
        return s.trim();
    }

    /**
     * Equal keys, or one contained in the other ("tesco" ~ "tesco stores uk ltd").
     */
    public static boolean matches(String a, String b) {
        // TODO: short keys such as "m&s" match too broadly; require a token-prefix match with a minimum length.
        String ka = normalize(a);
        String kb = normalize(b);
        if (ka.isEmpty() || kb.isEmpty()) return false;
        return ka.equals(kb) || ka.contains(kb) || kb.contains(ka);
    }
}
