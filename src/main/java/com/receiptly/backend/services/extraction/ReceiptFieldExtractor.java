package com.receiptly.backend.services.extraction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristics that read receipt fields out of raw OCR text.
 *
 * Every method is pure and tolerant: malformed input gives {@link Optional#empty()},
 * never an exception.
 */
public final class ReceiptFieldExtractor {

    private ReceiptFieldExtractor() {}

    private static final Pattern AMOUNT = Pattern.compile(
            "(?:£|\\$|€|EUR\\s*|GBP\\s*|USD\\s*)?\\s*([0-9]{1,6}(?:[.,][0-9]{2})?)");

    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})[-/](\\d{2})[-/](\\d{2})\\b");

    private static final Pattern DAY_MONTH_NAME_DATE = Pattern.compile(
            "\\b(\\d{1,2})\\s+(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+(\\d{2,4})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMERIC_DMY_DATE = Pattern.compile("\\b(\\d{1,2})[/-](\\d{1,2})[/-](\\d{2,4})\\b");

    private static final List<String> AMOUNT_KEYWORDS = List.of(
            "total",
            "amount due",
            "balance due",
            "grand total",
            "total paid",
            "payment due"
    );

    private static final List<String> VENDOR_EXCLUDE_KEYWORDS = List.of(
            "receipt",
            "invoice",
            "date",
            "total",
            "subtotal",
            "vat",
            "tax",
            "amount",
            "thank"
    );

    private static final Set<String> FILENAME_NOISE_TOKENS = Set.of("receipt", "invoice", "scan", "document");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1),
            Map.entry("feb", 2),
            Map.entry("mar", 3),
            Map.entry("apr", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6),
            Map.entry("jul", 7),
            Map.entry("aug", 8),
            Map.entry("sep", 9),
            Map.entry("sept", 9),
            Map.entry("oct", 10),
            Map.entry("nov", 11),
            Map.entry("dec", 12)
    );

    static final int MAX_VENDOR_LENGTH = 64;
    static final int MAX_VENDOR_DIGITS = 3;
    static final String ELLIPSIS = "...";

    /**
     * Largest amount on a "total"-like line, else the largest amount anywhere.
     * Receipts list smaller line items above the labelled payable total.
     */
    public static Optional<BigDecimal> extractTotalAmount(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        BigDecimal bestKeyword = null;
        BigDecimal bestAny = null;

        for (String rawLine : text.split("\\R")) {
            String line = normalizeWhitespace(rawLine);
            if (line.isEmpty()) continue;

            boolean keywordLine = containsAny(line.toLowerCase(Locale.ROOT), AMOUNT_KEYWORDS);
            Matcher m = AMOUNT.matcher(line);
            while (m.find()) {
                BigDecimal amount = parseAmountToken(m.group(1));
                if (amount == null) continue;
                bestAny = max(bestAny, amount);
                if (keywordLine) {
                    bestKeyword = max(bestKeyword, amount);
                }
            }
        }

        return Optional.ofNullable(bestKeyword != null ? bestKeyword : bestAny);
    }

    /**
     * First parseable date, searching "date" lines before all lines.
     * Per line: ISO, then day + month name + year, then numeric day/month/year.
     */
    public static Optional<LocalDate> extractTransactionDate(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        List<String> candidates = new ArrayList<>();
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (!line.isEmpty()) candidates.add(line);
        }

        List<String> searchLines = new ArrayList<>();
        for (String line : candidates) {
            if (line.toLowerCase(Locale.ROOT).contains("date")) searchLines.add(line);
        }
        searchLines.addAll(candidates);

        for (String line : searchLines) {
            Optional<LocalDate> date = parseDateInLine(line);
            if (date.isPresent()) return date;
        }
        return Optional.empty();
    }

    /**
     * First short, mostly non-numeric line that is not a receipt label;
     * otherwise a title-cased name derived from the filename.
     */
    public static Optional<String> inferVendorName(String text, String filename) {
        if (text != null) {
            for (String rawLine : text.split("\\R")) {
                String line = normalizeWhitespace(rawLine);
                if (line.isEmpty()) continue;
                if (containsAny(line.toLowerCase(Locale.ROOT), VENDOR_EXCLUDE_KEYWORDS)) continue;
                if (line.length() > MAX_VENDOR_LENGTH) continue;
                if (countDigits(line) > MAX_VENDOR_DIGITS) continue;
                return Optional.of(line);
            }
        }
        return vendorFromFilename(filename);
    }

    static Optional<String> vendorFromFilename(String filename) {
        if (filename == null || filename.isBlank()) return Optional.empty();

        String name = filename.trim().replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        name = name.replace('_', ' ').replace('-', ' ');

        List<String> kept = new ArrayList<>();
        for (String token : normalizeWhitespace(name).toLowerCase(Locale.ROOT).split(" ")) {
            if (token.isEmpty() || FILENAME_NOISE_TOKENS.contains(token)) continue;
            kept.add(capitalize(token));
        }
        return kept.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", kept));
    }

    /**
     * Whitespace-normalized text cut to {@code limit} characters; a truncated result ends with "..."
     * and is exactly {@code limit} long.
     */
    public static Optional<String> buildTextExcerpt(String text, int limit) {
        String normalized = normalizeWhitespace(text);
        if (normalized.isEmpty()) return Optional.empty();
        if (normalized.length() <= limit) return Optional.of(normalized);
        if (limit <= ELLIPSIS.length()) {
            return Optional.of(ELLIPSIS.substring(0, Math.max(0, limit)));
        }
        return Optional.of(normalized.substring(0, limit - ELLIPSIS.length()) + ELLIPSIS);
    }

    public static String normalizeWhitespace(String value) {
        if (value == null) return "";
        return value.replaceAll("\\s+", " ").trim();
    }

    private static Optional<LocalDate> parseDateInLine(String line) {
        Matcher iso = ISO_DATE.matcher(line);
        while (iso.find()) {
            LocalDate d = safeDate(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3)));
            if (d != null) return Optional.of(d);
        }

        Matcher named = DAY_MONTH_NAME_DATE.matcher(line);
        while (named.find()) {
            Integer month = MONTHS.get(named.group(2).toLowerCase(Locale.ROOT));
            if (month == null) continue;
            LocalDate d = safeDate(parseYear(named.group(3)), month, Integer.parseInt(named.group(1)));
            if (d != null) return Optional.of(d);
        }

        Matcher dmy = NUMERIC_DMY_DATE.matcher(line);
        while (dmy.find()) {
            LocalDate d = safeDate(parseYear(dmy.group(3)), Integer.parseInt(dmy.group(2)), Integer.parseInt(dmy.group(1)));
            if (d != null) return Optional.of(d);
        }
        return Optional.empty();
    }

    private static LocalDate safeDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static int parseYear(String value) {
        int parsed = Integer.parseInt(value);
        return value.length() == 2 ? 2000 + parsed : parsed;
    }

    private static BigDecimal parseAmountToken(String token) {
        if (token == null) return null;
        String normalized = token.replace(" ", "").replace(',', '.');
        try {
            BigDecimal amount = new BigDecimal(normalized);
            if (amount.signum() <= 0) return null;
            return amount.setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal max(BigDecimal current, BigDecimal candidate) {
        return current == null || candidate.compareTo(current) > 0 ? candidate : current;
    }

    private static boolean containsAny(String lower, List<String> keywords) {
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    private static int countDigits(String value) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) count++;
        }
        return count;
    }

    private static String capitalize(String token) {
        return Character.toUpperCase(token.charAt(0)) + token.substring(1);
    }
}
