package com.receiptly.backend.review;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.receiptly.backend.enums.ReviewField;

/**
 * Canonical forms used to compare review values.
 *
 * Amounts become 2-digit BigDecimals, dates become LocalDate (time part dropped),
 * booleans become Boolean and text is whitespace-collapsed. A value that cannot be
 * read as its field kind is kept as normalized text.
 */
public final class ReviewValues {

    private static final Pattern LEADING_ISO_DATE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");

    private ReviewValues() {}

    public static Object normalize(ReviewField.Kind kind, Object value) {
        if (value == null) return null;
        return switch (kind) {
            case AMOUNT -> normalizeAmount(value);
            case DATE -> normalizeDate(value);
            case BOOLEAN -> normalizeBoolean(value);
            case TEXT -> normalizeText(value);
        };
    }

    public static String normalizeText(Object value) {
        if (value == null) return null;
        String s = String.valueOf(value).replaceAll("\\s+", " ").trim();
        return s.isEmpty() ? null : s;
    }

    static Object normalizeAmount(Object value) {
        if (value instanceof BigDecimal bd) {
            return bd.setScale(2, RoundingMode.HALF_UP);
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).setScale(2, RoundingMode.HALF_UP);
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString()).setScale(2, RoundingMode.HALF_UP);
        }
        String text = normalizeText(value);
        if (text == null) return null;
        String cleaned = text.replaceAll("[£$€\\s]", "").replace(',', '.');
        try {
            return new BigDecimal(cleaned).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return text;
        }
    }

    static Object normalizeDate(Object value) {
        if (value instanceof LocalDate d) return d;
        if (value instanceof LocalDateTime dt) return dt.toLocalDate();
        if (value instanceof OffsetDateTime odt) return odt.toLocalDate();
        if (value instanceof ZonedDateTime zdt) return zdt.toLocalDate();
        if (value instanceof Instant instant) return instant.atOffset(ZoneOffset.UTC).toLocalDate();

        String text = normalizeText(value);
        if (text == null) return null;
        Matcher m = LEADING_ISO_DATE.matcher(text);
        if (m.find()) {
            try {
                return LocalDate.parse(m.group(1));
            } catch (DateTimeParseException e) {
                return text;
            }
        }
        return text;
    }

    static Object normalizeBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        String text = normalizeText(value);
        if (text == null) return null;
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "y", "1" -> Boolean.TRUE;
            case "false", "no", "n", "0" -> Boolean.FALSE;
            default -> text;
        };
    }
}
