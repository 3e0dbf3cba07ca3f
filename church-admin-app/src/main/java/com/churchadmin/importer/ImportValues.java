package com.churchadmin.importer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.UUID;

/**
 * Lenient parsing of spreadsheet cell values. Every method returns null for a value it cannot read,
 * leaving it to the caller to decide whether that is a row error.
 */
public final class ImportValues {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("uuuu/M/d").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("M-d-uuuu").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("M/d/uu").withResolverStyle(ResolverStyle.STRICT)
    );

    private ImportValues() {
    }

    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();

        // ISO date-time ("2024-01-15T00:00:00Z"): keep the date part
        if (value.length() > 10 && (value.charAt(10) == 'T' || value.charAt(10) == ' ')) {
            value = value.substring(0, 10);
        }

        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        return null;
    }

    /**
     * Parses a money cell, accepting "$1,250.00", " 50 " and accounting negatives "(5.00)".
     *
     * @return the amount exactly as written, or null when the cell is blank
     * @throws NumberFormatException when the cell holds something that is not a number
     */
    public static BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();

        boolean negative = false;
        if (value.startsWith("(") && value.endsWith(")")) {
            negative = true;
            value = value.substring(1, value.length() - 1);
        }
        value = value.replace("$", "").replace(",", "").replace(" ", "");
        if (value.isEmpty()) {
            throw new NumberFormatException("Not a number: " + raw);
        }

        BigDecimal amount = new BigDecimal(value);
        return negative ? amount.negate() : amount;
    }

    /**
     * True when the amount has no fraction of a cent, so "12.50" and "12.500" pass but "0.004" does not.
     */
    public static boolean hasCentPrecision(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= 2;
    }

    public static Integer parseInteger(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static UUID parseUuid(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean parseFlag(String raw) {
        return raw != null && "true".equalsIgnoreCase(raw.trim());
    }
}
