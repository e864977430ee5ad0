package com.investigation.linkage.engine;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Map;

/**
 * Field access and lenient number parsing for mapped source records.
 * Malformed numbers read as zero. Amounts are magnitudes: direction comes from the
 * from/to columns, so a signed debit such as {@code -600000} reads as 600000.
 */
public final class RecordValues {

    private RecordValues() {}

    /** Trimmed field value, or "" when absent. */
    public static String text(Map<String, String> record, String field) {
        String value = record.get(field);
        return value == null ? "" : value.trim();
    }

    /** Trimmed field value, or null when absent or blank. */
    public static String optional(Map<String, String> record, String field) {
        String value = text(record, field);
        return value.isEmpty() ? null : value;
    }

    public static String firstNonBlank(String preferred, String fallback) {
        return preferred == null || preferred.isBlank() ? fallback : preferred;
    }

    public static double parseAmount(String raw) {
        if (raw == null) return 0.0;
        String cleaned = raw.trim().replace(",", "").replace("฿", "");
        if (cleaned.isEmpty()) return 0.0;
        try {
            double value = Double.parseDouble(cleaned);
            return Double.isFinite(value) ? Math.abs(value) : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    /** Whole seconds; fractional input is truncated. */
    public static long parseSeconds(String raw) {
        return (long) parseAmount(raw);
    }

    public static String formatNumber(double value) {
        DecimalFormat format = new DecimalFormat("#,##0.##", DecimalFormatSymbols.getInstance(Locale.US));
        return format.format(value);
    }

    /** Full precision, for crypto units where fractions well below a cent are common. */
    public static String formatUnits(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String formatBaht(double value) {
        return "฿" + formatNumber(value);
    }
}
