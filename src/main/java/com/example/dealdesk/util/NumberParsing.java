package com.example.dealdesk.util;

/**
 * Lenient parsing of amounts typed by the salesperson.
 *
 * Blank, missing or unparsable text reads as zero so that a half-filled form still prices.
 * Thousands separators (spaces, no-break spaces, underscores), a trailing or leading dollar
 * sign and a decimal comma ("1 234,50 $") are tolerated.
 */
public final class NumberParsing {

    private NumberParsing() {}

    public static double parseOrZero(String text) {
        Double value = parseOrNull(text);
        return value == null ? 0.0 : value;
    }

    /** @return the parsed value, or null when the text is blank or not a finite number */
    public static Double parseOrNull(String text) {
        if (text == null) return null;
        String cleaned = text.replace("$", "")
                .replace(" ", "")
                .replace("\u00A0", "")
                .replace("\u202F", "")
                .replace("_", "")
                .trim();
        if (cleaned.isEmpty()) return null;
        if (cleaned.indexOf(',') >= 0) {
            // "1,234.50" uses the comma as a grouping mark, "1234,50" as the decimal mark
            cleaned = cleaned.indexOf('.') >= 0 ? cleaned.replace(",", "") : cleaned.replace(',', '.');
        }
        try {
            double value = Double.parseDouble(cleaned);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
