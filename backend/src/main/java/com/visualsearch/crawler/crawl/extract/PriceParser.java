package com.visualsearch.crawler.crawl.extract;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Parses display prices such as {@code "1.234,56 €"} or {@code "$1,234.56"}.
 */
public final class PriceParser {
    private static final Pattern NOISE = Pattern.compile("[^0-9.,]");

    private PriceParser() {
    }

    public static BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String cleaned = NOISE.matcher(raw).replaceAll("");
        if (cleaned.isEmpty()) {
            return null;
        }
        int lastComma = cleaned.lastIndexOf(',');
        int lastDot = cleaned.lastIndexOf('.');
        String normalized;
        if (lastComma >= 0 && lastDot >= 0) {
            // right-most separator is the decimal one
            if (lastComma > lastDot) {
                normalized = cleaned.replace(".", "").replace(',', '.');
            } else {
                normalized = cleaned.replace(",", "");
            }
        } else if (lastComma >= 0) {
            int digitsAfter = cleaned.length() - lastComma - 1;
            if (digitsAfter == 2 && cleaned.indexOf(',') == lastComma) {
                normalized = cleaned.replace(',', '.');
            } else {
                normalized = cleaned.replace(",", "");
            }
        } else {
            normalized = cleaned;
        }
        if (normalized.indexOf('.') != normalized.lastIndexOf('.')) {
            // "1.234.567" style grouping
            normalized = normalized.replace(".", "");
        }
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
