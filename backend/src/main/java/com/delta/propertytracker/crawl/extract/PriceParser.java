package com.delta.propertytracker.crawl.extract;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads UF and CLP figures out of a price string. A string may carry both ("UF 8.500
 * ($ 255.000.000)"); both figures are kept and UF is reported as the listing currency.
 */
public final class PriceParser {
    private static final List<Pattern> UF_PATTERNS = List.of(
        Pattern.compile("\\bUF\\s*(\\d[\\d.,]*)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(\\d[\\d.,]*)\\s*UF\\b", Pattern.CASE_INSENSITIVE)
    );
    private static final List<Pattern> CLP_PATTERNS = List.of(
        Pattern.compile("\\$\\s*(\\d[\\d.,]*)"),
        Pattern.compile("\\bCLP\\s*(\\d[\\d.,]*)", Pattern.CASE_INSENSITIVE)
    );

    private PriceParser() {
    }

    public static ParsedPrice parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String raw = text.trim().replaceAll("\\s+", " ");
        Double uf = firstAmount(UF_PATTERNS, raw);
        Double clp = firstAmount(CLP_PATTERNS, raw);
        String currency = null;
        if (uf != null) {
            currency = ParsedPrice.UF;
        } else if (clp != null) {
            currency = ParsedPrice.CLP;
        }
        return new ParsedPrice(raw, uf, clp, currency);
    }

    /** True for text that plausibly holds a price: a currency marker or at least one digit. */
    public static boolean looksLikePrice(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (text.contains("$") || upper.contains("UF") || upper.contains("CLP")) {
            return true;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static Double firstAmount(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Double amount = LocaleNumbers.parseAmount(matcher.group(1));
                if (amount != null) {
                    return amount;
                }
            }
        }
        return null;
    }
}
