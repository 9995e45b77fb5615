package com.delta.propertytracker.crawl.extract;

import java.util.regex.Pattern;

/**
 * Number parsing for es-CL page text, where {@code .} groups thousands and {@code ,} marks
 * decimals, but sites are not always consistent about it.
 */
public final class LocaleNumbers {
    private static final Pattern DOTTED_THOUSANDS = Pattern.compile("^\\d{1,3}(\\.\\d{3})+$");
    private static final Pattern DECIMAL_COMMA_TAIL = Pattern.compile(",\\d{1,2}$");

    private LocaleNumbers() {
    }

    /**
     * Parses a currency amount. Every {@code .} is a thousands separator; a {@code ,} is the
     * decimal mark only when it is the last separator and is followed by one or two digits.
     * "8.500" is 8500, "8.500,5" is 8500.5 and "1,250,000" is 1250000.
     */
    public static Double parseAmount(String raw) {
        String value = trimSeparators(raw);
        if (value == null) {
            return null;
        }
        String integerPart = value;
        String fraction = null;
        if (DECIMAL_COMMA_TAIL.matcher(value).find()) {
            int comma = value.lastIndexOf(',');
            integerPart = value.substring(0, comma);
            fraction = value.substring(comma + 1);
        }
        String digits = integerPart.replace(".", "").replace(",", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(fraction == null ? digits : digits + "." + fraction);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses a measurement such as a surface in square meters, where a single separator is
     * normally the decimal mark ("85,5" or "85.5"). Dotted thousands groups ("1.200") still
     * read as thousands.
     */
    public static Double parseMeasure(String raw) {
        String value = trimSeparators(raw);
        if (value == null) {
            return null;
        }
        String normalized;
        if (DOTTED_THOUSANDS.matcher(value).matches()) {
            normalized = value.replace(".", "");
        } else {
            normalized = value.replace(",", ".");
        }
        try {
            return Double.parseDouble(normalized);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer parseInteger(String raw) {
        String value = trimSeparators(raw);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.replace(".", "").replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trimSeparators(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        int start = 0;
        int end = value.length();
        while (start < end && !Character.isDigit(value.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isDigit(value.charAt(end - 1))) {
            end--;
        }
        return start >= end ? null : value.substring(start, end);
    }
}
