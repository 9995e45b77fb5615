package com.delta.propertytracker.crawl.extract;

import java.time.Year;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex table for the Spanish listing vocabulary. Each numeric field has an ordered list of
 * patterns; group 1 of the first matching pattern is the value. Extend the table rather
 * than adding branches to the extractor.
 */
public final class ExtractionPatterns {

    public enum NumericField {
        BEDROOMS(false),
        BATHROOMS(false),
        TOTAL_AREA(true),
        BUILT_AREA(true),
        PARKING(false),
        FLOOR(false),
        TOTAL_FLOORS(false);

        private final boolean decimal;

        NumericField(boolean decimal) {
            this.decimal = decimal;
        }

        public boolean decimal() {
            return decimal;
        }
    }

    private static final String AREA = "(\\d{1,4}(?:[.,]\\d+)?)";

    private static final Map<NumericField, List<Pattern>> NUMERIC = new EnumMap<>(NumericField.class);

    static {
        NUMERIC.put(NumericField.BEDROOMS, compile(
            "(\\d{1,2})\\s*(?:dormitorios?|dorms?\\b|bedrooms?)",
            "dormitorios?\\s*:?\\s*(\\d{1,2})\\b"
        ));
        NUMERIC.put(NumericField.BATHROOMS, compile(
            "(\\d{1,2})\\s*(?:baños?|bathrooms?|baths?\\b)",
            "baños?\\s*:?\\s*(\\d{1,2})\\b"
        ));
        NUMERIC.put(NumericField.TOTAL_AREA, compile(
            AREA + "\\s*m(?:²|2)?\\s*(?:totales|total|const)",
            "superficie total\\s*:?\\s*" + AREA
        ));
        NUMERIC.put(NumericField.BUILT_AREA, compile(
            AREA + "\\s*m(?:²|2)?\\s*(?:útiles|útil|utiles|util|built)",
            "superficie útil\\s*:?\\s*" + AREA
        ));
        NUMERIC.put(NumericField.PARKING, compile(
            "(\\d{1,2})\\s*(?:estacionamientos?|parking|garages?)",
            "estacionamientos?\\s*:?\\s*(\\d{1,2})\\b"
        ));
        NUMERIC.put(NumericField.FLOOR, compile(
            "número de piso de la unidad\\s*:?\\s*(\\d{1,3})",
            "\\bpiso\\s*(?:n[°º]\\s*)?(\\d{1,3})\\b",
            "\\bfloor\\s*(\\d{1,3})\\b"
        ));
        NUMERIC.put(NumericField.TOTAL_FLOORS, compile(
            "cantidad de pisos\\s*:?\\s*(\\d{1,3})",
            "(\\d{1,3})\\s*pisos\\b"
        ));
    }

    private static final List<Pattern> YEAR_BUILT = compile(
        "(?:año de construcción|construido en|year built)\\D{0,5}(\\d{4})",
        "(\\d{4})\\s*(?:año|year)"
    );
    private static final Pattern AGE_IN_YEARS = Pattern.compile("antigüedad\\s*:?\\s*(\\d{1,3})\\s*años?");

    private static final Pattern NO_ELEVATOR = Pattern.compile("sin ascensor|no elevator");
    private static final Pattern ELEVATOR = Pattern.compile("ascensor|elevator");

    private static final String CARDINAL = "nororiente|norponiente|suroriente|surponiente|norte|sur|oriente|poniente";
    private static final Pattern ORIENTATION = Pattern.compile(
        "orientaci[oó]n\\s*:?\\s*((?:" + CARDINAL + ")(?:\\s*(?:-|/|y)\\s*(?:" + CARDINAL + "))*)"
    );

    private static final Pattern PUBLISHED_AGO = Pattern.compile(
        "publicado hace (\\d{1,4})\\s*(d[ií]as?|days?|mes(?:es)?|months?|a[ñn]os?|years?)"
    );
    private static final Pattern PUBLISHED_TODAY = Pattern.compile("publicado hoy");

    private static final Pattern MAINTENANCE_FEE = Pattern.compile(
        "gastos comunes[^$\\d]{0,40}(\\$\\s*\\d[\\d.,]*)"
    );
    private static final Pattern CLP_AMOUNT = Pattern.compile("\\$\\s*\\d[\\d.,]*");

    private ExtractionPatterns() {
    }

    public static Integer findInteger(NumericField field, String text) {
        String match = find(field, text);
        return match == null ? null : LocaleNumbers.parseInteger(match);
    }

    public static Double findDecimal(NumericField field, String text) {
        String match = find(field, text);
        return match == null ? null : LocaleNumbers.parseMeasure(match);
    }

    /**
     * Years since construction. A construction year is accepted only within
     * {@code (1900, currentYear]}; "antigüedad N años" is read as the age directly.
     */
    public static Integer buildingAge(String text, Year currentYear) {
        String lower = lower(text);
        if (lower == null) {
            return null;
        }
        int now = currentYear.getValue();
        for (Pattern pattern : YEAR_BUILT) {
            Matcher matcher = pattern.matcher(lower);
            while (matcher.find()) {
                int year = Integer.parseInt(matcher.group(1));
                if (year > 1900 && year <= now) {
                    return now - year;
                }
            }
        }
        Matcher age = AGE_IN_YEARS.matcher(lower);
        if (age.find()) {
            return Integer.parseInt(age.group(1));
        }
        return null;
    }

    public static Boolean elevator(String text) {
        String lower = lower(text);
        if (lower == null) {
            return null;
        }
        if (NO_ELEVATOR.matcher(lower).find()) {
            return Boolean.FALSE;
        }
        if (ELEVATOR.matcher(lower).find()) {
            return Boolean.TRUE;
        }
        return null;
    }

    public static String orientation(String text) {
        String lower = lower(text);
        if (lower == null) {
            return null;
        }
        Matcher matcher = ORIENTATION.matcher(lower);
        return matcher.find() ? matcher.group(1).replaceAll("\\s+", " ").trim() : null;
    }

    /** Days on market from "publicado hace N días/meses/años"; months count 30 days, years 365. */
    public static ListingAge listingAge(String text) {
        String lower = lower(text);
        if (lower == null) {
            return null;
        }
        Matcher matcher = PUBLISHED_AGO.matcher(lower);
        if (matcher.find()) {
            int amount = Integer.parseInt(matcher.group(1));
            String unit = matcher.group(2);
            int multiplier = 1;
            if (unit.startsWith("m")) {
                multiplier = 30;
            } else if (unit.startsWith("a") || unit.startsWith("y")) {
                multiplier = 365;
            }
            return new ListingAge("hace " + amount + " " + unit, amount * multiplier);
        }
        if (PUBLISHED_TODAY.matcher(lower).find()) {
            return new ListingAge("hoy", 0);
        }
        return null;
    }

    public static String maintenanceFee(String text) {
        String lower = lower(text);
        if (lower == null) {
            return null;
        }
        Matcher matcher = MAINTENANCE_FEE.matcher(lower);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    /** First "$ N" amount in {@code text}, as written. */
    public static String clpAmount(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = CLP_AMOUNT.matcher(text);
        return matcher.find() ? matcher.group().trim() : null;
    }

    private static String find(NumericField field, String text) {
        String lower = lower(text);
        if (lower == null) {
            return null;
        }
        for (Pattern pattern : NUMERIC.get(field)) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private static String lower(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return text.toLowerCase(Locale.ROOT);
    }

    private static List<Pattern> compile(String... expressions) {
        return Arrays.stream(expressions).map(Pattern::compile).toList();
    }

    public record ListingAge(String text, int days) {
    }
}
