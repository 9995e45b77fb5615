package com.delta.propertytracker.crawl.validation;

import com.delta.propertytracker.crawl.model.PropertyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes free text on a record and reports implausible values. Values are flagged,
 * never dropped or clamped.
 */
@Component
public class PropertyRecordCleaner {
    private static final Logger log = LoggerFactory.getLogger(PropertyRecordCleaner.class);

    static final double MIN_AREA_M2 = 20.0;
    static final double MAX_AREA_M2 = 1000.0;
    static final double MIN_LATITUDE = -33.7;
    static final double MAX_LATITUDE = -33.2;
    static final double MIN_LONGITUDE = -71.0;
    static final double MAX_LONGITUDE = -70.3;
    static final int MAX_BEDROOMS = 10;
    static final int MAX_BATHROOMS = 8;

    /** Returns a cleaned copy; the input is left untouched. Cleaning twice changes nothing. */
    public PropertyRecord clean(PropertyRecord record) {
        PropertyRecord cleaned = record.copy();
        cleaned.setTitle(collapse(record.getTitle()));
        cleaned.setPrice(collapse(record.getPrice()));
        cleaned.setAddress(titleCase(collapse(record.getAddress())));
        cleaned.setNeighborhood(titleCase(collapse(record.getNeighborhood())));
        cleaned.setAmenities(record.getAmenities());

        for (String flag : rangeFlags(cleaned)) {
            log.warn("Listing {}: {}", cleaned.getListingId().isEmpty() ? cleaned.getUrl() : cleaned.getListingId(), flag);
        }
        return cleaned;
    }

    public List<String> rangeFlags(PropertyRecord record) {
        List<String> flags = new ArrayList<>();
        Double area = record.getTotalAreaM2();
        if (area != null && (area < MIN_AREA_M2 || area > MAX_AREA_M2)) {
            flags.add("Unusual area: " + area + " m2");
        }
        Double lat = record.getLatitude();
        Double lon = record.getLongitude();
        if (lat != null && lon != null
            && !(lat >= MIN_LATITUDE && lat <= MAX_LATITUDE && lon >= MIN_LONGITUDE && lon <= MAX_LONGITUDE)) {
            flags.add("Coordinates outside Santiago area: " + lat + ", " + lon);
        }
        if (record.getBedrooms() != null && record.getBedrooms() > MAX_BEDROOMS) {
            flags.add("Unusual bedroom count: " + record.getBedrooms());
        }
        if (record.getBathrooms() != null && record.getBathrooms() > MAX_BATHROOMS) {
            flags.add("Unusual bathroom count: " + record.getBathrooms());
        }
        return flags;
    }

    static String collapse(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = value.replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    /** Upper-cases the first letter of every run of letters and lower-cases the rest. */
    static String titleCase(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(value.length());
        boolean previousLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                out.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                out.append(c);
                previousLetter = false;
            }
        }
        return out.toString();
    }
}
