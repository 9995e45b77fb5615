package com.delta.propertytracker.crawl.extract;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Spanish amenity keywords mapped to canonical English tags. Keywords are matched against
 * accent-folded, lower-cased page text.
 */
public final class AmenityTable {

    public record Entry(String keyword, String tag) {
    }

    private static final List<Entry> DEFAULT_ENTRIES = List.of(
        new Entry("piscina", "pool"),
        new Entry("gimnasio", "gym"),
        new Entry("seguridad", "security"),
        new Entry("portero", "doorman"),
        new Entry("jardin", "garden"),
        new Entry("terraza", "terrace"),
        new Entry("balcon", "balcony"),
        new Entry("bodega", "storage"),
        new Entry("quincho", "bbq area"),
        new Entry("sala multiuso", "multipurpose room"),
        new Entry("salon de eventos", "event room")
    );

    private final List<Entry> entries;

    public AmenityTable(List<Entry> entries) {
        this.entries = entries.stream()
            .map(entry -> new Entry(TextNormalizer.fold(entry.keyword()), entry.tag()))
            .toList();
    }

    public static AmenityTable defaultTable() {
        return new AmenityTable(DEFAULT_ENTRIES);
    }

    public List<Entry> entries() {
        return entries;
    }

    /** Tags whose keyword occurs in {@code text}, in table order. */
    public Set<String> tagsIn(String text) {
        Set<String> tags = new LinkedHashSet<>();
        String folded = TextNormalizer.fold(text);
        if (folded.isBlank()) {
            return tags;
        }
        for (Entry entry : entries) {
            if (folded.contains(entry.keyword())) {
                tags.add(entry.tag());
            }
        }
        return tags;
    }
}
