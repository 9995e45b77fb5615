package com.delta.propertytracker.crawl.persistence;

import com.delta.propertytracker.crawl.model.PropertyRecord;

import java.time.Duration;
import java.util.List;

/** The durable property store. Implementations are the only writers to it. */
public interface PropertyPersistenceGateway {

    /**
     * Inserts the record, or overwrites the stored row with the same listing id. Records
     * without a listing id are always inserted.
     */
    void upsert(PropertyRecord record);

    PropertyStats aggregateStats(Duration recentWindow);

    /** Most recently scraped records first. */
    List<PropertyRecord> findRecent(int limit);
}
