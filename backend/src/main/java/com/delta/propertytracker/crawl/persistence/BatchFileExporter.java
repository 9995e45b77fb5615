package com.delta.propertytracker.crawl.persistence;

import com.delta.propertytracker.crawl.model.ListingReference;
import com.delta.propertytracker.crawl.model.PropertyRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes crawl results as single-line UTF-8 JSON arrays. These files are the durable
 * record of a run when the database is disabled or unavailable.
 */
@Component
public class BatchFileExporter {
    private static final Logger log = LoggerFactory.getLogger(BatchFileExporter.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BatchFileExporter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /** Writes {@code <prefix>_batch_<timestamp>.json}; a numeric suffix avoids clobbering a batch from the same second. */
    public Path writeBatch(String directory, String prefix, List<PropertyRecord> records) {
        if (records == null || records.isEmpty()) {
            return null;
        }
        String stamp = STAMP.format(clock.instant().atZone(clock.getZone()));
        Path dir = Path.of(directory);
        Path target = dir.resolve(prefix + "_batch_" + stamp + ".json");
        int sequence = 2;
        while (Files.exists(target)) {
            target = dir.resolve(prefix + "_batch_" + stamp + "_" + sequence + ".json");
            sequence++;
        }
        return write(target, records, "batch of " + records.size() + " properties");
    }

    public Path writeComplete(String directory, String prefix, List<PropertyRecord> records) {
        if (records == null || records.isEmpty()) {
            log.warn("No detailed properties to export");
            return null;
        }
        Path target = Path.of(directory).resolve(prefix + "_complete.json");
        return write(target, records, records.size() + " detailed properties");
    }

    public Path writeReferences(String directory, String fileName, List<ListingReference> references) {
        Path target = Path.of(directory).resolve(fileName);
        return write(target, references == null ? List.of() : references, "listing references");
    }

    private Path write(Path target, Object payload, String description) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8);
            log.info("Saved {} to {}", description, target);
            return target;
        } catch (IOException e) {
            log.warn("Failed to write {} to {}", description, target, e);
            return null;
        }
    }
}
