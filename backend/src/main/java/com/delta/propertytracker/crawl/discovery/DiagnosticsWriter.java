package com.delta.propertytracker.crawl.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;

/** Saves raw page content when a result page cannot be read, for later inspection. */
@Component
public class DiagnosticsWriter {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsWriter.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    public DiagnosticsWriter(Clock clock) {
        this.clock = clock;
    }

    public Path writePage(String directory, String label, int pageIndex, String content) {
        String stamp = STAMP.format(clock.instant().atZone(clock.getZone()));
        Path target = Path.of(directory).resolve(label + "_page" + pageIndex + "_" + stamp + ".html");
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content == null ? "" : content, StandardCharsets.UTF_8);
            log.info("Saved page diagnostics to {}", target);
            return target;
        } catch (IOException e) {
            log.warn("Failed to write page diagnostics to {}", target, e);
            return null;
        }
    }
}
