package com.delta.propertytracker.crawl.detail;

import com.delta.propertytracker.config.ScrapeConfig;
import com.delta.propertytracker.crawl.browser.BrowserSession;
import com.delta.propertytracker.crawl.browser.NavigationException;
import com.delta.propertytracker.crawl.browser.WaitPolicy;
import com.delta.propertytracker.crawl.extract.ExtractionScope;
import com.delta.propertytracker.crawl.extract.FieldExtractor;
import com.delta.propertytracker.crawl.model.ListingReference;
import com.delta.propertytracker.crawl.model.PropertyRecord;
import com.delta.propertytracker.crawl.pacing.PacingScheduler;
import com.delta.propertytracker.crawl.pacing.Sleeper;
import com.delta.propertytracker.crawl.util.ListingUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Loads one listing's detail page and fills a {@link PropertyRecord} from it. Extraction
 * passes run independently; a pass that fails leaves its fields {@code null} and the
 * remaining passes still run.
 */
@Service
public class DetailEnricherService {
    private static final Logger log = LoggerFactory.getLogger(DetailEnricherService.class);

    static final String MISSING_DETAIL_URL = "missing_detail_url";
    static final String NAVIGATION_FAILED = "navigation_failed";
    static final String INTERRUPTED = "interrupted";

    private final FieldExtractor fieldExtractor;
    private final Sleeper sleeper;
    private final Clock clock;

    public DetailEnricherService(FieldExtractor fieldExtractor, Sleeper sleeper, Clock clock) {
        this.fieldExtractor = fieldExtractor;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public EnrichmentOutcome enrich(BrowserSession session, ListingReference reference, ScrapeConfig config, PacingScheduler pacing) {
        String url = ListingUrlUtils.stripTracking(reference.detailUrl());
        if (url == null) {
            log.warn("Listing '{}' has no detail URL", reference.title());
            return EnrichmentOutcome.failure(reference, MISSING_DETAIL_URL);
        }

        pacing.awaitTurn();
        if (Thread.currentThread().isInterrupted()) {
            return EnrichmentOutcome.failure(reference, INTERRUPTED);
        }
        if (!load(session, url, config)) {
            return EnrichmentOutcome.failure(reference, NAVIGATION_FAILED);
        }
        try {
            sleeper.sleep(Duration.ofMillis(config.settleMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EnrichmentOutcome.failure(reference, INTERRUPTED);
        }

        PropertyRecord record = new PropertyRecord(clock.instant());
        record.setListingId(ListingUrlUtils.listingId(url));
        record.setTitle(reference.title());
        record.setUrl(url);

        ExtractionScope page = ExtractionScope.page(session);
        for (Pass pass : passes(config)) {
            try {
                pass.action().accept(page, record);
            } catch (RuntimeException e) {
                log.warn("{} extraction failed for {}: {}", pass.name(), url, e.getMessage());
            }
        }
        return EnrichmentOutcome.success(reference, record);
    }

    private List<Pass> passes(ScrapeConfig config) {
        List<Pass> passes = new ArrayList<>();
        passes.add(new Pass("financial", fieldExtractor::extractFinancial));
        passes.add(new Pass("physical", fieldExtractor::extractPhysical));
        passes.add(new Pass("location", (page, record) ->
            fieldExtractor.extractLocation(page, record, config.extractCoordinates())));
        passes.add(new Pass("building", fieldExtractor::extractBuilding));
        passes.add(new Pass("amenities", fieldExtractor::extractAmenities));
        if (config.saveImages()) {
            passes.add(new Pass("media", fieldExtractor::extractMedia));
        }
        passes.add(new Pass("metadata", fieldExtractor::extractMetadata));
        return passes;
    }

    private boolean load(BrowserSession session, String url, ScrapeConfig config) {
        int attempts = Math.max(1, config.maxRetriesPerListing());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            WaitPolicy policy = attempt == 1 ? WaitPolicy.DOM_CONTENT_LOADED : WaitPolicy.FULL_LOAD;
            int timeout = attempt == 1 ? config.detailTimeoutMs() : config.relaxedNavigationTimeoutMs();
            try {
                session.navigate(url, policy, timeout);
                return true;
            } catch (NavigationException e) {
                log.warn("Detail page {} attempt {}/{} failed ({})", url, attempt, attempts, e.kind());
            }
        }
        return false;
    }

    private record Pass(String name, BiConsumer<ExtractionScope, PropertyRecord> action) {
    }
}
