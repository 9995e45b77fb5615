package com.delta.propertytracker.crawl.service;

import com.delta.propertytracker.config.ScrapeConfig;
import com.delta.propertytracker.config.ScraperProperties;
import com.delta.propertytracker.crawl.browser.BrowserSession;
import com.delta.propertytracker.crawl.browser.BrowserSessionFactory;
import com.delta.propertytracker.crawl.detail.DetailEnricherService;
import com.delta.propertytracker.crawl.detail.EnrichmentOutcome;
import com.delta.propertytracker.crawl.discovery.DiscoveryResult;
import com.delta.propertytracker.crawl.discovery.DiscoveryStopReason;
import com.delta.propertytracker.crawl.discovery.ListingDiscoveryService;
import com.delta.propertytracker.crawl.model.CrawlRunMode;
import com.delta.propertytracker.crawl.model.CrawlRunRequest;
import com.delta.propertytracker.crawl.model.CrawlRunSummary;
import com.delta.propertytracker.crawl.model.ListingReference;
import com.delta.propertytracker.crawl.model.PropertyRecord;
import com.delta.propertytracker.crawl.pacing.PacingScheduler;
import com.delta.propertytracker.crawl.pacing.Sleeper;
import com.delta.propertytracker.crawl.persistence.BatchFileExporter;
import com.delta.propertytracker.crawl.persistence.PropertyPersistenceGateway;
import com.delta.propertytracker.crawl.validation.PropertyRecordCleaner;
import com.delta.propertytracker.crawl.validation.PropertyRecordScorer;
import com.delta.propertytracker.crawl.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one crawl end to end: result pages, then detail pages one by one, then cleaning,
 * scoring, persistence and JSON export. Partial results are kept whatever ends the run.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    static final String REFERENCES_FILE = "portal_inmobiliario_listings.json";
    static final String DETAILED_PREFIX = "detailed_properties";
    private static final int PROGRESS_EVERY = 10;

    private final ScraperProperties properties;
    private final BrowserSessionFactory sessionFactory;
    private final ListingDiscoveryService discoveryService;
    private final DetailEnricherService detailEnricher;
    private final PropertyRecordCleaner cleaner;
    private final PropertyRecordScorer scorer;
    private final Optional<PropertyPersistenceGateway> gateway;
    private final BatchFileExporter exporter;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CrawlOrchestratorService(
        ScraperProperties properties,
        BrowserSessionFactory sessionFactory,
        ListingDiscoveryService discoveryService,
        DetailEnricherService detailEnricher,
        PropertyRecordCleaner cleaner,
        PropertyRecordScorer scorer,
        Optional<PropertyPersistenceGateway> gateway,
        BatchFileExporter exporter,
        Clock clock,
        Sleeper sleeper
    ) {
        this.properties = properties;
        this.sessionFactory = sessionFactory;
        this.discoveryService = discoveryService;
        this.detailEnricher = detailEnricher;
        this.cleaner = cleaner;
        this.scorer = scorer;
        this.gateway = gateway;
        this.exporter = exporter;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public CrawlRunResult run(CrawlRunRequest request) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveCrawlRunException("A crawl run is already in progress");
        }
        try {
            return execute(request == null ? CrawlRunRequest.of(CrawlRunMode.DETAILED) : request);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private CrawlRunResult execute(CrawlRunRequest request) {
        Instant startedAt = clock.instant();
        CrawlRunMode mode = request.mode() == null ? CrawlRunMode.DETAILED : request.mode();
        ScrapeConfig config = properties.toScrapeConfig().withSessionCaps(request.maxPages(), request.maxListings());
        PacingScheduler pacing = new PacingScheduler(config, clock, sleeper);
        log.info(
            "Starting {} crawl of {} (maxPages={}, maxListings={})",
            mode,
            config.searchUrl(),
            config.maxPagesPerSession(),
            config.maxListingsPerSession()
        );

        RunState state = new RunState(startedAt, mode);
        try {
            try (BrowserSession session = sessionFactory.open()) {
                state.discovery = discoveryService.discover(session, config, pacing);
            }
            state.references = state.discovery.references();
            log.info(
                "Discovery finished: {} listings over {} pages ({})",
                state.references.size(),
                state.discovery.pagesVisited(),
                state.discovery.stopReason()
            );

            if (mode == CrawlRunMode.BASIC) {
                addExport(state, exporter.writeReferences(config.outputDir(), REFERENCES_FILE, state.references));
            } else if (!state.references.isEmpty() && !Thread.currentThread().isInterrupted()) {
                List<ListingReference> targets = state.references;
                if (targets.size() > config.maxListingsPerSession()) {
                    targets = targets.subList(0, config.maxListingsPerSession());
                    log.info("Limited to {} listings for this session", targets.size());
                }
                enrichAll(targets, config, pacing, state);
                addExport(state, exporter.writeComplete(config.outputDir(), DETAILED_PREFIX, state.records));
            }
            state.status = resolveStatus(state);
        } catch (RuntimeException e) {
            log.error("Crawl run failed", e);
            state.status = "FAILED";
        }

        CrawlRunSummary summary = state.summary(clock.instant());
        log.info(
            "Crawl {} finished: status={} attempted={} succeeded={} failed={} persisted={} avgScore={}",
            mode,
            summary.status(),
            summary.attempted(),
            summary.succeeded(),
            summary.failed(),
            summary.persisted(),
            summary.averageScore()
        );
        return new CrawlRunResult(summary, List.copyOf(state.references), List.copyOf(state.records));
    }

    private void enrichAll(List<ListingReference> targets, ScrapeConfig config, PacingScheduler pacing, RunState state) {
        FailureRateGuard guard = state.guard = new FailureRateGuard(config.maxFailureRate());
        int flushedUpTo = 0;
        log.info("Extracting details from {} listings", targets.size());
        try {
            try (BrowserSession session = sessionFactory.open()) {
                for (int i = 0; i < targets.size(); i++) {
                    if (Thread.currentThread().isInterrupted()) {
                        state.aborted = true;
                        break;
                    }
                    ListingReference reference = targets.get(i);
                    EnrichmentOutcome outcome;
                    try {
                        outcome = detailEnricher.enrich(session, reference, config, pacing);
                    } catch (RuntimeException e) {
                        log.warn("Listing {} failed unexpectedly", reference.detailUrl(), e);
                        outcome = EnrichmentOutcome.failure(reference, "unexpected_error");
                    }
                    if (Thread.currentThread().isInterrupted()) {
                        state.aborted = true;
                        break;
                    }

                    if (!outcome.succeeded()) {
                        guard.recordFailure();
                        log.warn("Listing {}/{} failed: {}", i + 1, targets.size(), outcome.failureReason());
                        if (guard.tripped()) {
                            state.breakerTripped = true;
                            log.warn(
                                "Failure rate {} over {} attempts exceeds {}, stopping detail extraction",
                                String.format("%.2f", guard.failureRate()),
                                guard.attempts(),
                                config.maxFailureRate()
                            );
                            break;
                        }
                        continue;
                    }

                    guard.recordSuccess();
                    PropertyRecord record = outcome.record();
                    if (config.validateData()) {
                        record = cleaner.clean(record);
                        for (String flag : cleaner.rangeFlags(record)) {
                            state.rangeFlags.add(listingLabel(record) + ": " + flag);
                        }
                        ValidationResult validation = scorer.score(record);
                        state.scores.add(validation.score());
                        if (validation.valid()) {
                            state.validRecords++;
                        } else {
                            log.warn(
                                "Listing {} has low data quality ({}%): {}",
                                record.getListingId(),
                                String.format("%.1f", validation.completenessPercentage()),
                                validation.issues()
                            );
                        }
                    }
                    state.records.add(record);
                    persist(record, config, state);

                    if (state.records.size() % config.batchSaveSize() == 0) {
                        addExport(state, exporter.writeBatch(
                            config.outputDir(),
                            DETAILED_PREFIX,
                            state.records.subList(flushedUpTo, state.records.size())
                        ));
                        flushedUpTo = state.records.size();
                    }
                    if ((i + 1) % PROGRESS_EVERY == 0) {
                        log.info(
                            "Progress: {}/{} ({}% success rate)",
                            i + 1,
                            targets.size(),
                            String.format("%.1f", (1.0 - guard.failureRate()) * 100.0)
                        );
                    }
                }
            }
        } finally {
            if (state.records.size() > flushedUpTo) {
                addExport(state, exporter.writeBatch(
                    config.outputDir(),
                    DETAILED_PREFIX,
                    state.records.subList(flushedUpTo, state.records.size())
                ));
            }
        }
    }

    private void persist(PropertyRecord record, ScrapeConfig config, RunState state) {
        if (!config.usePersistentStore() || gateway.isEmpty()) {
            return;
        }
        try {
            gateway.get().upsert(record);
            state.persisted++;
        } catch (DataAccessException e) {
            log.warn("Failed to persist listing {}", record.getListingId(), e);
        }
    }

    private String resolveStatus(RunState state) {
        if (state.aborted || Thread.currentThread().isInterrupted()
            || state.discovery.stopReason() == DiscoveryStopReason.INTERRUPTED) {
            return "ABORTED";
        }
        if (state.breakerTripped) {
            return "HALTED_HIGH_FAILURE_RATE";
        }
        if (state.references.isEmpty()) {
            return state.discovery.blocked() ? "BLOCKED" : "NO_LISTINGS";
        }
        boolean discoveryTroubled = state.discovery.stopReason() == DiscoveryStopReason.BLOCKED
            || state.discovery.stopReason() == DiscoveryStopReason.NAVIGATION_FAILED
            || state.discovery.stopReason() == DiscoveryStopReason.ERROR;
        boolean enrichmentFailures = state.guard != null && state.guard.failures() > 0;
        return discoveryTroubled || enrichmentFailures ? "COMPLETED_WITH_ERRORS" : "COMPLETED";
    }

    private static String listingLabel(PropertyRecord record) {
        return record.hasListingId() ? record.getListingId() : record.getUrl();
    }

    private void addExport(RunState state, Path file) {
        if (file != null) {
            state.exportedFiles.add(file.toString());
        }
    }

    private static final class RunState {
        private final Instant startedAt;
        private final CrawlRunMode mode;
        private DiscoveryResult discovery;
        private List<ListingReference> references = List.of();
        private final List<PropertyRecord> records = new ArrayList<>();
        private final List<Integer> scores = new ArrayList<>();
        private final List<String> rangeFlags = new ArrayList<>();
        private final List<String> exportedFiles = new ArrayList<>();
        private FailureRateGuard guard;
        private int validRecords;
        private int persisted;
        private boolean breakerTripped;
        private boolean aborted;
        private String status = "FAILED";

        private RunState(Instant startedAt, CrawlRunMode mode) {
            this.startedAt = startedAt;
            this.mode = mode;
        }

        private CrawlRunSummary summary(Instant finishedAt) {
            Double averageScore = scores.isEmpty()
                ? null
                : scores.stream().mapToInt(Integer::intValue).average().orElse(0.0);
            return new CrawlRunSummary(
                startedAt,
                finishedAt,
                status,
                mode,
                discovery == null ? 0 : discovery.pagesVisited(),
                discovery == null ? null : discovery.stopReason().name(),
                references.size(),
                guard == null ? 0 : guard.attempts(),
                guard == null ? 0 : guard.successes(),
                guard == null ? 0 : guard.failures(),
                persisted,
                breakerTripped,
                scores.isEmpty() ? null : validRecords,
                averageScore,
                List.copyOf(rangeFlags),
                List.copyOf(exportedFiles)
            );
        }
    }
}
