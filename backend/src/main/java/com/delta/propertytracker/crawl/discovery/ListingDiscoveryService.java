package com.delta.propertytracker.crawl.discovery;

import com.delta.propertytracker.config.ScrapeConfig;
import com.delta.propertytracker.crawl.browser.BrowserSession;
import com.delta.propertytracker.crawl.browser.ElementHandle;
import com.delta.propertytracker.crawl.browser.NavigationException;
import com.delta.propertytracker.crawl.browser.WaitPolicy;
import com.delta.propertytracker.crawl.extract.FieldExtractor;
import com.delta.propertytracker.crawl.model.ListingReference;
import com.delta.propertytracker.crawl.pacing.PacingScheduler;
import com.delta.propertytracker.crawl.pacing.Sleeper;
import com.delta.propertytracker.crawl.util.ListingUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks the search result pages and collects a {@link ListingReference} per result card.
 * Never throws: every failure ends the walk with a {@link DiscoveryStopReason} and the
 * references gathered so far.
 */
@Service
public class ListingDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(ListingDiscoveryService.class);

    static final List<String> CARD_SELECTORS = List.of(
        ".ui-search-layout__item",
        ".ui-search-result",
        ".ui-search-results__item",
        ".ui-search-item",
        "[data-testid*=\"result\"]",
        "div[class*=\"MLC\"]",
        "[class*=\"result\"]",
        "[class*=\"listing\"]",
        "[class*=\"card\"]",
        "a[href*=\"MLC\"]",
        "[class*=\"item\"]",
        "article"
    );

    private static final List<String> NEXT_PAGE_SELECTORS = List.of(
        ".andes-pagination__button--next",
        "a[title=\"Siguiente\"]",
        "[aria-label=\"Siguiente\"]"
    );

    private static final Pattern BLOCKING_KEYWORDS = Pattern.compile(
        "\\b(captcha|blocked|challenge|robot|automation|bot|access denied|unusual traffic)\\b",
        Pattern.CASE_INSENSITIVE
    );

    private final FieldExtractor fieldExtractor;
    private final DiagnosticsWriter diagnosticsWriter;
    private final Sleeper sleeper;

    public ListingDiscoveryService(FieldExtractor fieldExtractor, DiagnosticsWriter diagnosticsWriter, Sleeper sleeper) {
        this.fieldExtractor = fieldExtractor;
        this.diagnosticsWriter = diagnosticsWriter;
        this.sleeper = sleeper;
    }

    public DiscoveryResult discover(BrowserSession session, ScrapeConfig config, PacingScheduler pacing) {
        List<ListingReference> references = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        int pagesVisited = 0;
        int pageIndex = 1;
        try {
            while (true) {
                pacing.awaitTurn();
                if (Thread.currentThread().isInterrupted()) {
                    return new DiscoveryResult(references, pagesVisited, DiscoveryStopReason.INTERRUPTED, null, null);
                }

                String url = ListingUrlUtils.pageUrl(config.searchUrl(), pageIndex, config.pageSize());
                log.info("Loading result page {}: {}", pageIndex, url);
                if (!load(session, url, config)) {
                    return new DiscoveryResult(references, pagesVisited, DiscoveryStopReason.NAVIGATION_FAILED, null, null);
                }
                pagesVisited++;
                sleeper.sleep(Duration.ofMillis(config.settleMillis()));

                CardSelection cards = selectCards(session, config.cardThreshold());
                if (cards == null) {
                    return unreadablePage(session, config, references, pagesVisited, pageIndex);
                }

                int added = 0;
                int index = 0;
                for (ElementHandle card : cards.elements()) {
                    index++;
                    ListingReference reference;
                    try {
                        reference = fieldExtractor.extractCard(session, card, cards.selector(), pageIndex).orElse(null);
                    } catch (RuntimeException e) {
                        log.debug("Card {} on page {} could not be read: {}", index, pageIndex, e.getMessage());
                        continue;
                    }
                    if (reference == null) {
                        continue;
                    }
                    String key = ListingUrlUtils.stripTracking(reference.detailUrl());
                    if (key != null && !seenUrls.add(key)) {
                        continue;
                    }
                    references.add(reference);
                    added++;
                }
                log.info("Page {}: {} listings via {} ({} cards)", pageIndex, added, cards.selector(), cards.elements().size());

                if (pageIndex >= config.maxPagesPerSession()) {
                    return new DiscoveryResult(references, pagesVisited, DiscoveryStopReason.PAGE_CAP, null, null);
                }
                if (!hasEnabledNextPage(session)) {
                    log.info("No next page after page {}", pageIndex);
                    return new DiscoveryResult(references, pagesVisited, DiscoveryStopReason.LAST_PAGE, null, null);
                }

                pageIndex++;
                sleeper.sleep(Duration.ofMillis(jitterMillis(config)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new DiscoveryResult(references, pagesVisited, DiscoveryStopReason.INTERRUPTED, null, null);
        } catch (RuntimeException e) {
            log.warn("Listing discovery stopped on page {}", pageIndex, e);
            return new DiscoveryResult(references, pagesVisited, DiscoveryStopReason.ERROR, null, null);
        }
    }

    /** First card selector matching more than {@code threshold} elements, or {@code null}. */
    CardSelection selectCards(BrowserSession session, int threshold) {
        for (String selector : CARD_SELECTORS) {
            List<ElementHandle> elements = session.queryAll(selector);
            if (elements.size() > threshold) {
                return new CardSelection(selector, elements);
            }
        }
        return null;
    }

    boolean hasEnabledNextPage(BrowserSession session) {
        for (String selector : NEXT_PAGE_SELECTORS) {
            for (ElementHandle control : session.queryAll(selector)) {
                if (isEnabled(session, control)) {
                    return true;
                }
            }
        }
        return false;
    }

    static String findBlockingKeyword(String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        Matcher matcher = BLOCKING_KEYWORDS.matcher(content);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }

    private DiscoveryResult unreadablePage(
        BrowserSession session,
        ScrapeConfig config,
        List<ListingReference> references,
        int pagesVisited,
        int pageIndex
    ) {
        String content = session.pageContent();
        String keyword = findBlockingKeyword(content);
        Path dump = diagnosticsWriter.writePage(config.diagnosticsDir(), keyword == null ? "no_listings" : "blocked", pageIndex, content);
        if (keyword != null) {
            log.warn("Page {} looks like a blocking page (keyword '{}')", pageIndex, keyword);
            return new DiscoveryResult(references, pagesVisited, DiscoveryStopReason.BLOCKED, keyword, dump);
        }
        log.warn("No listing cards found on page {}", pageIndex);
        return new DiscoveryResult(references, pagesVisited, DiscoveryStopReason.NO_LISTINGS, null, dump);
    }

    private boolean load(BrowserSession session, String url, ScrapeConfig config) {
        try {
            session.navigate(url, WaitPolicy.DOM_CONTENT_LOADED, config.navigationTimeoutMs());
            return true;
        } catch (NavigationException e) {
            log.warn("Navigation to {} failed ({}), retrying with full load", url, e.kind());
        }
        try {
            session.navigate(url, WaitPolicy.FULL_LOAD, config.relaxedNavigationTimeoutMs());
            return true;
        } catch (NavigationException e) {
            log.warn("Second navigation to {} failed ({}): {}", url, e.kind(), e.getMessage());
            return false;
        }
    }

    private boolean isEnabled(BrowserSession session, ElementHandle control) {
        if (session.attr(control, "disabled") != null) {
            return false;
        }
        String ariaDisabled = session.attr(control, "aria-disabled");
        if (ariaDisabled != null && "true".equalsIgnoreCase(ariaDisabled.trim())) {
            return false;
        }
        String classes = session.attr(control, "class");
        return classes == null || !classes.toLowerCase(Locale.ROOT).contains("disabled");
    }

    private long jitterMillis(ScrapeConfig config) {
        int min = config.pageJitterMinMs();
        int max = config.pageJitterMaxMs();
        if (max <= min) {
            return min;
        }
        return ThreadLocalRandom.current().nextLong(min, max + 1L);
    }

    record CardSelection(String selector, List<ElementHandle> elements) {
    }
}
