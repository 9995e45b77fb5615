package com.delta.propertytracker.crawl.api;

import com.delta.propertytracker.config.ScraperProperties;
import com.delta.propertytracker.crawl.model.CrawlRunMode;
import com.delta.propertytracker.crawl.model.CrawlRunRequest;
import com.delta.propertytracker.crawl.model.CrawlRunSummary;
import com.delta.propertytracker.crawl.persistence.PropertyPersistenceGateway;
import com.delta.propertytracker.crawl.persistence.PropertyStats;
import com.delta.propertytracker.crawl.service.CrawlOrchestratorService;
import com.delta.propertytracker.crawl.service.PropertyQualityService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final PropertyPersistenceGateway persistenceGateway;
    private final PropertyQualityService qualityService;
    private final ScraperProperties scraperProperties;

    public CrawlController(
        CrawlOrchestratorService crawlOrchestratorService,
        PropertyPersistenceGateway persistenceGateway,
        PropertyQualityService qualityService,
        ScraperProperties scraperProperties
    ) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.persistenceGateway = persistenceGateway;
        this.qualityService = qualityService;
        this.scraperProperties = scraperProperties;
    }

    @PostMapping("/crawl/run")
    public CrawlRunSummary runCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        CrawlRunMode fallback = CrawlRunMode.parse(scraperProperties.getCli().getMode(), CrawlRunMode.DETAILED);
        CrawlRunMode mode;
        try {
            mode = request == null ? fallback : CrawlRunMode.parse(request.mode(), fallback);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        }
        Integer maxPages = request == null ? null : positiveOrNull(request.maxPages(), "maxPages");
        Integer maxListings = request == null ? null : positiveOrNull(request.maxListings(), "maxListings");
        return crawlOrchestratorService.run(new CrawlRunRequest(mode, maxPages, maxListings)).summary();
    }

    @GetMapping("/properties/stats")
    public PropertyStats stats(
        @RequestParam(name = "recentHours", required = false, defaultValue = "24") int recentHours
    ) {
        if (recentHours <= 0) {
            throw new ResponseStatusException(BAD_REQUEST, "recentHours must be positive");
        }
        return persistenceGateway.aggregateStats(Duration.ofHours(recentHours));
    }

    @GetMapping("/properties/quality")
    public PropertyQualityService.QualityReport quality(
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        if (limit <= 0) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be positive");
        }
        return qualityService.report(limit);
    }

    private Integer positiveOrNull(Integer value, String name) {
        if (value == null) {
            return null;
        }
        if (value <= 0) {
            throw new ResponseStatusException(BAD_REQUEST, name + " must be positive");
        }
        return value;
    }
}
