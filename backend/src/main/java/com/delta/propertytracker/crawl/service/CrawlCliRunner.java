package com.delta.propertytracker.crawl.service;

import com.delta.propertytracker.config.ScraperProperties;
import com.delta.propertytracker.crawl.model.CrawlRunMode;
import com.delta.propertytracker.crawl.model.CrawlRunRequest;
import com.delta.propertytracker.crawl.model.CrawlRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final ScraperProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        ScraperProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CrawlRunMode mode = CrawlRunMode.parse(properties.getCli().getMode(), CrawlRunMode.DETAILED);
        CrawlRunSummary summary = crawlOrchestratorService.run(CrawlRunRequest.of(mode)).summary();
        log.info(
            "Crawl run completed with status {}: pages={}, stop={}, discovered={}, attempted={}, succeeded={}, failed={}",
            summary.status(),
            summary.pagesVisited(),
            summary.discoveryStopReason(),
            summary.discovered(),
            summary.attempted(),
            summary.succeeded(),
            summary.failed()
        );
        if (summary.averageScore() != null) {
            log.info(
                "Quality: {} valid records, average score {}/20",
                summary.validRecords(),
                String.format("%.1f", summary.averageScore())
            );
        }
        for (String flag : summary.rangeFlags()) {
            log.warn("Out-of-range value: {}", flag);
        }
        for (String file : summary.exportedFiles()) {
            log.info("Exported {}", file);
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
