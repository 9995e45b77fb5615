package com.delta.propertytracker.config;

import com.delta.propertytracker.crawl.browser.BrowserSessionFactory;
import com.delta.propertytracker.crawl.browser.JsoupBrowserSession;
import com.delta.propertytracker.crawl.browser.SeleniumBrowserSessionFactory;
import com.delta.propertytracker.crawl.browser.UserAgentRotation;
import com.delta.propertytracker.crawl.pacing.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

@Configuration
public class CrawlConfig {
    private static final Logger log = LoggerFactory.getLogger(CrawlConfig.class);

    @Bean
    public BrowserSessionFactory browserSessionFactory(ScraperProperties properties) {
        ScraperProperties.Browser browser = properties.getBrowser();
        String engine = browser.getEngine().toLowerCase(Locale.ROOT);
        switch (engine) {
            case "selenium":
                return new SeleniumBrowserSessionFactory(browser);
            case "jsoup":
                log.info("Using the static Jsoup engine; pages that need scripts will render without listings");
                return () -> new JsoupBrowserSession(JsoupBrowserSession.connectLoader(UserAgentRotation.pick(browser.getUserAgents())));
            default:
                throw new IllegalStateException("Unsupported scraper.browser.engine: " + browser.getEngine());
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
