package com.delta.propertytracker.crawl.browser;

import com.delta.propertytracker.config.ScraperProperties;
import io.github.bonigarcia.wdm.WebDriverManager;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URL;

public class SeleniumBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSessionFactory.class);

    private final ScraperProperties.Browser settings;
    private boolean driverPrepared;

    public SeleniumBrowserSessionFactory(ScraperProperties.Browser settings) {
        this.settings = settings;
    }

    @Override
    public synchronized BrowserSession open() {
        String userAgent = UserAgentRotation.pick(settings.getUserAgents());
        ChromeOptions options = chromeOptions(userAgent);
        WebDriver driver;
        String remoteUrl = settings.getRemoteUrl();
        if (!remoteUrl.isBlank()) {
            log.info("Opening remote browser session at {}", remoteUrl);
            try {
                driver = new RemoteWebDriver(new URL(remoteUrl), options);
            } catch (MalformedURLException e) {
                throw new IllegalStateException("Invalid remote browser url " + remoteUrl, e);
            }
        } else {
            if (!driverPrepared) {
                WebDriverManager.chromedriver().setup();
                driverPrepared = true;
            }
            log.info("Opening local browser session (headless={})", settings.isHeadless());
            driver = new ChromeDriver(options);
        }
        return sized(driver);
    }

    BrowserSession sized(WebDriver driver) {
        try {
            driver.manage().window().setSize(new Dimension(settings.getWindowWidth(), settings.getWindowHeight()));
        } catch (RuntimeException e) {
            driver.quit();
            throw e;
        }
        return new SeleniumBrowserSession(driver);
    }

    ChromeOptions chromeOptions(String userAgent) {
        ChromeOptions options = new ChromeOptions();
        if (settings.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--disable-notifications",
            "--lang=es-CL",
            "--user-agent=" + userAgent
        );
        options.setPageLoadStrategy(PageLoadStrategy.EAGER);
        return options;
    }
}
