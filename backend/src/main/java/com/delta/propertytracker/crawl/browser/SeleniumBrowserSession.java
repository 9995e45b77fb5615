package com.delta.propertytracker.crawl.browser;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class SeleniumBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSession.class);

    private final WebDriver driver;
    private boolean closed;

    public SeleniumBrowserSession(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void navigate(String url, WaitPolicy waitPolicy, int timeoutMs) {
        Duration timeout = Duration.ofMillis(Math.max(1, timeoutMs));
        try {
            driver.manage().timeouts().pageLoadTimeout(timeout);
            driver.get(url);
            new WebDriverWait(driver, timeout).until(d -> isReady(d, waitPolicy));
        } catch (TimeoutException e) {
            throw new NavigationException(NavigationException.Kind.TIMEOUT, url, "Timed out loading " + url, e);
        } catch (WebDriverException e) {
            throw new NavigationException(NavigationException.Kind.ERROR, url, "Failed to load " + url, e);
        }
    }

    @Override
    public List<ElementHandle> queryAll(String selector) {
        return find(driver, selector);
    }

    @Override
    public List<ElementHandle> queryAll(ElementHandle scope, String selector) {
        if (scope == null) {
            return find(driver, selector);
        }
        return find(unwrap(scope), selector);
    }

    @Override
    public String text(ElementHandle element) {
        try {
            return unwrap(element).getText();
        } catch (WebDriverException e) {
            log.debug("Unable to read element text: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public String attr(ElementHandle element, String name) {
        try {
            return unwrap(element).getAttribute(name);
        } catch (WebDriverException e) {
            log.debug("Unable to read attribute {}: {}", name, e.getMessage());
            return null;
        }
    }

    @Override
    public String pageContent() {
        try {
            String source = driver.getPageSource();
            return source == null ? "" : source;
        } catch (WebDriverException e) {
            log.debug("Unable to read page source: {}", e.getMessage());
            return "";
        }
    }

    @Override
    public String currentUrl() {
        try {
            return driver.getCurrentUrl();
        } catch (WebDriverException e) {
            return null;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to quit browser cleanly", e);
        }
    }

    private boolean isReady(WebDriver webDriver, WaitPolicy waitPolicy) {
        Object state = ((JavascriptExecutor) webDriver).executeScript("return document.readyState");
        if (waitPolicy == WaitPolicy.FULL_LOAD) {
            return "complete".equals(state);
        }
        return "interactive".equals(state) || "complete".equals(state);
    }

    private List<ElementHandle> find(SearchContext context, String selector) {
        try {
            List<ElementHandle> handles = new ArrayList<>();
            for (WebElement element : context.findElements(By.cssSelector(selector))) {
                handles.add(new SeleniumElement(element));
            }
            return handles;
        } catch (WebDriverException e) {
            log.debug("Selector {} failed: {}", selector, e.getMessage());
            return List.of();
        }
    }

    private WebElement unwrap(ElementHandle handle) {
        if (handle instanceof SeleniumElement seleniumElement) {
            return seleniumElement.element();
        }
        throw new IllegalArgumentException("Element does not belong to a Selenium session");
    }

    private record SeleniumElement(WebElement element) implements ElementHandle {
    }
}
