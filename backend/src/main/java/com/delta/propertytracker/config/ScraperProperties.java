package com.delta.propertytracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_SEARCH_URL =
        "https://www.portalinmobiliario.com/venta/departamento/san-carlos-de-apoquindo-las-condes-santiago-metropolitana";

    private String searchUrl = DEFAULT_SEARCH_URL;
    private int pageSize = 48;
    private int cardThreshold = 5;

    private double minDelaySeconds = 3.0;
    private double maxDelaySeconds = 8.0;
    private int maxRequestsPerMinute = 10;

    private boolean avoidPeakHours = true;
    private int peakStartHour = 9;
    private int peakEndHour = 18;
    private int peakCooldownSeconds = 60;

    private int maxListingsPerSession = 100;
    private int maxPagesPerSession = 10;
    private int maxRetriesPerListing = 3;

    private boolean saveImages = false;
    private boolean extractCoordinates = true;
    private boolean validateData = true;
    private boolean usePersistentStore = true;

    private int batchSaveSize = 50;
    private double maxFailureRate = 0.30;

    private int pageJitterMinMs = 2000;
    private int pageJitterMaxMs = 5000;
    private int navigationTimeoutMs = 60000;
    private int relaxedNavigationTimeoutMs = 30000;
    private int detailTimeoutMs = 30000;
    private int settleMillis = 2000;

    private String storePath = "./data/properties";
    private String outputDir = "./output";
    private String diagnosticsDir = "./diagnostics";

    private Browser browser = new Browser();
    private Cli cli = new Cli();

    public ScrapeConfig toScrapeConfig() {
        return new ScrapeConfig(
            getSearchUrl(),
            getPageSize(),
            getCardThreshold(),
            getMinDelaySeconds(),
            getMaxDelaySeconds(),
            getMaxRequestsPerMinute(),
            isAvoidPeakHours(),
            getPeakStartHour(),
            getPeakEndHour(),
            getPeakCooldownSeconds(),
            getMaxListingsPerSession(),
            getMaxPagesPerSession(),
            getMaxRetriesPerListing(),
            isSaveImages(),
            isExtractCoordinates(),
            isValidateData(),
            isUsePersistentStore(),
            getBatchSaveSize(),
            getMaxFailureRate(),
            getPageJitterMinMs(),
            getPageJitterMaxMs(),
            getNavigationTimeoutMs(),
            getRelaxedNavigationTimeoutMs(),
            getDetailTimeoutMs(),
            getSettleMillis(),
            getOutputDir(),
            getDiagnosticsDir()
        );
    }

    public String getSearchUrl() {
        if (searchUrl == null || searchUrl.isBlank()) {
            return DEFAULT_SEARCH_URL;
        }
        return searchUrl.trim();
    }

    public void setSearchUrl(String searchUrl) {
        this.searchUrl = searchUrl;
    }

    public int getPageSize() {
        return Math.max(1, pageSize);
    }

    public void setPageSize(int pageSize) {
        this.pageSize = Math.max(1, pageSize);
    }

    public int getCardThreshold() {
        return Math.max(0, cardThreshold);
    }

    public void setCardThreshold(int cardThreshold) {
        this.cardThreshold = Math.max(0, cardThreshold);
    }

    public double getMinDelaySeconds() {
        return Math.max(0.0, minDelaySeconds);
    }

    public void setMinDelaySeconds(double minDelaySeconds) {
        this.minDelaySeconds = Math.max(0.0, minDelaySeconds);
    }

    public double getMaxDelaySeconds() {
        return Math.max(getMinDelaySeconds(), maxDelaySeconds);
    }

    public void setMaxDelaySeconds(double maxDelaySeconds) {
        this.maxDelaySeconds = Math.max(0.0, maxDelaySeconds);
    }

    public int getMaxRequestsPerMinute() {
        return Math.max(1, maxRequestsPerMinute);
    }

    public void setMaxRequestsPerMinute(int maxRequestsPerMinute) {
        this.maxRequestsPerMinute = Math.max(1, maxRequestsPerMinute);
    }

    public boolean isAvoidPeakHours() {
        return avoidPeakHours;
    }

    public void setAvoidPeakHours(boolean avoidPeakHours) {
        this.avoidPeakHours = avoidPeakHours;
    }

    public int getPeakStartHour() {
        return clampHour(peakStartHour);
    }

    public void setPeakStartHour(int peakStartHour) {
        this.peakStartHour = clampHour(peakStartHour);
    }

    public int getPeakEndHour() {
        return clampHour(peakEndHour);
    }

    public void setPeakEndHour(int peakEndHour) {
        this.peakEndHour = clampHour(peakEndHour);
    }

    public int getPeakCooldownSeconds() {
        return Math.max(0, peakCooldownSeconds);
    }

    public void setPeakCooldownSeconds(int peakCooldownSeconds) {
        this.peakCooldownSeconds = Math.max(0, peakCooldownSeconds);
    }

    public int getMaxListingsPerSession() {
        return Math.max(1, maxListingsPerSession);
    }

    public void setMaxListingsPerSession(int maxListingsPerSession) {
        this.maxListingsPerSession = Math.max(1, maxListingsPerSession);
    }

    public int getMaxPagesPerSession() {
        return Math.max(1, maxPagesPerSession);
    }

    public void setMaxPagesPerSession(int maxPagesPerSession) {
        this.maxPagesPerSession = Math.max(1, maxPagesPerSession);
    }

    public int getMaxRetriesPerListing() {
        return Math.max(1, maxRetriesPerListing);
    }

    public void setMaxRetriesPerListing(int maxRetriesPerListing) {
        this.maxRetriesPerListing = Math.max(1, maxRetriesPerListing);
    }

    public boolean isSaveImages() {
        return saveImages;
    }

    public void setSaveImages(boolean saveImages) {
        this.saveImages = saveImages;
    }

    public boolean isExtractCoordinates() {
        return extractCoordinates;
    }

    public void setExtractCoordinates(boolean extractCoordinates) {
        this.extractCoordinates = extractCoordinates;
    }

    public boolean isValidateData() {
        return validateData;
    }

    public void setValidateData(boolean validateData) {
        this.validateData = validateData;
    }

    public boolean isUsePersistentStore() {
        return usePersistentStore;
    }

    public void setUsePersistentStore(boolean usePersistentStore) {
        this.usePersistentStore = usePersistentStore;
    }

    public int getBatchSaveSize() {
        return Math.max(1, batchSaveSize);
    }

    public void setBatchSaveSize(int batchSaveSize) {
        this.batchSaveSize = Math.max(1, batchSaveSize);
    }

    public double getMaxFailureRate() {
        return Math.min(1.0, Math.max(0.0, maxFailureRate));
    }

    public void setMaxFailureRate(double maxFailureRate) {
        this.maxFailureRate = Math.min(1.0, Math.max(0.0, maxFailureRate));
    }

    public int getPageJitterMinMs() {
        return Math.max(0, pageJitterMinMs);
    }

    public void setPageJitterMinMs(int pageJitterMinMs) {
        this.pageJitterMinMs = Math.max(0, pageJitterMinMs);
    }

    public int getPageJitterMaxMs() {
        return Math.max(getPageJitterMinMs(), pageJitterMaxMs);
    }

    public void setPageJitterMaxMs(int pageJitterMaxMs) {
        this.pageJitterMaxMs = Math.max(0, pageJitterMaxMs);
    }

    public int getNavigationTimeoutMs() {
        return Math.max(1000, navigationTimeoutMs);
    }

    public void setNavigationTimeoutMs(int navigationTimeoutMs) {
        this.navigationTimeoutMs = Math.max(1000, navigationTimeoutMs);
    }

    public int getRelaxedNavigationTimeoutMs() {
        return Math.max(1000, relaxedNavigationTimeoutMs);
    }

    public void setRelaxedNavigationTimeoutMs(int relaxedNavigationTimeoutMs) {
        this.relaxedNavigationTimeoutMs = Math.max(1000, relaxedNavigationTimeoutMs);
    }

    public int getDetailTimeoutMs() {
        return Math.max(1000, detailTimeoutMs);
    }

    public void setDetailTimeoutMs(int detailTimeoutMs) {
        this.detailTimeoutMs = Math.max(1000, detailTimeoutMs);
    }

    public int getSettleMillis() {
        return Math.max(0, settleMillis);
    }

    public void setSettleMillis(int settleMillis) {
        this.settleMillis = Math.max(0, settleMillis);
    }

    public String getStorePath() {
        return storePath;
    }

    public void setStorePath(String storePath) {
        this.storePath = storePath;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getDiagnosticsDir() {
        return diagnosticsDir;
    }

    public void setDiagnosticsDir(String diagnosticsDir) {
        this.diagnosticsDir = diagnosticsDir;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    private static int clampHour(int hour) {
        return Math.min(23, Math.max(0, hour));
    }

    public static class Browser {
        private static final List<String> DEFAULT_USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
        );

        private String engine = "selenium";
        private boolean headless = true;
        private String remoteUrl = "";
        private int windowWidth = 1920;
        private int windowHeight = 1080;
        private List<String> userAgents = new ArrayList<>(DEFAULT_USER_AGENTS);

        public String getEngine() {
            return engine == null || engine.isBlank() ? "selenium" : engine.trim();
        }

        public void setEngine(String engine) {
            this.engine = engine;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getRemoteUrl() {
            return remoteUrl == null ? "" : remoteUrl.trim();
        }

        public void setRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl;
        }

        public int getWindowWidth() {
            return Math.max(320, windowWidth);
        }

        public void setWindowWidth(int windowWidth) {
            this.windowWidth = windowWidth;
        }

        public int getWindowHeight() {
            return Math.max(240, windowHeight);
        }

        public void setWindowHeight(int windowHeight) {
            this.windowHeight = windowHeight;
        }

        public List<String> getUserAgents() {
            if (userAgents == null) {
                return DEFAULT_USER_AGENTS;
            }
            List<String> usable = userAgents.stream()
                .filter(agent -> agent != null && !agent.isBlank())
                .map(String::trim)
                .toList();
            return usable.isEmpty() ? DEFAULT_USER_AGENTS : usable;
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = userAgents;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;
        private String mode = "detailed";

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }
}
