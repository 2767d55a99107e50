package com.harvest.jobcrawler.config;

import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 1000;
    private int requestRetryMaxDelayMs = 30000;
    private double retryBackoffFactor = 2.0;
    private int urlConcurrency = 5;
    private int resumeWindowDays = 30;
    private int documentCacheTtlSeconds = 3600;
    private int documentCacheMaxSize = 2000;
    private Throttle throttle = new Throttle();
    private Circuits circuits = new Circuits();
    private Healing healing = new Healing();
    private Rendering rendering = new Rendering();
    private Enrichment enrichment = new Enrichment();
    private Validation validation = new Validation();
    private Cli cli = new Cli();
    private Map<String, Source> sources = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public double getRetryBackoffFactor() {
        return Math.max(1.0, retryBackoffFactor);
    }

    public void setRetryBackoffFactor(double retryBackoffFactor) {
        this.retryBackoffFactor = Math.max(1.0, retryBackoffFactor);
    }

    public int getUrlConcurrency() {
        return Math.max(1, urlConcurrency);
    }

    public void setUrlConcurrency(int urlConcurrency) {
        this.urlConcurrency = Math.max(1, urlConcurrency);
    }

    public int getResumeWindowDays() {
        return Math.max(0, resumeWindowDays);
    }

    public void setResumeWindowDays(int resumeWindowDays) {
        this.resumeWindowDays = Math.max(0, resumeWindowDays);
    }

    public int getDocumentCacheTtlSeconds() {
        return Math.max(1, documentCacheTtlSeconds);
    }

    public void setDocumentCacheTtlSeconds(int documentCacheTtlSeconds) {
        this.documentCacheTtlSeconds = Math.max(1, documentCacheTtlSeconds);
    }

    public int getDocumentCacheMaxSize() {
        return Math.max(1, documentCacheMaxSize);
    }

    public void setDocumentCacheMaxSize(int documentCacheMaxSize) {
        this.documentCacheMaxSize = Math.max(1, documentCacheMaxSize);
    }

    public Throttle getThrottle() {
        return throttle;
    }

    public void setThrottle(Throttle throttle) {
        this.throttle = throttle;
    }

    public Circuits getCircuits() {
        return circuits;
    }

    public void setCircuits(Circuits circuits) {
        this.circuits = circuits;
    }

    public Healing getHealing() {
        return healing;
    }

    public void setHealing(Healing healing) {
        this.healing = healing;
    }

    public Rendering getRendering() {
        return rendering;
    }

    public void setRendering(Rendering rendering) {
        this.rendering = rendering;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public String baseUrlFor(SourcePlatform platform) {
        Source source = sources.get(platform.code());
        if (source != null && source.getBaseUrl() != null && !source.getBaseUrl().isBlank()) {
            String configured = source.getBaseUrl().trim();
            return configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
        }
        return platform.defaultBaseUrl();
    }

    public double rateFor(SourcePlatform platform) {
        Source source = sources.get(platform.code());
        if (source != null && source.getRate() != null && source.getRate() > 0) {
            return source.getRate();
        }
        return platform.defaultRate() > 0 ? platform.defaultRate() : throttle.getDefaultRate();
    }

    public double capacityFor(SourcePlatform platform) {
        Source source = sources.get(platform.code());
        if (source != null && source.getCapacity() != null && source.getCapacity() >= 1) {
            return source.getCapacity();
        }
        return platform.defaultCapacity() >= 1 ? platform.defaultCapacity() : throttle.getDefaultCapacity();
    }

    public boolean isSourceEnabled(SourcePlatform platform) {
        Source source = sources.get(platform.code());
        return source == null || source.isEnabled();
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Source {
        private boolean enabled = true;
        private String baseUrl;
        private Double rate;
        private Double capacity;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Double getRate() {
            return rate;
        }

        public void setRate(Double rate) {
            this.rate = rate;
        }

        public Double getCapacity() {
            return capacity;
        }

        public void setCapacity(Double capacity) {
            this.capacity = capacity;
        }
    }

    public static class Throttle {
        private String store = "jdbc";
        private double defaultRate = 2.0;
        private double defaultCapacity = 10.0;
        private long acquireTimeoutMs = 60000;
        private long cooldownPollMs = 2000;
        private long maxWaitMs = 5000;
        private long jitterMinMs = 10;
        private long jitterMaxMs = 50;
        private int successStreakThreshold = 50;
        private double boostFactor = 1.1;
        private double backoffFactor = 0.7;
        private double maxRateMultiplier = 1.5;
        private double minRateMultiplier = 0.1;
        private int rateLimitCooldownSeconds = 300;

        public String getStore() {
            return store == null || store.isBlank() ? "jdbc" : store.trim();
        }

        public void setStore(String store) {
            this.store = store;
        }

        public double getDefaultRate() {
            return defaultRate > 0 ? defaultRate : 2.0;
        }

        public void setDefaultRate(double defaultRate) {
            this.defaultRate = defaultRate;
        }

        public double getDefaultCapacity() {
            return Math.max(1.0, defaultCapacity);
        }

        public void setDefaultCapacity(double defaultCapacity) {
            this.defaultCapacity = defaultCapacity;
        }

        public long getAcquireTimeoutMs() {
            return Math.max(1, acquireTimeoutMs);
        }

        public void setAcquireTimeoutMs(long acquireTimeoutMs) {
            this.acquireTimeoutMs = acquireTimeoutMs;
        }

        public long getCooldownPollMs() {
            return Math.max(1, cooldownPollMs);
        }

        public void setCooldownPollMs(long cooldownPollMs) {
            this.cooldownPollMs = cooldownPollMs;
        }

        public long getMaxWaitMs() {
            return Math.max(1, maxWaitMs);
        }

        public void setMaxWaitMs(long maxWaitMs) {
            this.maxWaitMs = maxWaitMs;
        }

        public long getJitterMinMs() {
            return Math.max(0, jitterMinMs);
        }

        public void setJitterMinMs(long jitterMinMs) {
            this.jitterMinMs = jitterMinMs;
        }

        public long getJitterMaxMs() {
            return Math.max(getJitterMinMs(), jitterMaxMs);
        }

        public void setJitterMaxMs(long jitterMaxMs) {
            this.jitterMaxMs = jitterMaxMs;
        }

        public int getSuccessStreakThreshold() {
            return Math.max(1, successStreakThreshold);
        }

        public void setSuccessStreakThreshold(int successStreakThreshold) {
            this.successStreakThreshold = successStreakThreshold;
        }

        public double getBoostFactor() {
            return Math.max(1.0, boostFactor);
        }

        public void setBoostFactor(double boostFactor) {
            this.boostFactor = boostFactor;
        }

        public double getBackoffFactor() {
            return Math.min(1.0, Math.max(0.01, backoffFactor));
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public double getMaxRateMultiplier() {
            return Math.max(1.0, maxRateMultiplier);
        }

        public void setMaxRateMultiplier(double maxRateMultiplier) {
            this.maxRateMultiplier = maxRateMultiplier;
        }

        public double getMinRateMultiplier() {
            return Math.min(1.0, Math.max(0.01, minRateMultiplier));
        }

        public void setMinRateMultiplier(double minRateMultiplier) {
            this.minRateMultiplier = minRateMultiplier;
        }

        public int getRateLimitCooldownSeconds() {
            return Math.max(1, rateLimitCooldownSeconds);
        }

        public void setRateLimitCooldownSeconds(int rateLimitCooldownSeconds) {
            this.rateLimitCooldownSeconds = rateLimitCooldownSeconds;
        }
    }

    public static class Circuits {
        private int aiFailureThreshold = 5;
        private int aiRecoverySeconds = 60;
        private int renderFailureThreshold = 10;
        private int renderRecoverySeconds = 30;

        public int getAiFailureThreshold() {
            return Math.max(1, aiFailureThreshold);
        }

        public void setAiFailureThreshold(int aiFailureThreshold) {
            this.aiFailureThreshold = aiFailureThreshold;
        }

        public int getAiRecoverySeconds() {
            return Math.max(1, aiRecoverySeconds);
        }

        public void setAiRecoverySeconds(int aiRecoverySeconds) {
            this.aiRecoverySeconds = aiRecoverySeconds;
        }

        public int getRenderFailureThreshold() {
            return Math.max(1, renderFailureThreshold);
        }

        public void setRenderFailureThreshold(int renderFailureThreshold) {
            this.renderFailureThreshold = renderFailureThreshold;
        }

        public int getRenderRecoverySeconds() {
            return Math.max(1, renderRecoverySeconds);
        }

        public void setRenderRecoverySeconds(int renderRecoverySeconds) {
            this.renderRecoverySeconds = renderRecoverySeconds;
        }
    }

    public static class Healing {
        private boolean enabled = true;
        private int failureThreshold = 3;
        private int isolationSeconds = 600;
        private double minTitleSimilarity = 0.4;
        private String ollamaUrl = "http://localhost:11434";
        private String model = "gemma3:4b";
        private int timeoutSeconds = 60;
        private int maxDocumentChars = 3500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getIsolationSeconds() {
            return Math.max(1, isolationSeconds);
        }

        public void setIsolationSeconds(int isolationSeconds) {
            this.isolationSeconds = isolationSeconds;
        }

        public double getMinTitleSimilarity() {
            return Math.min(1.0, Math.max(0.0, minTitleSimilarity));
        }

        public void setMinTitleSimilarity(double minTitleSimilarity) {
            this.minTitleSimilarity = minTitleSimilarity;
        }

        public String getOllamaUrl() {
            String value = ollamaUrl == null || ollamaUrl.isBlank() ? "http://localhost:11434" : ollamaUrl.trim();
            return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
        }

        public void setOllamaUrl(String ollamaUrl) {
            this.ollamaUrl = ollamaUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxDocumentChars() {
            return Math.max(200, maxDocumentChars);
        }

        public void setMaxDocumentChars(int maxDocumentChars) {
            this.maxDocumentChars = maxDocumentChars;
        }
    }

    public static class Rendering {
        private boolean enabled = false;
        private int maxContexts = 5;
        private int pageTimeoutSeconds = 30;
        private int acquireTimeoutSeconds = 60;
        private int settleMillis = 2000;
        private boolean headless = true;
        private String remoteUrl;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxContexts() {
            return Math.max(1, maxContexts);
        }

        public void setMaxContexts(int maxContexts) {
            this.maxContexts = maxContexts;
        }

        public int getPageTimeoutSeconds() {
            return Math.max(1, pageTimeoutSeconds);
        }

        public void setPageTimeoutSeconds(int pageTimeoutSeconds) {
            this.pageTimeoutSeconds = pageTimeoutSeconds;
        }

        public int getAcquireTimeoutSeconds() {
            return Math.max(1, acquireTimeoutSeconds);
        }

        public void setAcquireTimeoutSeconds(int acquireTimeoutSeconds) {
            this.acquireTimeoutSeconds = acquireTimeoutSeconds;
        }

        public int getSettleMillis() {
            return Math.max(0, settleMillis);
        }

        public void setSettleMillis(int settleMillis) {
            this.settleMillis = settleMillis;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getRemoteUrl() {
            return remoteUrl;
        }

        public void setRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl;
        }
    }

    public static class Enrichment {
        private boolean enabled = true;
        private int threads = 2;
        private int queueCapacity = 500;
        private boolean geocodingEnabled = false;
        private String geocoderUrl = "https://nominatim.openstreetmap.org/search";
        private int geocoderTimeoutSeconds = 10;
        private boolean companyEnabled = true;
        private int companyCacheMaxSize = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getThreads() {
            return Math.max(1, threads);
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getQueueCapacity() {
            return Math.max(1, queueCapacity);
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public boolean isGeocodingEnabled() {
            return geocodingEnabled;
        }

        public void setGeocodingEnabled(boolean geocodingEnabled) {
            this.geocodingEnabled = geocodingEnabled;
        }

        public String getGeocoderUrl() {
            return geocoderUrl;
        }

        public void setGeocoderUrl(String geocoderUrl) {
            this.geocoderUrl = geocoderUrl;
        }

        public int getGeocoderTimeoutSeconds() {
            return Math.max(1, geocoderTimeoutSeconds);
        }

        public void setGeocoderTimeoutSeconds(int geocoderTimeoutSeconds) {
            this.geocoderTimeoutSeconds = geocoderTimeoutSeconds;
        }

        public boolean isCompanyEnabled() {
            return companyEnabled;
        }

        public void setCompanyEnabled(boolean companyEnabled) {
            this.companyEnabled = companyEnabled;
        }

        public int getCompanyCacheMaxSize() {
            return Math.max(1, companyCacheMaxSize);
        }

        public void setCompanyCacheMaxSize(int companyCacheMaxSize) {
            this.companyCacheMaxSize = companyCacheMaxSize;
        }
    }

    public static class Validation {
        private boolean saveSamples = true;
        private String sampleDir = "data/failed_samples";
        private int driftMinSamples = 10;
        private double driftFailRatio = 0.3;

        public boolean isSaveSamples() {
            return saveSamples;
        }

        public void setSaveSamples(boolean saveSamples) {
            this.saveSamples = saveSamples;
        }

        public String getSampleDir() {
            return sampleDir;
        }

        public void setSampleDir(String sampleDir) {
            this.sampleDir = sampleDir;
        }

        public int getDriftMinSamples() {
            return Math.max(1, driftMinSamples);
        }

        public void setDriftMinSamples(int driftMinSamples) {
            this.driftMinSamples = driftMinSamples;
        }

        public double getDriftFailRatio() {
            return Math.min(1.0, Math.max(0.0, driftFailRatio));
        }

        public void setDriftFailRatio(double driftFailRatio) {
            this.driftFailRatio = driftFailRatio;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String sources = "";
        private String category;
        private int limit = 20;
        private boolean resume = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSources() {
            return sources == null ? "" : sources;
        }

        public void setSources(String sources) {
            this.sources = sources;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public int getLimit() {
            return Math.max(1, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(1, limit);
        }

        public boolean isResume() {
            return resume;
        }

        public void setResume(boolean resume) {
            this.resume = resume;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
