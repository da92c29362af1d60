package com.delta.jobharvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "delta-job-harvester/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private Scraper scraper = new Scraper();
    private Polling polling = new Polling();
    private Classifier classifier = new Classifier();
    private Cache cache = new Cache();
    private Dedup dedup = new Dedup();
    private Filters filters = new Filters();

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
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Scraper getScraper() {
        return scraper;
    }

    public void setScraper(Scraper scraper) {
        this.scraper = scraper;
    }

    public Polling getPolling() {
        return polling;
    }

    public void setPolling(Polling polling) {
        this.polling = polling;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = dedup;
    }

    public Filters getFilters() {
        return filters;
    }

    public void setFilters(Filters filters) {
        this.filters = filters;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public static class Scraper {
        private String baseUrl = "https://api.outscraper.cloud";
        private String apiKey;
        private String webhookUrl;
        private String webhookSecret;
        private int defaultLimit = 500;
        private int pollMaxAttempts = 2;
        private int pollRetryBaseDelayMs = 500;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = blankToNull(apiKey);
        }

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = blankToNull(webhookUrl);
        }

        public String getWebhookSecret() {
            return webhookSecret;
        }

        public void setWebhookSecret(String webhookSecret) {
            this.webhookSecret = blankToNull(webhookSecret);
        }

        public int getDefaultLimit() {
            return Math.max(1, defaultLimit);
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getPollMaxAttempts() {
            return Math.max(1, pollMaxAttempts);
        }

        public void setPollMaxAttempts(int pollMaxAttempts) {
            this.pollMaxAttempts = Math.max(1, pollMaxAttempts);
        }

        public int getPollRetryBaseDelayMs() {
            return Math.max(0, pollRetryBaseDelayMs);
        }

        public void setPollRetryBaseDelayMs(int pollRetryBaseDelayMs) {
            this.pollRetryBaseDelayMs = Math.max(0, pollRetryBaseDelayMs);
        }
    }

    public static class Polling {
        private boolean enabled = true;
        private int intervalSeconds = 120;
        private int taskTimeoutMinutes = 60;
        private int lockTtlSeconds = 900;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalSeconds() {
            return Math.max(1, intervalSeconds);
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = Math.max(1, intervalSeconds);
        }

        public int getTaskTimeoutMinutes() {
            return Math.max(1, taskTimeoutMinutes);
        }

        public void setTaskTimeoutMinutes(int taskTimeoutMinutes) {
            this.taskTimeoutMinutes = Math.max(1, taskTimeoutMinutes);
        }

        public int getLockTtlSeconds() {
            return Math.max(30, lockTtlSeconds);
        }

        public void setLockTtlSeconds(int lockTtlSeconds) {
            this.lockTtlSeconds = Math.max(30, lockTtlSeconds);
        }
    }

    public static class Classifier {
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private int concurrency = 32;
        private int maxAttempts = 5;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 30_000;
        private int batchTimeoutSeconds = 900;
        private int maxDescriptionChars = 6000;
        private int maxTokens = 500;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = blankToNull(apiKey);
        }

        public String getModel() {
            return model == null || model.isBlank() ? "gpt-4o-mini" : model.trim();
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(getRetryBaseDelayMs(), retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public int getBatchTimeoutSeconds() {
            return Math.max(1, batchTimeoutSeconds);
        }

        public void setBatchTimeoutSeconds(int batchTimeoutSeconds) {
            this.batchTimeoutSeconds = Math.max(1, batchTimeoutSeconds);
        }

        public int getMaxDescriptionChars() {
            return Math.max(200, maxDescriptionChars);
        }

        public void setMaxDescriptionChars(int maxDescriptionChars) {
            this.maxDescriptionChars = Math.max(200, maxDescriptionChars);
        }

        public int getMaxTokens() {
            return Math.max(50, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(50, maxTokens);
        }
    }

    public static class Cache {
        private int ttlHours = 168;
        private int retentionDays = 30;
        private int lookupBatchSize = 500;
        private boolean refreshOnHit = false;

        public int getTtlHours() {
            return Math.max(1, ttlHours);
        }

        public void setTtlHours(int ttlHours) {
            this.ttlHours = Math.max(1, ttlHours);
        }

        public int getRetentionDays() {
            return Math.max(1, retentionDays);
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = Math.max(1, retentionDays);
        }

        public int getLookupBatchSize() {
            return Math.max(1, lookupBatchSize);
        }

        public void setLookupBatchSize(int lookupBatchSize) {
            this.lookupBatchSize = Math.max(1, lookupBatchSize);
        }

        public boolean isRefreshOnHit() {
            return refreshOnHit;
        }

        public void setRefreshOnHit(boolean refreshOnHit) {
            this.refreshOnHit = refreshOnHit;
        }
    }

    public static class Dedup {
        private boolean similarTitlePassEnabled = true;
        private boolean fallbackToSearchMarket = true;
        private String marketsResource = "classpath:markets.csv";

        public boolean isSimilarTitlePassEnabled() {
            return similarTitlePassEnabled;
        }

        public void setSimilarTitlePassEnabled(boolean similarTitlePassEnabled) {
            this.similarTitlePassEnabled = similarTitlePassEnabled;
        }

        public boolean isFallbackToSearchMarket() {
            return fallbackToSearchMarket;
        }

        public void setFallbackToSearchMarket(boolean fallbackToSearchMarket) {
            this.fallbackToSearchMarket = fallbackToSearchMarket;
        }

        public String getMarketsResource() {
            return marketsResource;
        }

        public void setMarketsResource(String marketsResource) {
            this.marketsResource = marketsResource;
        }
    }

    public static class Filters {
        private List<String> spamCompanies = new ArrayList<>(List.of("class a drivers", "live trucking"));
        private List<String> spamDomains = new ArrayList<>(List.of("cdllife.com", "truckwayjobs.com", "giggridz.com"));
        private List<String> ownerOperatorKeywords = new ArrayList<>(List.of(
            "owner operator",
            "owner-operator",
            "lease purchase",
            "dispatch service",
            "1099 driver",
            "hotshot",
            "power only"
        ));
        private List<String> schoolBusKeywords = new ArrayList<>(List.of(
            "school bus",
            "isd",
            "school district",
            "student transport",
            "pupil transport"
        ));

        public List<String> getSpamCompanies() {
            return spamCompanies;
        }

        public void setSpamCompanies(List<String> spamCompanies) {
            this.spamCompanies = spamCompanies == null ? new ArrayList<>() : spamCompanies;
        }

        public List<String> getSpamDomains() {
            return spamDomains;
        }

        public void setSpamDomains(List<String> spamDomains) {
            this.spamDomains = spamDomains == null ? new ArrayList<>() : spamDomains;
        }

        public List<String> getOwnerOperatorKeywords() {
            return ownerOperatorKeywords;
        }

        public void setOwnerOperatorKeywords(List<String> ownerOperatorKeywords) {
            this.ownerOperatorKeywords = ownerOperatorKeywords == null ? new ArrayList<>() : ownerOperatorKeywords;
        }

        public List<String> getSchoolBusKeywords() {
            return schoolBusKeywords;
        }

        public void setSchoolBusKeywords(List<String> schoolBusKeywords) {
            this.schoolBusKeywords = schoolBusKeywords == null ? new ArrayList<>() : schoolBusKeywords;
        }
    }
}
