package com.openonco.discovery.config;

import com.openonco.discovery.pipeline.model.DiscoverySource;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "openonco-discovery/0.1 (+https://openonco.org)";
    private static final String DEFAULT_CRAWL_CRON = "0 2 * * 0";

    private Data data = new Data();
    private Http http = new Http();
    private Scheduler scheduler = new Scheduler();
    private Cleanup cleanup = new Cleanup();
    private Digest digest = new Digest();
    private Email email = new Email();
    private Cli cli = new Cli();
    private Map<String, Crawler> crawlers = new LinkedHashMap<>();
    private List<String> monitoredTests = new ArrayList<>();
    private List<VendorPage> vendors = new ArrayList<>();
    private List<PayerPage> payers = new ArrayList<>();

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public void setCleanup(Cleanup cleanup) {
        this.cleanup = cleanup;
    }

    public Digest getDigest() {
        return digest;
    }

    public void setDigest(Digest digest) {
        this.digest = digest;
    }

    public Email getEmail() {
        return email;
    }

    public void setEmail(Email email) {
        this.email = email;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Crawler> getCrawlers() {
        return crawlers;
    }

    public void setCrawlers(Map<String, Crawler> crawlers) {
        this.crawlers = crawlers == null ? new LinkedHashMap<>() : crawlers;
    }

    /**
     * Settings for one source. Sources without an entry fall back to a disabled crawler
     * on the weekly default schedule.
     */
    public Crawler crawler(DiscoverySource source) {
        Crawler configured = crawlers.get(source.id());
        if (configured != null) {
            return configured;
        }
        Crawler fallback = new Crawler();
        fallback.setEnabled(false);
        return fallback;
    }

    public List<String> getMonitoredTests() {
        return monitoredTests;
    }

    public void setMonitoredTests(List<String> monitoredTests) {
        this.monitoredTests = monitoredTests == null ? new ArrayList<>() : monitoredTests;
    }

    public List<VendorPage> getVendors() {
        return vendors;
    }

    public void setVendors(List<VendorPage> vendors) {
        this.vendors = vendors == null ? new ArrayList<>() : vendors;
    }

    public List<PayerPage> getPayers() {
        return payers;
    }

    public void setPayers(List<PayerPage> payers) {
        this.payers = payers == null ? new ArrayList<>() : payers;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Data {
        private String dir = "data";

        public String getDir() {
            return (dir == null || dir.isBlank()) ? "data" : dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Http {
        private String userAgent;
        private int requestTimeoutSeconds = 30;
        private int requestMaxRetries = 2;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 5000;
        private int defaultHostDelayMs = 1000;
        private int clientThreads = 4;

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
            this.requestMaxRetries = requestMaxRetries;
        }

        public int getRequestRetryBaseDelayMs() {
            return Math.max(0, requestRetryBaseDelayMs);
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
        }

        public int getRequestRetryMaxDelayMs() {
            return Math.max(0, requestRetryMaxDelayMs);
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
        }

        public int getDefaultHostDelayMs() {
            return Math.max(1, defaultHostDelayMs);
        }

        public void setDefaultHostDelayMs(int defaultHostDelayMs) {
            this.defaultHostDelayMs = Math.max(1, defaultHostDelayMs);
        }

        public int getClientThreads() {
            return Math.max(1, clientThreads);
        }

        public void setClientThreads(int clientThreads) {
            this.clientThreads = clientThreads;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int poolSize = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPoolSize() {
            return Math.max(1, poolSize);
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    public static class Cleanup {
        private String cron = "0 0 * * *";
        private int maxAgeDays = 30;

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public int getMaxAgeDays() {
            return Math.max(1, maxAgeDays);
        }

        public void setMaxAgeDays(int maxAgeDays) {
            this.maxAgeDays = maxAgeDays;
        }
    }

    public static class Digest {
        private boolean enabled = true;
        private String cron = "0 6 * * 1";
        private String exportDir;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getExportDir() {
            return exportDir;
        }

        public void setExportDir(String exportDir) {
            this.exportDir = exportDir;
        }
    }

    public static class Email {
        private String apiUrl = "https://api.resend.com/emails";
        private String apiKey;
        private String from = "OpenOnco Daemon <daemon@openonco.org>";
        private List<String> to = new ArrayList<>();

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public List<String> getTo() {
            return to.stream()
                .filter(address -> address != null && !address.isBlank())
                .map(String::trim)
                .toList();
        }

        public void setTo(List<String> to) {
            this.to = to == null ? new ArrayList<>() : to;
        }
    }

    public static class Cli {
        private boolean exitAfterRun = true;

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Crawler {
        private boolean enabled = true;
        private double rateLimit = 1.0;
        private String cron = DEFAULT_CRAWL_CRON;
        private String baseUrl;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /**
         * Requests per second allowed against the source host.
         */
        public double getRateLimit() {
            return rateLimit > 0 ? rateLimit : 1.0;
        }

        public void setRateLimit(double rateLimit) {
            this.rateLimit = rateLimit;
        }

        public String getCron() {
            return (cron == null || cron.isBlank()) ? DEFAULT_CRAWL_CRON : cron.trim();
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String baseUrlOr(String defaultBaseUrl) {
            String value = (baseUrl == null || baseUrl.isBlank()) ? defaultBaseUrl : baseUrl.trim();
            return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
        }

        public long minIntervalMs() {
            return (long) Math.ceil(1000.0 / getRateLimit());
        }
    }

    public static class VendorPage {
        private String id;
        private String name;
        private String newsUrl;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getNewsUrl() {
            return newsUrl;
        }

        public void setNewsUrl(String newsUrl) {
            this.newsUrl = newsUrl;
        }
    }

    public static class PayerPage {
        private String id;
        private String name;
        private String indexUrl;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getIndexUrl() {
            return indexUrl;
        }

        public void setIndexUrl(String indexUrl) {
            this.indexUrl = indexUrl;
        }
    }
}
