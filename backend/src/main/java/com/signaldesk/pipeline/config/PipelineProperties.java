package com.signaldesk.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "signal-pipeline/0.1 (+ops@signaldesk.example)";

    private String userAgent;
    private boolean demoMode;
    private Retry retry = new Retry();
    private Scheduler scheduler = new Scheduler();
    private Cli cli = new Cli();
    private Watchlist watchlist = new Watchlist();
    private Map<String, Provider> providers = new LinkedHashMap<>();
    private Map<String, JobSettings> jobs = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public boolean isDemoMode() {
        return demoMode;
    }

    public void setDemoMode(boolean demoMode) {
        this.demoMode = demoMode;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Watchlist getWatchlist() {
        return watchlist;
    }

    public void setWatchlist(Watchlist watchlist) {
        this.watchlist = watchlist;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public Provider provider(String name) {
        Provider provider = providers.get(name);
        if (provider == null) {
            throw new IllegalStateException("No provider configured under pipeline.providers." + name);
        }
        return provider;
    }

    public Map<String, JobSettings> getJobs() {
        return jobs;
    }

    public void setJobs(Map<String, JobSettings> jobs) {
        this.jobs = jobs == null ? new LinkedHashMap<>() : jobs;
    }

    public JobSettings job(String name) {
        return jobs.getOrDefault(name, new JobSettings());
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(10);

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
        }
    }

    public static class Scheduler {
        private Duration tickInterval = Duration.ofSeconds(1);
        private int maxConcurrentJobs = 4;
        private Duration jobTimeout;
        private int historySize = 200;

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            if (tickInterval == null || tickInterval.isNegative() || tickInterval.isZero()) {
                this.tickInterval = Duration.ofSeconds(1);
                return;
            }
            this.tickInterval = tickInterval;
        }

        public int getMaxConcurrentJobs() {
            return Math.max(1, maxConcurrentJobs);
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
        }

        /**
         * Upper bound on a single job execution. {@code null} (the default) disables it.
         */
        public Duration getJobTimeout() {
            return jobTimeout;
        }

        public void setJobTimeout(Duration jobTimeout) {
            if (jobTimeout == null || jobTimeout.isNegative() || jobTimeout.isZero()) {
                this.jobTimeout = null;
                return;
            }
            this.jobTimeout = jobTimeout;
        }

        public int getHistorySize() {
            return Math.max(1, historySize);
        }

        public void setHistorySize(int historySize) {
            this.historySize = Math.max(1, historySize);
        }
    }

    public static class Cli {
        private String mode = "scheduler";
        private String job = "";
        private boolean exitAfterRun = true;

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode == null || mode.isBlank() ? "scheduler" : mode.trim().toLowerCase(Locale.ROOT);
        }

        public String getJob() {
            return job;
        }

        public void setJob(String job) {
            this.job = job == null ? "" : job.trim();
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Watchlist {
        private String csv = "classpath:watchlist.csv";
        private String tickers = "";

        public String getCsv() {
            return csv;
        }

        public void setCsv(String csv) {
            this.csv = csv;
        }

        // comma separated; when set the CSV is ignored
        public String getTickers() {
            return tickers;
        }

        public void setTickers(String tickers) {
            this.tickers = tickers == null ? "" : tickers;
        }
    }

    public static class Provider {
        private String baseUrl;
        private String apiKey;
        private int callsPerWindow = 60;
        private int windowSeconds = 60;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private List<String> throttleMarkers = new ArrayList<>();
        private Duration throttleCooldown = Duration.ofSeconds(30);
        private int requestTimeoutSeconds = 20;
        private Map<String, String> headers = new LinkedHashMap<>();

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
            this.apiKey = apiKey;
        }

        public int getCallsPerWindow() {
            return Math.max(1, callsPerWindow);
        }

        public void setCallsPerWindow(int callsPerWindow) {
            this.callsPerWindow = Math.max(1, callsPerWindow);
        }

        public int getWindowSeconds() {
            return Math.max(1, windowSeconds);
        }

        public void setWindowSeconds(int windowSeconds) {
            this.windowSeconds = Math.max(1, windowSeconds);
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl == null ? Duration.ZERO : cacheTtl;
        }

        public List<String> getThrottleMarkers() {
            return throttleMarkers;
        }

        public void setThrottleMarkers(List<String> throttleMarkers) {
            this.throttleMarkers = throttleMarkers == null ? new ArrayList<>() : throttleMarkers;
        }

        public Duration getThrottleCooldown() {
            return throttleCooldown;
        }

        public void setThrottleCooldown(Duration throttleCooldown) {
            this.throttleCooldown = throttleCooldown == null ? Duration.ZERO : throttleCooldown;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers == null ? new LinkedHashMap<>() : headers;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class JobSettings {
        private boolean enabled = true;
        private Duration cadence;
        private List<String> sources = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getCadence() {
            return cadence;
        }

        public void setCadence(Duration cadence) {
            this.cadence = cadence;
        }

        public List<String> getSources() {
            return sources;
        }

        public void setSources(List<String> sources) {
            this.sources = sources == null ? new ArrayList<>() : sources;
        }
    }
}
