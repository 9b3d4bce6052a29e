package com.courtcapture.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "capture")
public class CaptureProperties {
    private static final String DEFAULT_ZONE = "America/Sao_Paulo";
    private static final String DEFAULT_EXECUTOR_URL = "http://localhost:8090";

    private Credentials credentials = new Credentials();
    private Resolver resolver = new Resolver();
    private Courts courts = new Courts();
    private Scheduler scheduler = new Scheduler();
    private Executor executor = new Executor();
    private Runs runs = new Runs();

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public void setResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    public Courts getCourts() {
        return courts;
    }

    public void setCourts(Courts courts) {
        this.courts = courts;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
    }

    public static class Credentials {
        private int cacheTtlSeconds = 300;
        private long sweepIntervalMs = 60_000;
        private String encryptionKey;

        public int getCacheTtlSeconds() {
            return Math.max(1, cacheTtlSeconds);
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = Math.max(1, cacheTtlSeconds);
        }

        public Duration cacheTtl() {
            return Duration.ofSeconds(getCacheTtlSeconds());
        }

        public long getSweepIntervalMs() {
            return Math.max(1000, sweepIntervalMs);
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = Math.max(1000, sweepIntervalMs);
        }

        public String getEncryptionKey() {
            return encryptionKey;
        }

        public void setEncryptionKey(String encryptionKey) {
            this.encryptionKey = encryptionKey == null ? null : encryptionKey.trim();
        }
    }

    public static class Resolver {
        private int concurrency = 8;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }
    }

    public static class Courts {
        private int cacheTtlSeconds = 300;

        public int getCacheTtlSeconds() {
            return Math.max(1, cacheTtlSeconds);
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = Math.max(1, cacheTtlSeconds);
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long pollIntervalMs = 60_000;
        private int batchSize = 20;
        private int runConcurrency = 2;
        private String zone = DEFAULT_ZONE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalMs() {
            return Math.max(1000, pollIntervalMs);
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = Math.max(1000, pollIntervalMs);
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getRunConcurrency() {
            return Math.max(1, runConcurrency);
        }

        public void setRunConcurrency(int runConcurrency) {
            this.runConcurrency = Math.max(1, runConcurrency);
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone == null || zone.isBlank() ? DEFAULT_ZONE : zone.trim();
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    public static class Executor {
        private String baseUrl = DEFAULT_EXECUTOR_URL;
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 900;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                this.baseUrl = DEFAULT_EXECUTOR_URL;
                return;
            }
            String trimmed = baseUrl.trim();
            this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Runs {
        private int staleRunMinutes = 180;

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }
    }
}
