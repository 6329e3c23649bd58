package io.github.byzatic.jobscheduler.config;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of the scheduling core. Built with {@link Builder} or loaded from the classpath
 * resource {@value #RESOURCE}, where every key may be overridden by a system property with the
 * {@value #SYSTEM_PREFIX} prefix.
 */
public final class SchedulerConfig {
    private final static Logger logger = LoggerFactory.getLogger(SchedulerConfig.class);

    public static final String RESOURCE = "job-scheduler.properties";
    public static final String SYSTEM_PREFIX = "jobscheduler.";

    public static final String KEY_DB_URL = "db.url";
    public static final String KEY_DEFAULT_TIMEOUT = "http.timeout.default.seconds";
    public static final String KEY_CONNECT_TIMEOUT = "http.connect.timeout.seconds";
    public static final String KEY_MAX_RESPONSE_BYTES = "http.max.response.bytes";
    public static final String KEY_MAX_REDIRECTS = "http.max.redirects";
    public static final String KEY_USER_AGENT = "http.user.agent";
    public static final String KEY_TRIGGER_INTERVAL = "trigger.interval.seconds";
    public static final String KEY_RETENTION_DAYS = "runs.retention.days";
    public static final String KEY_CLEANUP_SCHEDULE = "cleanup.schedule";
    public static final String KEY_ENGINE_GRACE = "engine.grace.millis";

    private final String databaseUrl;
    private final Duration defaultTaskTimeout;
    private final Duration connectTimeout;
    private final int maxResponseBytes;
    private final int maxRedirects;
    private final String userAgent;
    private final Duration triggerInterval;
    private final int runRetentionDays;
    private final String cleanupSchedule;
    private final Duration engineGrace;

    private SchedulerConfig(Builder b) {
        this.databaseUrl = b.databaseUrl;
        this.defaultTaskTimeout = b.defaultTaskTimeout;
        this.connectTimeout = b.connectTimeout;
        this.maxResponseBytes = b.maxResponseBytes;
        this.maxRedirects = b.maxRedirects;
        this.userAgent = b.userAgent;
        this.triggerInterval = b.triggerInterval;
        this.runRetentionDays = b.runRetentionDays;
        this.cleanupSchedule = b.cleanupSchedule;
        this.engineGrace = b.engineGrace;
    }

    public static @NotNull SchedulerConfig defaults() {
        return new Builder().build();
    }

    /**
     * Loads {@value #RESOURCE} if present, then applies system property overrides.
     */
    public static @NotNull SchedulerConfig load() {
        Properties props = new Properties();
        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("{} not found on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    /**
     * @throws IllegalArgumentException if a numeric key holds a non-numeric or non-positive value
     */
    public static @NotNull SchedulerConfig fromProperties(@NotNull Properties props) {
        Builder b = new Builder();
        String dbUrl = props.getProperty(KEY_DB_URL);
        if (dbUrl != null && !dbUrl.isBlank()) b.databaseUrl(dbUrl.trim());
        b.defaultTaskTimeout(Duration.ofSeconds(positive(props, KEY_DEFAULT_TIMEOUT, b.defaultTaskTimeout.getSeconds())));
        b.connectTimeout(Duration.ofSeconds(positive(props, KEY_CONNECT_TIMEOUT, b.connectTimeout.getSeconds())));
        b.maxResponseBytes((int) positive(props, KEY_MAX_RESPONSE_BYTES, b.maxResponseBytes));
        b.maxRedirects((int) positive(props, KEY_MAX_REDIRECTS, b.maxRedirects));
        String userAgent = props.getProperty(KEY_USER_AGENT);
        if (userAgent != null && !userAgent.isBlank()) b.userAgent(userAgent.trim());
        b.triggerInterval(Duration.ofSeconds(positive(props, KEY_TRIGGER_INTERVAL, b.triggerInterval.getSeconds())));
        b.runRetentionDays((int) positive(props, KEY_RETENTION_DAYS, b.runRetentionDays));
        String cleanup = props.getProperty(KEY_CLEANUP_SCHEDULE);
        if (cleanup != null && !cleanup.isBlank()) b.cleanupSchedule(cleanup.trim());
        b.engineGrace(Duration.ofMillis(positive(props, KEY_ENGINE_GRACE, b.engineGrace.toMillis())));
        return b.build();
    }

    private static long positive(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key " + key + " is not a number: " + raw, e);
        }
        if (value <= 0) throw new IllegalArgumentException("Config key " + key + " must be positive: " + raw);
        return value;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public Duration getDefaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getMaxResponseBytes() {
        return maxResponseBytes;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Duration getTriggerInterval() {
        return triggerInterval;
    }

    public int getRunRetentionDays() {
        return runRetentionDays;
    }

    public String getCleanupSchedule() {
        return cleanupSchedule;
    }

    public Duration getEngineGrace() {
        return engineGrace;
    }

    public static final class Builder {
        private String databaseUrl = "jdbc:sqlite:data/scheduler.db";
        private Duration defaultTaskTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxResponseBytes = 4096;
        private int maxRedirects = 10;
        private String userAgent = "Mozilla/5.0 (compatible)";
        private Duration triggerInterval = Duration.ofSeconds(10);
        private int runRetentionDays = 30;
        private String cleanupSchedule = "0 3 * * *"; // daily at 03:00
        private Duration engineGrace = Duration.ofSeconds(10);

        public Builder databaseUrl(String databaseUrl) {
            this.databaseUrl = Objects.requireNonNull(databaseUrl);
            return this;
        }

        public Builder defaultTaskTimeout(Duration timeout) {
            this.defaultTaskTimeout = Objects.requireNonNull(timeout);
            return this;
        }

        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = Objects.requireNonNull(timeout);
            return this;
        }

        public Builder maxResponseBytes(int maxResponseBytes) {
            this.maxResponseBytes = maxResponseBytes;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.maxRedirects = maxRedirects;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent);
            return this;
        }

        /**
         * Minimum spacing of manual triggers of the same task.
         */
        public Builder triggerInterval(Duration triggerInterval) {
            this.triggerInterval = Objects.requireNonNull(triggerInterval);
            return this;
        }

        public Builder runRetentionDays(int days) {
            this.runRetentionDays = days;
            return this;
        }

        public Builder cleanupSchedule(String cron) {
            this.cleanupSchedule = Objects.requireNonNull(cron);
            return this;
        }

        public Builder engineGrace(Duration grace) {
            this.engineGrace = Objects.requireNonNull(grace);
            return this;
        }

        public SchedulerConfig build() {
            if (maxResponseBytes <= 0) throw new IllegalArgumentException("maxResponseBytes must be positive");
            if (maxRedirects < 0) throw new IllegalArgumentException("maxRedirects must not be negative");
            if (runRetentionDays <= 0) throw new IllegalArgumentException("runRetentionDays must be positive");
            return new SchedulerConfig(this);
        }
    }
}
