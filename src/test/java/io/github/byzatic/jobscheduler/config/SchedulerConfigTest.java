package io.github.byzatic.jobscheduler.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    void defaults() {
        SchedulerConfig c = SchedulerConfig.defaults();
        assertEquals("jdbc:sqlite:data/scheduler.db", c.getDatabaseUrl());
        assertEquals(Duration.ofSeconds(30), c.getDefaultTaskTimeout());
        assertEquals(Duration.ofSeconds(10), c.getConnectTimeout());
        assertEquals(4096, c.getMaxResponseBytes());
        assertEquals(10, c.getMaxRedirects());
        assertEquals(Duration.ofSeconds(10), c.getTriggerInterval());
        assertEquals(30, c.getRunRetentionDays());
        assertEquals("0 3 * * *", c.getCleanupSchedule());
    }

    @Test
    void bundledResourceMatchesDefaults() {
        SchedulerConfig loaded = SchedulerConfig.load();
        SchedulerConfig defaults = SchedulerConfig.defaults();
        assertEquals(defaults.getDatabaseUrl(), loaded.getDatabaseUrl());
        assertEquals(defaults.getDefaultTaskTimeout(), loaded.getDefaultTaskTimeout());
        assertEquals(defaults.getMaxResponseBytes(), loaded.getMaxResponseBytes());
        assertEquals(defaults.getUserAgent(), loaded.getUserAgent());
        assertEquals(defaults.getCleanupSchedule(), loaded.getCleanupSchedule());
        assertEquals(defaults.getEngineGrace(), loaded.getEngineGrace());
    }

    @Test
    void systemPropertiesOverrideResource() {
        String key = SchedulerConfig.SYSTEM_PREFIX + SchedulerConfig.KEY_RETENTION_DAYS;
        System.setProperty(key, "7");
        try {
            assertEquals(7, SchedulerConfig.load().getRunRetentionDays());
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty(SchedulerConfig.KEY_DB_URL, " jdbc:sqlite:/tmp/x.db ");
        p.setProperty(SchedulerConfig.KEY_DEFAULT_TIMEOUT, "45");
        p.setProperty(SchedulerConfig.KEY_MAX_REDIRECTS, "3");
        p.setProperty(SchedulerConfig.KEY_USER_AGENT, "probe/1.0");
        p.setProperty(SchedulerConfig.KEY_CLEANUP_SCHEDULE, "@daily");
        p.setProperty(SchedulerConfig.KEY_ENGINE_GRACE, "250");

        SchedulerConfig c = SchedulerConfig.fromProperties(p);

        assertEquals("jdbc:sqlite:/tmp/x.db", c.getDatabaseUrl());
        assertEquals(Duration.ofSeconds(45), c.getDefaultTaskTimeout());
        assertEquals(3, c.getMaxRedirects());
        assertEquals("probe/1.0", c.getUserAgent());
        assertEquals("@daily", c.getCleanupSchedule());
        assertEquals(Duration.ofMillis(250), c.getEngineGrace());
        assertEquals(4096, c.getMaxResponseBytes());
    }

    @Test
    void badNumbersAreRejected() {
        Properties notNumber = new Properties();
        notNumber.setProperty(SchedulerConfig.KEY_TRIGGER_INTERVAL, "ten");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromProperties(notNumber));
        assertTrue(e.getMessage().contains(SchedulerConfig.KEY_TRIGGER_INTERVAL));

        Properties negative = new Properties();
        negative.setProperty(SchedulerConfig.KEY_RETENTION_DAYS, "-1");
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.fromProperties(negative));
    }

    @Test
    void builderValidates() {
        assertThrows(IllegalArgumentException.class, () -> new SchedulerConfig.Builder().maxResponseBytes(0).build());
        assertThrows(IllegalArgumentException.class, () -> new SchedulerConfig.Builder().runRetentionDays(0).build());
        assertThrows(NullPointerException.class, () -> new SchedulerConfig.Builder().userAgent(null));
    }
}
