package io.github.byzatic.jobscheduler;

import io.github.byzatic.jobscheduler.admin.AdminResult;
import io.github.byzatic.jobscheduler.base_exceptions.InvalidScheduleException;
import io.github.byzatic.jobscheduler.config.SchedulerConfig;
import io.github.byzatic.jobscheduler.cron.CronScheduler;
import io.github.byzatic.jobscheduler.registry.JobInfo;
import io.github.byzatic.jobscheduler.ssrf_guard.FakeDns;
import io.github.byzatic.jobscheduler.ssrf_guard.SafeHttpClientFactory;
import io.github.byzatic.jobscheduler.ssrf_guard.SsrfGuard;
import io.github.byzatic.jobscheduler.store.Database;
import io.github.byzatic.jobscheduler.store.JdbcOverrideStore;
import io.github.byzatic.jobscheduler.store.JdbcTaskStore;
import io.github.byzatic.jobscheduler.store.ScheduledTask;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerRuntimeTest {
    static final String HOURLY = "0 * * * *";

    @TempDir
    Path dir;

    SchedulerConfig config() {
        return new SchedulerConfig.Builder()
                .databaseUrl("jdbc:sqlite:" + dir.resolve("db").resolve("scheduler.db"))
                .engineGrace(Duration.ofMillis(500))
                .build();
    }

    JobSchedulerRuntime runtime(SchedulerConfig config) {
        Database database = new Database(config.getDatabaseUrl());
        SsrfGuard guard = new SsrfGuard(new FakeDns().answer("example.com", "93.184.215.14"));
        return new JobSchedulerRuntime(config, new JdbcOverrideStore(database), new JdbcTaskStore(database),
                new CronScheduler.Builder().grace(config.getEngineGrace()).build(),
                guard, SafeHttpClientFactory.create(guard, config));
    }

    static List<String> keys(JobSchedulerRuntime runtime) {
        return runtime.getRegistry().list().stream().map(JobInfo::key).collect(Collectors.toList());
    }

    @Test
    void stateSurvivesRestart() throws Exception {
        SchedulerConfig config = config();
        long taskId;
        try (JobSchedulerRuntime first = runtime(config)) {
            first.scheduleJob("core", "sitemap", "Rebuild sitemap", HOURLY, () -> { }, null);
            first.start();

            AdminResult<ScheduledTask> created = first.getAdminService()
                    .createTask("Health check", "https://example.com/health", "*/10 * * * *", null);
            assertTrue(created.isSuccess(), created.toString());
            taskId = created.getValue().getId();
            assertTrue(first.getAdminService().updateSchedule("core", "sitemap", "*/20 * * * *").isSuccess());
            assertEquals(List.of("core:sitemap", "task:cleanup", "task:task_" + taskId), keys(first));
        }

        try (JobSchedulerRuntime second = runtime(config)) {
            second.scheduleJob("core", "sitemap", "Rebuild sitemap", HOURLY, () -> { }, null);
            second.start();

            assertEquals(List.of("core:sitemap", "task:cleanup", "task:task_" + taskId), keys(second));
            JobInfo sitemap = second.getRegistry().find("core", "sitemap").orElseThrow();
            assertEquals("*/20 * * * *", sitemap.effectiveSchedule);
            assertTrue(sitemap.overridden);
            JobInfo task = second.getRegistry().find("task", "task_" + taskId).orElseThrow();
            assertEquals("*/10 * * * *", task.effectiveSchedule);
            assertNotNull(task.nextRun);
        }
    }

    @Test
    void startIsIdempotent() throws Exception {
        try (JobSchedulerRuntime runtime = runtime(config())) {
            runtime.start();
            runtime.start();
            assertEquals(List.of("task:cleanup"), keys(runtime));
        }
    }

    @Test
    void invalidDefaultScheduleIsRejected() {
        try (JobSchedulerRuntime runtime = runtime(config())) {
            assertThrows(InvalidScheduleException.class,
                    () -> runtime.scheduleJob("core", "broken", "Broken", "not cron", () -> { }, null));
            assertTrue(runtime.getRegistry().list().isEmpty());
        }
    }

    @Test
    void defaultWiringStartsAndStops() throws Exception {
        JobSchedulerRuntime runtime = JobSchedulerRuntime.create(config());
        runtime.start();
        assertTrue(runtime.getRegistry().find("task", "cleanup").isPresent());
        runtime.close();
        runtime.close();
    }
}
