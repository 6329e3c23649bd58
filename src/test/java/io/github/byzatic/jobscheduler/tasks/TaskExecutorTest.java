package io.github.byzatic.jobscheduler.tasks;

import com.google.common.base.Ticker;
import io.github.byzatic.jobscheduler.base_exceptions.RateLimitedException;
import io.github.byzatic.jobscheduler.base_exceptions.TaskNotFoundException;
import io.github.byzatic.jobscheduler.base_exceptions.TriggerUnavailableException;
import io.github.byzatic.jobscheduler.config.SchedulerConfig;
import io.github.byzatic.jobscheduler.cron.CronScheduler;
import io.github.byzatic.jobscheduler.registry.JobInfo;
import io.github.byzatic.jobscheduler.registry.JobRegistry;
import io.github.byzatic.jobscheduler.ssrf_guard.CannedInterceptor;
import io.github.byzatic.jobscheduler.ssrf_guard.FakeDns;
import io.github.byzatic.jobscheduler.ssrf_guard.SafeHttpClientFactory;
import io.github.byzatic.jobscheduler.ssrf_guard.SsrfGuard;
import io.github.byzatic.jobscheduler.store.InMemoryOverrideStore;
import io.github.byzatic.jobscheduler.store.InMemoryTaskStore;
import io.github.byzatic.jobscheduler.store.ScheduledTask;
import io.github.byzatic.jobscheduler.store.TaskRun;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TaskExecutorTest {
    static final Instant NOW = Instant.parse("2025-08-08T11:23:20Z");
    static final Duration WAIT = Duration.ofSeconds(5);

    static final class FakeTicker extends Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(long amount, TimeUnit unit) {
            nanos.addAndGet(unit.toNanos(amount));
        }
    }

    final SchedulerConfig config = SchedulerConfig.defaults();
    final FakeDns dns = new FakeDns()
            .answer("example.com", "93.184.215.14")
            .answer("moved.example", "93.184.215.14")
            .answer("moved.example", "10.0.0.7");
    final SsrfGuard guard = new SsrfGuard(dns);
    final FakeTicker ticker = new FakeTicker();
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    volatile CannedInterceptor.Responder responder =
            request -> CannedInterceptor.response(request, 200, "application/json", "{\"ok\":true}");
    final CannedInterceptor canned = new CannedInterceptor(request -> responder.respond(request));

    InMemoryTaskStore store;
    InMemoryOverrideStore overrides;
    CronScheduler engine;
    JobRegistry registry;
    TaskExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore();
        overrides = new InMemoryOverrideStore();
        engine = new CronScheduler.Builder().build();
        registry = new JobRegistry(overrides);
        OkHttpClient client = SafeHttpClientFactory.create(guard, config).newBuilder()
                .addInterceptor(canned)
                .build();
        executor = new TaskExecutor(store, registry, engine, guard, client, config, ticker, clock);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    ScheduledTask task(String url) {
        return store.createTask("health check", url, "0 * * * *", 30, true);
    }

    TaskRun onlyRun(ScheduledTask task) {
        List<TaskRun> runs = store.listRuns(task.getId(), 10, 0);
        assertEquals(1, runs.size(), runs.toString());
        return runs.get(0);
    }

    @Test
    void successfulRunStoresSummary() {
        ScheduledTask task = task("https://example.com/health");

        executor.executeTask(task);

        TaskRun run = onlyRun(task);
        assertEquals(TaskRun.Status.SUCCESS, run.status);
        assertEquals(200, run.statusCode);
        assertEquals("application/json (11 bytes)", run.responseSummary);
        assertNull(run.errorMessage);
        assertEquals(NOW, run.startedAt);
        assertEquals(NOW, run.completedAt);
        assertNotNull(run.durationMs);

        Request sent = canned.requests().get(0);
        assertEquals("GET", sent.method());
        assertEquals(config.getUserAgent(), sent.header("User-Agent"));
    }

    @Test
    void errorStatusIsStillARecordedResponse() {
        responder = request -> CannedInterceptor.response(request, 503, "text/html", "<h1>down</h1>");
        ScheduledTask task = task("https://example.com/health");

        executor.executeTask(task);

        TaskRun run = onlyRun(task);
        assertEquals(TaskRun.Status.SUCCESS, run.status);
        assertEquals(503, run.statusCode);
        assertEquals("text/html (13 bytes)", run.responseSummary);
    }

    @Test
    void bodyIsReadUpToLimitAndMissingContentTypeIsUnknown() {
        responder = request -> CannedInterceptor.response(request, 200, null, "x".repeat(10_000));
        ScheduledTask task = task("https://example.com/big");

        executor.executeTask(task);

        assertEquals("unknown (" + config.getMaxResponseBytes() + " bytes)", onlyRun(task).responseSummary);
    }

    @Test
    void privateTargetFailsWithoutRequest() {
        ScheduledTask task = task("http://10.0.0.1/admin");

        executor.executeTask(task);

        TaskRun run = onlyRun(task);
        assertEquals(TaskRun.Status.FAILED, run.status);
        assertTrue(run.errorMessage.startsWith("SSRF protection: "), run.errorMessage);
        assertNull(run.statusCode);
        assertTrue(canned.requests().isEmpty());
    }

    @Test
    void hostRebindingToPrivateAddressFailsAtFireTime() throws Exception {
        guard.validateUrl("https://moved.example/hook");
        ScheduledTask task = task("https://moved.example/hook");

        executor.executeTask(task);

        TaskRun run = onlyRun(task);
        assertEquals(TaskRun.Status.FAILED, run.status);
        assertTrue(run.errorMessage.startsWith("SSRF protection: "), run.errorMessage);
        assertTrue(run.errorMessage.contains("10.0.0.7"), run.errorMessage);
        assertTrue(canned.requests().isEmpty());
    }

    @Test
    void transportErrorIsRecorded() {
        responder = request -> {
            throw new IOException("connection reset");
        };
        ScheduledTask task = task("https://example.com/health");

        executor.executeTask(task);

        TaskRun run = onlyRun(task);
        assertEquals(TaskRun.Status.FAILED, run.status);
        assertEquals("request failed: connection reset", run.errorMessage);
    }

    @Test
    void slowResponseHitsTaskTimeout() {
        responder = request -> {
            try {
                Thread.sleep(1500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CannedInterceptor.response(request, 200, "text/plain", "late");
        };
        ScheduledTask task = store.createTask("slow endpoint", "https://example.com/slow", "0 * * * *", 1, true);

        executor.executeTask(task);

        TaskRun run = onlyRun(task);
        assertEquals(TaskRun.Status.FAILED, run.status);
        assertEquals("request failed: timeout", run.errorMessage);
    }

    @Test
    void addTaskRegistersJob() throws Exception {
        ScheduledTask task = task("https://example.com/health");

        executor.addTask(task);

        JobInfo info = registry.find(TaskExecutor.SOURCE, TaskExecutor.taskName(task.getId())).orElseThrow();
        assertEquals("task_" + task.getId(), info.name);
        assertEquals("health check: GET https://example.com/health", info.description);
        assertEquals("0 * * * *", info.defaultSchedule);
        assertTrue(info.canTrigger);
        assertNotNull(info.nextRun);
        assertEquals(1, engine.entries().size());
    }

    @Test
    void removeTaskUnregistersJob() throws Exception {
        ScheduledTask task = task("https://example.com/health");
        executor.addTask(task);

        executor.removeTask(task.getId());

        assertTrue(registry.list().isEmpty());
        assertTrue(engine.entries().isEmpty());
    }

    @Test
    void rescheduleReturnsTaskToItsOwnSchedule() throws Exception {
        ScheduledTask task = task("https://example.com/health");
        executor.addTask(task);
        String name = TaskExecutor.taskName(task.getId());
        registry.updateSchedule(TaskExecutor.SOURCE, name, "*/5 * * * *");

        ScheduledTask edited = store.updateTask(task.getId(), task.getName(), task.getUrl(), "30 2 * * *", 30).orElseThrow();
        executor.rescheduleTask(edited);

        JobInfo info = registry.find(TaskExecutor.SOURCE, name).orElseThrow();
        assertEquals("30 2 * * *", info.effectiveSchedule);
        assertFalse(info.overridden);
        assertTrue(overrides.row(TaskExecutor.SOURCE, name).isEmpty());
        assertEquals(1, engine.entries().size());
    }

    @Test
    void loadSchedulesActiveTasksAndSkipsBrokenOnes() throws Exception {
        store.createTask("first task", "https://example.com/a", "0 * * * *", 30, true);
        store.createTask("inactive task", "https://example.com/b", "0 * * * *", 30, false);
        store.createTask("never fires", "https://example.com/c", "0 0 30 2 *", 30, true);

        assertEquals(1, executor.loadAndScheduleAll());

        assertEquals(1, registry.list().size());
        assertEquals("task_1", registry.list().get(0).name);
    }

    @Test
    void loadUsesPersistedOverride() throws Exception {
        ScheduledTask task = task("https://example.com/health");
        overrides.put(TaskExecutor.SOURCE, TaskExecutor.taskName(task.getId()), "*/10 * * * *");

        executor.loadAndScheduleAll();

        assertEquals("*/10 * * * *", engine.entries().get(0).cron);
    }

    @Test
    void scheduledTaskRuns() throws Exception {
        ScheduledTask task = store.createTask("every second", "https://example.com/tick", "*/1 * * * * *", 30, true);
        executor.addTask(task);
        engine.start();

        TaskRun run = store.awaitCompletedRun(task.getId(), WAIT);
        assertEquals(TaskRun.Status.SUCCESS, run.status);
    }

    @Test
    void manualTriggerIsRateLimitedPerTask() throws Exception {
        ScheduledTask first = task("https://example.com/one");
        ScheduledTask second = task("https://example.com/two");

        executor.triggerTask(first.getId());
        RateLimitedException e = assertThrows(RateLimitedException.class, () -> executor.triggerTask(first.getId()));
        assertEquals("rate limit exceeded, try again in a few seconds", e.getMessage());
        executor.triggerTask(second.getId());

        ticker.advance(10, TimeUnit.SECONDS);
        executor.triggerTask(first.getId());

        store.awaitCompletedRun(second.getId(), WAIT);
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (store.listRuns(first.getId(), 10, 0).stream().filter(r -> r.completedAt != null).count() < 2) {
            assertTrue(System.nanoTime() < deadline, "two runs of the first task expected");
            Thread.sleep(10);
        }
    }

    @Test
    void triggerThroughRegistryUsesSameLimiter() throws Exception {
        ScheduledTask task = task("https://example.com/health");
        executor.addTask(task);
        String name = TaskExecutor.taskName(task.getId());

        registry.triggerNow(TaskExecutor.SOURCE, name);
        assertThrows(RateLimitedException.class, () -> registry.triggerNow(TaskExecutor.SOURCE, name));
        assertEquals(TaskRun.Status.SUCCESS, store.awaitCompletedRun(task.getId(), WAIT).status);
    }

    @Test
    void unknownTaskIsNotFoundEveryTime() {
        assertThrows(TaskNotFoundException.class, () -> executor.triggerTask(999));
        assertThrows(TaskNotFoundException.class, () -> executor.triggerTask(999));
        assertEquals(0, executor.limiterCount());
    }

    @Test
    void rescheduleKeepsTriggerLimit() throws Exception {
        ScheduledTask task = task("https://example.com/health");
        executor.addTask(task);

        executor.triggerTask(task.getId());
        executor.rescheduleTask(task);

        assertThrows(RateLimitedException.class, () -> executor.triggerTask(task.getId()));
        ticker.advance(10, TimeUnit.SECONDS);
        executor.triggerTask(task.getId());
    }

    @Test
    void disablingAndEnablingKeepsTriggerLimit() throws Exception {
        ScheduledTask task = task("https://example.com/health");
        executor.addTask(task);

        executor.triggerTask(task.getId());
        executor.removeTask(task.getId());
        executor.addTask(task);

        assertThrows(RateLimitedException.class, () -> executor.triggerTask(task.getId()));
    }

    @Test
    void deletingTaskDropsItsLimiter() throws Exception {
        ScheduledTask task = task("https://example.com/health");
        executor.addTask(task);
        executor.triggerTask(task.getId());
        assertEquals(1, executor.limiterCount());

        executor.deleteTask(task.getId());

        assertEquals(0, executor.limiterCount());
        assertTrue(registry.list().isEmpty());
        assertTrue(engine.entries().isEmpty());
    }

    @Test
    void triggerAfterShutdownIsUnavailable() {
        ScheduledTask task = task("https://example.com/health");
        engine.close();
        assertThrows(TriggerUnavailableException.class, () -> executor.triggerTask(task.getId()));
    }

    @Test
    void cleanupJobIsRegisteredAndTriggerable() throws Exception {
        assertTrue(executor.registerCleanupJob());

        JobInfo info = registry.find(TaskExecutor.SOURCE, TaskExecutor.CLEANUP_NAME).orElseThrow();
        assertEquals("Delete task runs older than 30 days", info.description);
        assertEquals("0 3 * * *", info.effectiveSchedule);
        assertTrue(info.canTrigger);

        registry.triggerNow(TaskExecutor.SOURCE, TaskExecutor.CLEANUP_NAME);
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (store.lastCleanupCutoff.get() == null) {
            assertTrue(System.nanoTime() < deadline, "cleanup did not run");
            Thread.sleep(10);
        }
        assertEquals(NOW.minus(Duration.ofDays(30)), store.lastCleanupCutoff.get());
    }

    @Test
    void cleanupJobWithBadScheduleIsNotRegistered() {
        SchedulerConfig bad = new SchedulerConfig.Builder().cleanupSchedule("whenever").build();
        TaskExecutor other = new TaskExecutor(store, registry, engine, guard, new OkHttpClient(), bad, ticker, clock);

        assertFalse(other.registerCleanupJob());
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void cleanupDeletesRunsPastRetention() throws Exception {
        store.createRun(1, NOW.minus(Duration.ofDays(40)));
        store.createRun(1, NOW.minus(Duration.ofDays(29)));

        new RunHistoryCleanupJob(store, engine, 30, clock).execute();

        List<TaskRun> left = store.allRuns();
        assertEquals(1, left.size());
        assertEquals(NOW.minus(Duration.ofDays(29)), left.get(0).startedAt);
    }
}
