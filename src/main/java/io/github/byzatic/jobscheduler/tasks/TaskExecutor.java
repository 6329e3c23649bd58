package io.github.byzatic.jobscheduler.tasks;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.base.Ticker;
import com.google.common.io.ByteStreams;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobscheduler.base_exceptions.InvalidScheduleException;
import io.github.byzatic.jobscheduler.base_exceptions.JobRegistryException;
import io.github.byzatic.jobscheduler.base_exceptions.RateLimitedException;
import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import io.github.byzatic.jobscheduler.base_exceptions.TaskNotFoundException;
import io.github.byzatic.jobscheduler.base_exceptions.TriggerUnavailableException;
import io.github.byzatic.jobscheduler.config.SchedulerConfig;
import io.github.byzatic.jobscheduler.cron.CronEngine;
import io.github.byzatic.jobscheduler.registry.JobRegistry;
import io.github.byzatic.jobscheduler.ssrf_guard.SsrfGuard;
import io.github.byzatic.jobscheduler.ssrf_guard.UrlRejectedException;
import io.github.byzatic.jobscheduler.store.ScheduledTask;
import io.github.byzatic.jobscheduler.store.TaskStore;
import io.github.byzatic.jobscheduler.token_bucket_limiter.Limiter;
import io.github.byzatic.jobscheduler.token_bucket_limiter.SimpleTokenBucketLimiter;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Schedules user-defined HTTP polling tasks and records the outcome of every run.
 * <p>
 * Each task is added to the {@link CronEngine} and registered with the {@link JobRegistry} as
 * {@code task:task_<id>}, so its schedule can be overridden like any other job. Runs issue a
 * single GET through the SSRF-guarded client and store only a {@code content-type (n bytes)}
 * summary of the response.
 */
@ThreadSafe
public class TaskExecutor {
    private final static Logger logger = LoggerFactory.getLogger(TaskExecutor.class);

    public static final String SOURCE = "task";
    public static final String CLEANUP_NAME = "cleanup";

    private final TaskStore store;
    private final JobRegistry registry;
    private final CronEngine engine;
    private final SsrfGuard guard;
    private final OkHttpClient client;
    private final SchedulerConfig config;
    private final Ticker ticker;
    private final Clock clock;

    private final Object lock = new Object();
    @GuardedBy("lock")
    private final Map<Long, UUID> taskEntries = new HashMap<>();
    @GuardedBy("lock")
    private final Map<Long, Limiter> triggerLimiters = new HashMap<>();

    /**
     * @param client HTTP client for task requests, normally built by
     *               {@link io.github.byzatic.jobscheduler.ssrf_guard.SafeHttpClientFactory}
     */
    public TaskExecutor(@NotNull TaskStore store, @NotNull JobRegistry registry, @NotNull CronEngine engine,
                        @NotNull SsrfGuard guard, @NotNull OkHttpClient client, @NotNull SchedulerConfig config) {
        this(store, registry, engine, guard, client, config, Ticker.systemTicker(), Clock.systemUTC());
    }

    TaskExecutor(TaskStore store, JobRegistry registry, CronEngine engine, SsrfGuard guard, OkHttpClient client,
                 SchedulerConfig config, Ticker ticker, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.client = Objects.requireNonNull(client, "client");
        this.config = Objects.requireNonNull(config, "config");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @VisibleForTesting
    int limiterCount() {
        synchronized (lock) {
            return triggerLimiters.size();
        }
    }

    public static @NotNull String taskName(long taskId) {
        return "task_" + taskId;
    }

    /**
     * Schedules every active task. A task that cannot be scheduled is logged and skipped.
     *
     * @return number of tasks scheduled
     * @throws StorageException if the task list cannot be read
     */
    public int loadAndScheduleAll() throws StorageException {
        List<ScheduledTask> tasks = store.listActiveTasks();
        int scheduled = 0;
        for (ScheduledTask task : tasks) {
            try {
                scheduleTask(task);
                scheduled++;
            } catch (InvalidScheduleException e) {
                logger.error("Failed to schedule task {} ('{}')", task.getId(), task.getName(), e);
            }
        }
        if (!tasks.isEmpty()) {
            logger.info("Loaded {} of {} scheduled tasks", scheduled, tasks.size());
        }
        return scheduled;
    }

    /**
     * @throws InvalidScheduleException if the engine rejects the task's effective schedule
     */
    public void addTask(@NotNull ScheduledTask task) throws InvalidScheduleException {
        scheduleTask(task);
    }

    /**
     * Unschedules the task and unregisters it, which also drops its schedule override. The
     * task's trigger limiter is kept, so disabling or editing a task does not reset it.
     */
    public void removeTask(long taskId) {
        UUID entryId;
        synchronized (lock) {
            entryId = taskEntries.remove(taskId);
        }
        if (entryId != null) {
            engine.removeJob(entryId);
        }
        registry.unregister(SOURCE, taskName(taskId));
    }

    /**
     * Removes a task that is being deleted for good, together with its trigger limiter.
     */
    public void deleteTask(long taskId) {
        removeTask(taskId);
        synchronized (lock) {
            triggerLimiters.remove(taskId);
        }
    }

    /**
     * Replaces the engine entry of an edited task. The task returns to its own schedule.
     */
    public void rescheduleTask(@NotNull ScheduledTask task) throws InvalidScheduleException {
        removeTask(task.getId());
        scheduleTask(task);
    }

    /**
     * Runs the task now, in the background. Allowed once per trigger interval per task.
     *
     * @throws RateLimitedException        if the task was triggered too recently
     * @throws TaskNotFoundException       if no such task is stored
     * @throws TriggerUnavailableException if the engine is shut down
     * @throws JobRegistryException        if the task cannot be read
     */
    public void triggerTask(long taskId) throws JobRegistryException {
        Optional<ScheduledTask> task;
        try {
            task = store.getTask(taskId);
        } catch (StorageException e) {
            throw new JobRegistryException("failed to load task " + taskId, e);
        }
        if (task.isEmpty()) {
            throw new TaskNotFoundException("task not found: " + taskId);
        }

        // limiters exist only for stored tasks
        Limiter limiter;
        synchronized (lock) {
            limiter = triggerLimiters.computeIfAbsent(taskId,
                    id -> new SimpleTokenBucketLimiter(1, config.getTriggerInterval(), ticker));
        }
        if (!limiter.tryAcquire()) {
            throw new RateLimitedException("rate limit exceeded, try again in a few seconds");
        }

        ScheduledTask target = task.get();
        try {
            engine.runNow(SOURCE + ":" + taskName(taskId), token -> executeTask(target));
        } catch (IllegalStateException e) {
            throw new TriggerUnavailableException("scheduler is shut down", e);
        }
        logger.info("Triggered task {} ('{}')", taskId, target.getName());
    }

    /**
     * Performs one run of the task and records it. Never throws; every failure ends up in the
     * run history.
     */
    public void executeTask(@NotNull ScheduledTask task) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        long runId;
        try {
            runId = store.createRun(task.getId(), startedAt);
        } catch (StorageException e) {
            logger.error("Failed to create run record for task {}", task.getId(), e);
            return;
        }

        // the host may resolve differently now than when the task was saved
        HttpUrl url;
        try {
            url = guard.validateUrl(task.getUrl());
        } catch (UrlRejectedException e) {
            recordFailure(task, runId, startNanos, "SSRF protection: " + e.getMessage());
            return;
        }

        Duration timeout = task.getTimeoutSeconds() > 0
                ? Duration.ofSeconds(task.getTimeoutSeconds())
                : config.getDefaultTaskTimeout();

        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", config.getUserAgent())
                .get()
                .build();
        Call call = client.newCall(request);
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);

        int statusCode;
        String summary;
        try (Response response = call.execute()) {
            byte[] body;
            try {
                body = readCapped(response.body());
            } catch (IOException e) {
                recordFailure(task, runId, startNanos, "failed to read response: " + describe(e));
                return;
            }
            String contentType = response.header("Content-Type");
            statusCode = response.code();
            summary = (Strings.isNullOrEmpty(contentType) ? "unknown" : contentType) + " (" + body.length + " bytes)";
        } catch (IOException | RuntimeException e) {
            recordFailure(task, runId, startNanos, "request failed: " + describe(e));
            return;
        }

        long durationMs = elapsedMillis(startNanos);
        try {
            store.finalizeRunSuccess(runId, statusCode, summary, durationMs, clock.instant());
        } catch (StorageException e) {
            logger.error("Failed to record success of run {}", runId, e);
        }
        logger.debug("Task {} ('{}') executed: status {}, {} ms", task.getId(), task.getName(), statusCode, durationMs);
    }

    /**
     * Registers the daily job that prunes old task runs. Its schedule can be overridden like any other job.
     *
     * @return false if the engine rejected the schedule
     */
    public boolean registerCleanupJob() {
        String defaultSchedule = config.getCleanupSchedule();
        String schedule = registry.getEffectiveSchedule(SOURCE, CLEANUP_NAME, defaultSchedule);
        RunHistoryCleanupJob job = new RunHistoryCleanupJob(store, engine, config.getRunRetentionDays(), clock);

        UUID entryId;
        try {
            entryId = engine.addJob(schedule, token -> job.execute());
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error("Failed to register task run cleanup job with schedule '{}'", schedule, e);
            return false;
        }

        registry.register(SOURCE, CLEANUP_NAME,
                "Delete task runs older than " + config.getRunRetentionDays() + " days",
                defaultSchedule, engine, entryId, job, job);
        logger.info("Task run cleanup job registered with schedule '{}', retention {} days",
                schedule, config.getRunRetentionDays());
        return true;
    }

    private void scheduleTask(ScheduledTask task) throws InvalidScheduleException {
        String name = taskName(task.getId());
        String schedule = registry.getEffectiveSchedule(SOURCE, name, task.getSchedule());
        TaskJob job = new TaskJob(this, task);

        UUID entryId;
        try {
            entryId = engine.addJob(schedule, token -> job.execute());
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new InvalidScheduleException(
                    "invalid schedule '" + schedule + "' for task '" + task.getName() + "': " + e.getMessage(), e);
        }

        UUID replaced;
        synchronized (lock) {
            replaced = taskEntries.put(task.getId(), entryId);
        }
        if (replaced != null) {
            engine.removeJob(replaced);
        }

        registry.register(SOURCE, name, task.getName() + ": GET " + task.getUrl(), task.getSchedule(),
                engine, entryId, job, job);
    }

    private byte[] readCapped(ResponseBody body) throws IOException {
        if (body == null) return new byte[0];
        try (InputStream in = body.byteStream()) {
            return ByteStreams.toByteArray(ByteStreams.limit(in, config.getMaxResponseBytes()));
        }
    }

    private void recordFailure(ScheduledTask task, long runId, long startNanos, String message) {
        long durationMs = elapsedMillis(startNanos);
        try {
            store.finalizeRunFailure(runId, message, durationMs, clock.instant());
        } catch (StorageException e) {
            logger.error("Failed to record failure of run {}", runId, e);
        }
        logger.warn("Task {} ('{}') run {} failed: {}", task.getId(), task.getName(), runId, message);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
