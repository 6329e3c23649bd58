package io.github.byzatic.jobscheduler;

import io.github.byzatic.jobscheduler.admin.SchedulerAdminService;
import io.github.byzatic.jobscheduler.base_exceptions.InvalidScheduleException;
import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import io.github.byzatic.jobscheduler.config.SchedulerConfig;
import io.github.byzatic.jobscheduler.cron.CronEngine;
import io.github.byzatic.jobscheduler.cron.CronScheduler;
import io.github.byzatic.jobscheduler.registry.JobCommand;
import io.github.byzatic.jobscheduler.registry.JobRegistry;
import io.github.byzatic.jobscheduler.registry.ManualTrigger;
import io.github.byzatic.jobscheduler.ssrf_guard.SafeHttpClientFactory;
import io.github.byzatic.jobscheduler.ssrf_guard.SsrfGuard;
import io.github.byzatic.jobscheduler.store.Database;
import io.github.byzatic.jobscheduler.store.JdbcOverrideStore;
import io.github.byzatic.jobscheduler.store.JdbcTaskStore;
import io.github.byzatic.jobscheduler.store.OverrideStore;
import io.github.byzatic.jobscheduler.store.TaskStore;
import io.github.byzatic.jobscheduler.tasks.TaskExecutor;
import okhttp3.OkHttpClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the scheduling core together. Construct one per process once the database is reachable,
 * pass the registry to every module that schedules jobs, and close it on shutdown.
 *
 * <pre>{@code
 * try (JobSchedulerRuntime runtime = JobSchedulerRuntime.create(SchedulerConfig.load())) {
 *     runtime.scheduleJob("core", "sitemap", "Rebuild sitemap", "0 * * * *", sitemap::rebuild, null);
 *     runtime.start();
 *     ...
 * }
 * }</pre>
 */
public final class JobSchedulerRuntime implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(JobSchedulerRuntime.class);

    private final CronEngine engine;
    private final JobRegistry registry;
    private final TaskStore taskStore;
    private final SsrfGuard guard;
    private final OkHttpClient httpClient;
    private final TaskExecutor taskExecutor;
    private final SchedulerAdminService adminService;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public JobSchedulerRuntime(@NotNull SchedulerConfig config, @NotNull OverrideStore overrideStore,
                               @NotNull TaskStore taskStore, @NotNull CronEngine engine,
                               @NotNull SsrfGuard guard, @NotNull OkHttpClient httpClient) {
        Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.taskStore = Objects.requireNonNull(taskStore, "taskStore");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.registry = new JobRegistry(overrideStore);
        this.taskExecutor = new TaskExecutor(taskStore, registry, engine, guard, httpClient, config);
        this.adminService = new SchedulerAdminService(registry, taskExecutor, taskStore, guard);
    }

    /**
     * Default wiring: JDBC stores on {@link SchedulerConfig#getDatabaseUrl()}, a {@link CronScheduler}
     * and the SSRF-guarded HTTP client.
     */
    public static @NotNull JobSchedulerRuntime create(@NotNull SchedulerConfig config) {
        Database database = new Database(config.getDatabaseUrl());
        SsrfGuard guard = new SsrfGuard();
        CronEngine engine = new CronScheduler.Builder()
                .grace(config.getEngineGrace())
                .build();
        return new JobSchedulerRuntime(config, new JdbcOverrideStore(database), new JdbcTaskStore(database),
                engine, guard, SafeHttpClientFactory.create(guard, config));
    }

    /**
     * Loads and schedules stored tasks, registers the run cleanup job and starts the engine.
     *
     * @throws StorageException if the task tables cannot be created or read
     */
    public void start() throws StorageException {
        if (!started.compareAndSet(false, true)) return;
        taskStore.ensureSchema();
        taskExecutor.loadAndScheduleAll();
        taskExecutor.registerCleanupJob();
        engine.start();
        logger.info("Job scheduler started with {} jobs", registry.list().size());
    }

    /**
     * Schedules a job with its effective schedule (override or default) and registers it.
     *
     * @param trigger manual trigger, {@code null} if the job cannot be triggered on demand
     * @return the engine entry id
     * @throws InvalidScheduleException if the engine rejects the effective schedule
     */
    public @NotNull UUID scheduleJob(@NotNull String source, @NotNull String name, @NotNull String description,
                                     @NotNull String defaultSchedule, @NotNull JobCommand command,
                                     @Nullable ManualTrigger trigger) throws InvalidScheduleException {
        String schedule = registry.getEffectiveSchedule(source, name, defaultSchedule);
        UUID entryId;
        try {
            entryId = engine.addJob(schedule, token -> command.execute());
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new InvalidScheduleException(
                    "cannot schedule " + source + ":" + name + " with '" + schedule + "': " + e.getMessage(), e);
        }
        registry.register(source, name, description, defaultSchedule, engine, entryId, command, trigger);
        return entryId;
    }

    public @NotNull JobRegistry getRegistry() {
        return registry;
    }

    public @NotNull TaskExecutor getTaskExecutor() {
        return taskExecutor;
    }

    public @NotNull SchedulerAdminService getAdminService() {
        return adminService;
    }

    public @NotNull SsrfGuard getGuard() {
        return guard;
    }

    /**
     * Stops the engine and releases the HTTP client. Running jobs get the configured grace period
     * before they are interrupted.
     */
    @Override
    public void close() {
        engine.close();
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        logger.info("Job scheduler stopped");
    }
}
