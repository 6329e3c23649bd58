package io.github.byzatic.jobscheduler.cron;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CronScheduler
 * - Scheduling via cron (5 or 6 fields, or a descriptor such as {@code @daily})
 * - Configurable ThreadPoolExecutor; fired entries run concurrently
 * - Add/remove entries at runtime, live next/previous fire time per entry
 * - Soft stop via CancellationToken on remove and close
 * - Optional protection against parallel runs of the same entry (disallowOverlap)
 * <p>
 * Entries added before {@link #start()} are queued and fire once the dispatcher runs.
 */
@ThreadSafe
public final class CronScheduler implements CronEngine {
    private final static Logger logger = LoggerFactory.getLogger(CronScheduler.class);

    private final ThreadPoolExecutor executor;
    private final ZoneId zone;
    private final long graceMillis;
    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
    private final Map<UUID, JobRecord> jobs = new ConcurrentHashMap<>();
    private final Thread dispatcher;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private CronScheduler(ThreadPoolExecutor executor, ZoneId zone, long graceMillis) {
        this.executor = executor;
        this.zone = zone;
        this.graceMillis = graceMillis;

        this.dispatcher = new Thread(this::dispatchLoop, "cron-dispatcher");
        this.dispatcher.setDaemon(true);
    }

    public static final class Builder {
        private ThreadPoolExecutor executor;
        private ZoneId zone = ZoneId.systemDefault();
        private long graceMillis = 10_000; // 10s

        /**
         * Provide your own custom thread pool.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone);
            return this;
        }

        /**
         * How long {@link #close()} waits for running entries before interrupting them.
         */
        public Builder grace(Duration grace) {
            this.graceMillis = Objects.requireNonNull(grace).toMillis();
            return this;
        }

        public CronScheduler build() {
            if (executor == null) {
                AtomicInteger counter = new AtomicInteger();
                executor = new ThreadPoolExecutor(
                        Math.max(2, Runtime.getRuntime().availableProcessors()),
                        Math.max(4, Runtime.getRuntime().availableProcessors() * 2),
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        r -> {
                            Thread t = new Thread(r, "cron-exec-" + counter.incrementAndGet());
                            t.setDaemon(false);
                            t.setUncaughtExceptionHandler((th, ex) ->
                                    logger.error("Uncaught exception in {}", th.getName(), ex));
                            return t;
                        },
                        new ThreadPoolExecutor.CallerRunsPolicy()
                );
                executor.allowCoreThreadTimeOut(true);
            }
            return new CronScheduler(executor, zone, graceMillis);
        }
    }

    // ======== Public API ========

    @Override
    public @NotNull UUID addJob(@NotNull String cron, @NotNull CronTask task) {
        return addJob(cron, task, false);
    }

    @Override
    public @NotNull UUID addJob(@NotNull String cron, @NotNull CronTask task, boolean disallowOverlap) {
        Objects.requireNonNull(cron);
        Objects.requireNonNull(task);
        if (closed.get()) throw new IllegalStateException("Cron engine is closed");

        CronExpr expr = CronExpr.parse(cron);
        Instant first = expr.next(Instant.now(), zone)
                .orElseThrow(() -> new IllegalArgumentException("Cron has no future fire time: " + cron));

        UUID id = UUID.randomUUID();
        JobRecord rec = new JobRecord(id, expr, task, disallowOverlap);
        jobs.put(id, rec);
        enqueue(rec, first);
        logger.trace("Added entry {} with cron '{}', first fire at {}", id, cron, first);
        return id;
    }

    @Override
    public boolean removeJob(@NotNull UUID jobId) {
        JobRecord rec = jobs.remove(jobId);
        if (rec == null) return false;
        rec.removed.set(true);
        rec.nextFire = null;
        CancellationToken token = rec.tokenRef.get();
        if (token != null) token.requestStop("Removed");
        logger.trace("Removed entry {}", jobId);
        return true;
    }

    @Override
    public @NotNull Optional<EntryInfo> entry(@NotNull UUID jobId) {
        JobRecord r = jobs.get(jobId);
        if (r == null) return Optional.empty();
        return Optional.of(r.snapshot());
    }

    @Override
    public @NotNull List<EntryInfo> entries() {
        List<EntryInfo> out = new ArrayList<>();
        for (JobRecord r : jobs.values()) out.add(r.snapshot());
        return out;
    }

    @Override
    public void runNow(@NotNull String label, @NotNull CronTask task) {
        Objects.requireNonNull(task);
        if (closed.get()) throw new IllegalStateException("Cron engine is closed");
        CancellationToken token = new CancellationToken();
        try {
            executor.execute(() -> {
                try {
                    task.run(token);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                } catch (Throwable ex) {
                    logger.error("Immediate run '{}' failed", label, ex);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Cron engine rejected immediate run: " + label, e);
        }
    }

    @Override
    public void start() {
        if (closed.get()) throw new IllegalStateException("Cron engine is closed");
        if (started.compareAndSet(false, true)) {
            dispatcher.start();
            logger.debug("Cron engine started with {} entries", jobs.size());
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        dispatcher.interrupt();
        for (JobRecord rec : jobs.values()) {
            rec.removed.set(true);
            CancellationToken token = rec.tokenRef.get();
            if (token != null) token.requestStop("Scheduler closing");
        }
        jobs.clear();
        queue.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        logger.debug("Cron engine stopped");
    }

    // ======== Internal ========

    private void enqueue(JobRecord rec, Instant at) {
        rec.nextFire = at;
        queue.offer(new ScheduledEntry(rec.id, at.toEpochMilli()));
    }

    private void dispatchLoop() {
        while (!closed.get()) {
            try {
                ScheduledEntry entry = queue.take(); // blocks until the trigger time
                JobRecord rec = jobs.get(entry.jobId);
                if (rec == null || rec.removed.get()) continue;

                Instant firedAt = Instant.ofEpochMilli(entry.triggerAtMillis);
                // skip this tick if the previous run is still going and overlap is not allowed
                if (!(rec.disallowOverlap && rec.isRunning.get())) {
                    rec.prevFire = firedAt;
                    submitRun(rec);
                }

                Instant next = rec.cron.next(firedAt.isAfter(Instant.now()) ? firedAt : Instant.now(), zone).orElse(null);
                if (next != null && !rec.removed.get()) {
                    enqueue(rec, next);
                } else {
                    rec.nextFire = null;
                }
            } catch (InterruptedException ie) {
                if (closed.get()) break;
            } catch (Throwable t) {
                logger.error("Cron dispatcher error", t);
            }
        }
    }

    private void submitRun(JobRecord rec) {
        if (rec.disallowOverlap && !rec.isRunning.compareAndSet(false, true)) return;

        CancellationToken token = new CancellationToken();
        rec.tokenRef.set(token);

        Runnable wrapper = () -> {
            rec.state = JobState.RUNNING;
            try {
                rec.task.run(token);
                rec.lastError = null;
                if (token.isStopRequested()) {
                    rec.state = JobState.CANCELLED;
                    logger.debug("Cron entry {} stopped early: {}", rec.id, token.reason());
                } else {
                    rec.state = JobState.COMPLETED;
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                rec.state = JobState.CANCELLED;
            } catch (Throwable ex) {
                rec.state = JobState.FAILED;
                rec.lastError = String.valueOf(ex);
                logger.error("Cron entry {} ('{}') failed", rec.id, rec.cron, ex);
            } finally {
                rec.tokenRef.compareAndSet(token, null);
                if (rec.disallowOverlap) rec.isRunning.set(false);
            }
        };

        try {
            executor.execute(wrapper);
        } catch (RejectedExecutionException e) {
            if (rec.disallowOverlap) rec.isRunning.set(false);
            logger.warn("Cron entry {} rejected by executor", rec.id);
        }
    }
}
