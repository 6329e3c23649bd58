package io.github.byzatic.jobscheduler.registry;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobscheduler.base_exceptions.CriticalRescheduleFailureException;
import io.github.byzatic.jobscheduler.base_exceptions.InvalidScheduleException;
import io.github.byzatic.jobscheduler.base_exceptions.JobNotFoundException;
import io.github.byzatic.jobscheduler.base_exceptions.JobRegistryException;
import io.github.byzatic.jobscheduler.base_exceptions.RescheduleFailedException;
import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import io.github.byzatic.jobscheduler.base_exceptions.TriggerUnavailableException;
import io.github.byzatic.jobscheduler.cron.CronEngine;
import io.github.byzatic.jobscheduler.cron.CronExpr;
import io.github.byzatic.jobscheduler.cron.CronTask;
import io.github.byzatic.jobscheduler.store.OverrideStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Catalog of every scheduled job, keyed by {@code source:name}.
 * <p>
 * The registry never schedules a job on registration: callers add the engine entry first
 * (using {@link #getEffectiveSchedule} for the cadence) and then hand the entry id over.
 * Schedule changes afterwards go through the registry, which swaps the engine entry and
 * persists the override. A failed swap is rolled back to the previous schedule.
 * <p>
 * Reads share a lock; registration and schedule changes hold the write lock for the whole
 * remove, add and persist sequence.
 */
@ThreadSafe
public class JobRegistry {
    private final static Logger logger = LoggerFactory.getLogger(JobRegistry.class);

    private static final Comparator<JobInfo> ORDER =
            Comparator.comparing((JobInfo i) -> i.source).thenComparing(i -> i.name);

    private final OverrideStore overrides;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @GuardedBy("lock")
    private final Map<JobKey, RegisteredJob> jobs = new HashMap<>();

    /**
     * Creates the override table if it is missing. A failure there is logged; lookups then fall
     * back to default schedules.
     */
    public JobRegistry(@NotNull OverrideStore overrides) {
        this.overrides = Objects.requireNonNull(overrides, "overrides");
        try {
            overrides.ensureSchema();
        } catch (StorageException e) {
            logger.error("Failed to create schedule override table", e);
        }
    }

    /**
     * @return the persisted override for the job, or {@code defaultSchedule} if there is none
     * or the store cannot be read
     */
    public @NotNull String getEffectiveSchedule(@NotNull String source, @NotNull String name, @NotNull String defaultSchedule) {
        try {
            Optional<String> override = overrides.getOverride(source, name);
            if (override.isPresent() && !override.get().isBlank()) {
                return override.get();
            }
        } catch (StorageException e) {
            logger.error("Failed to read schedule override of {}:{}, using default '{}'", source, name, defaultSchedule, e);
        }
        return defaultSchedule;
    }

    /**
     * Records a job that the caller has already added to {@code engine}.
     * Registering an existing key replaces the record; its old engine entry is removed.
     *
     * @param entryId engine entry of the job, {@code null} if it is not scheduled
     * @param trigger manual trigger, {@code null} if the job cannot be triggered on demand
     */
    public void register(@NotNull String source, @NotNull String name, @NotNull String description,
                         @NotNull String defaultSchedule, @NotNull CronEngine engine, @Nullable UUID entryId,
                         @NotNull JobCommand command, @Nullable ManualTrigger trigger) {
        JobKey key = new JobKey(source, name);
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(defaultSchedule, "defaultSchedule");
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(command, "command");

        lock.writeLock().lock();
        try {
            String effective = getEffectiveSchedule(source, name, defaultSchedule);
            RegisteredJob previous = jobs.put(key,
                    new RegisteredJob(key, description, defaultSchedule, effective, engine, entryId, command, trigger));

            if (previous != null) {
                logger.warn("Job {} registered again, replacing the previous registration", key);
                if (previous.entryId != null && !(previous.engine == engine && previous.entryId.equals(entryId))) {
                    previous.engine.removeJob(previous.entryId);
                }
            }
            logger.debug("Registered job {} with schedule '{}'", key, effective);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return every job sorted by source, then name
     */
    public @NotNull List<JobInfo> list() {
        List<JobInfo> out;
        lock.readLock().lock();
        try {
            out = new ArrayList<>(jobs.size());
            for (RegisteredJob job : jobs.values()) {
                out.add(job.snapshot());
            }
        } finally {
            lock.readLock().unlock();
        }
        out.sort(ORDER);
        return out;
    }

    public @NotNull Optional<JobInfo> find(@NotNull String source, @NotNull String name) {
        lock.readLock().lock();
        try {
            RegisteredJob job = jobs.get(new JobKey(source, name));
            return job == null ? Optional.empty() : Optional.of(job.snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Invokes the job's manual trigger on the caller's thread and propagates its failure.
     *
     * @throws JobNotFoundException        if no such job is registered
     * @throws TriggerUnavailableException if the job has no manual trigger
     */
    public void triggerNow(@NotNull String source, @NotNull String name) throws JobRegistryException {
        JobKey key = new JobKey(source, name);
        ManualTrigger trigger;
        lock.readLock().lock();
        try {
            RegisteredJob job = jobs.get(key);
            if (job == null) {
                throw new JobNotFoundException("job not found: " + key);
            }
            trigger = job.trigger;
        } finally {
            lock.readLock().unlock();
        }

        if (trigger == null) {
            throw new TriggerUnavailableException("manual trigger not available for: " + key);
        }
        logger.info("Manually triggering job {}", key);
        trigger.trigger();
    }

    /**
     * Replaces the job's schedule and persists it as an override. A failure to persist is logged;
     * the new schedule is live regardless.
     *
     * @throws JobNotFoundException               if no such job is registered
     * @throws InvalidScheduleException           if {@code newSchedule} is not a cron expression; nothing changes
     * @throws RescheduleFailedException          if the engine rejected the new schedule; the previous one is back
     * @throws CriticalRescheduleFailureException if the previous schedule could not be restored either
     */
    public void updateSchedule(@NotNull String source, @NotNull String name, @NotNull String newSchedule) throws JobRegistryException {
        JobKey key = new JobKey(source, name);
        lock.writeLock().lock();
        try {
            RegisteredJob job = jobs.get(key);
            if (job == null) {
                throw new JobNotFoundException("job not found: " + key);
            }
            try {
                CronExpr.parseStandard(newSchedule);
            } catch (IllegalArgumentException e) {
                throw new InvalidScheduleException("invalid cron expression '" + newSchedule + "': " + e.getMessage(), e);
            }

            reschedule(job, newSchedule);

            try {
                if (newSchedule.equals(job.defaultSchedule)) {
                    overrides.deleteOverride(source, name);
                } else {
                    overrides.upsertOverride(source, name, newSchedule);
                }
            } catch (StorageException e) {
                logger.error("Failed to persist schedule override of {}", key, e);
            }
            logger.info("Updated schedule of {} to '{}'", key, newSchedule);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the job to its default schedule and deletes the override. A job already on its
     * default schedule is left alone.
     *
     * @throws JobNotFoundException               if no such job is registered
     * @throws RescheduleFailedException          if the engine rejected the default schedule
     * @throws CriticalRescheduleFailureException if the previous schedule could not be restored either
     */
    public void resetSchedule(@NotNull String source, @NotNull String name) throws JobRegistryException {
        JobKey key = new JobKey(source, name);
        lock.writeLock().lock();
        try {
            RegisteredJob job = jobs.get(key);
            if (job == null) {
                throw new JobNotFoundException("job not found: " + key);
            }
            if (job.effectiveSchedule.equals(job.defaultSchedule)) {
                return;
            }

            reschedule(job, job.defaultSchedule);

            try {
                overrides.deleteOverride(source, name);
            } catch (StorageException e) {
                logger.error("Failed to delete schedule override of {}", key, e);
            }
            logger.info("Reset schedule of {} to default '{}'", key, job.defaultSchedule);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the job's engine entry, its record and its override. Unknown keys are ignored.
     */
    public void unregister(@NotNull String source, @NotNull String name) {
        JobKey key = new JobKey(source, name);
        lock.writeLock().lock();
        try {
            RegisteredJob job = jobs.remove(key);
            if (job == null) return;

            if (job.entryId != null) {
                job.engine.removeJob(job.entryId);
            }
            try {
                overrides.deleteOverride(source, name);
            } catch (StorageException e) {
                logger.error("Failed to delete schedule override of {} on unregister", key, e);
            }
            logger.debug("Unregistered job {}", key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @GuardedBy("lock")
    private void reschedule(RegisteredJob job, String schedule) throws JobRegistryException {
        String previous = job.effectiveSchedule;
        if (job.entryId != null) {
            job.engine.removeJob(job.entryId);
            job.entryId = null;
        }

        try {
            job.entryId = job.engine.addJob(schedule, asCronTask(job.command));
        } catch (RuntimeException addFailure) {
            try {
                job.entryId = job.engine.addJob(previous, asCronTask(job.command));
            } catch (RuntimeException rollbackFailure) {
                CriticalRescheduleFailureException critical = new CriticalRescheduleFailureException(
                        "critical: failed to restore schedule '" + previous + "' of " + job.key +
                                " after update failure; the job is not scheduled",
                        rollbackFailure, addFailure);
                logger.error("Job {} lost its schedule", job.key, critical);
                throw critical;
            }
            throw new RescheduleFailedException(
                    "failed to apply schedule '" + schedule + "' to " + job.key + ": " + addFailure.getMessage(), addFailure);
        }
        job.effectiveSchedule = schedule;
    }

    private static CronTask asCronTask(JobCommand command) {
        return token -> command.execute();
    }
}
