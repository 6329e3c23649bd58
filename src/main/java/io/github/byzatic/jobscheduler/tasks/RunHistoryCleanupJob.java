package io.github.byzatic.jobscheduler.tasks;

import io.github.byzatic.jobscheduler.base_exceptions.JobRegistryException;
import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import io.github.byzatic.jobscheduler.base_exceptions.TriggerUnavailableException;
import io.github.byzatic.jobscheduler.cron.CronEngine;
import io.github.byzatic.jobscheduler.registry.JobCommand;
import io.github.byzatic.jobscheduler.registry.ManualTrigger;
import io.github.byzatic.jobscheduler.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes task runs older than the retention period. Manual triggers run it in the background.
 */
final class RunHistoryCleanupJob implements JobCommand, ManualTrigger {
    private final static Logger logger = LoggerFactory.getLogger(RunHistoryCleanupJob.class);

    private final TaskStore store;
    private final CronEngine engine;
    private final Duration retention;
    private final Clock clock;

    RunHistoryCleanupJob(TaskStore store, CronEngine engine, int retentionDays, Clock clock) {
        this.store = store;
        this.engine = engine;
        this.retention = Duration.ofDays(retentionDays);
        this.clock = clock;
    }

    @Override
    public void execute() {
        Instant cutoff = clock.instant().minus(retention);
        try {
            int deleted = store.deleteRunsOlderThan(cutoff);
            logger.info("Cleaned up {} task runs started before {}", deleted, cutoff);
        } catch (StorageException e) {
            logger.error("Failed to clean up old task runs", e);
        }
    }

    @Override
    public void trigger() throws JobRegistryException {
        try {
            engine.runNow(TaskExecutor.SOURCE + ":" + TaskExecutor.CLEANUP_NAME, token -> execute());
        } catch (IllegalStateException e) {
            throw new TriggerUnavailableException("scheduler is shut down", e);
        }
    }
}
