package io.github.byzatic.jobscheduler.cron;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Wall-clock scheduler with runtime add/remove of entries.
 * Entries are addressed by the id returned from {@link #addJob}; the engine holds no reference
 * back to whoever registered them.
 */
public interface CronEngine extends AutoCloseable {
    /**
     * @throws IllegalArgumentException if the expression is invalid or never fires
     * @throws IllegalStateException    if the engine is closed
     */
    @NotNull UUID addJob(@NotNull String cron, @NotNull CronTask task);

    @NotNull UUID addJob(@NotNull String cron, @NotNull CronTask task, boolean disallowOverlap);

    /**
     * Unschedules the entry and asks a running instance to stop. Does not wait for it.
     *
     * @return false if the entry is unknown
     */
    boolean removeJob(@NotNull UUID jobId);

    @NotNull Optional<EntryInfo> entry(@NotNull UUID jobId);

    @NotNull List<EntryInfo> entries();

    /**
     * Fire-and-forget execution on the engine's worker pool, outside any schedule.
     *
     * @throws IllegalStateException if the engine is closed
     */
    void runNow(@NotNull String label, @NotNull CronTask task);

    void start();

    @Override
    void close();
}
