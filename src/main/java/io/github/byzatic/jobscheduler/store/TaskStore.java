package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * User-defined polling tasks and their run history.
 */
public interface TaskStore {
    void ensureSchema() throws StorageException;

    // ---- tasks ----

    @NotNull List<ScheduledTask> listActiveTasks() throws StorageException;

    @NotNull List<ScheduledTask> listTasks() throws StorageException;

    @NotNull Optional<ScheduledTask> getTask(long id) throws StorageException;

    @NotNull ScheduledTask createTask(@NotNull String name, @NotNull String url, @NotNull String schedule,
                                      long timeoutSeconds, boolean active) throws StorageException;

    @NotNull Optional<ScheduledTask> updateTask(long id, @NotNull String name, @NotNull String url,
                                                @NotNull String schedule, long timeoutSeconds) throws StorageException;

    @NotNull Optional<ScheduledTask> setTaskActive(long id, boolean active) throws StorageException;

    /**
     * Deletes the task together with its run history.
     *
     * @return false if no such task existed
     */
    boolean deleteTask(long id) throws StorageException;

    // ---- runs ----

    /**
     * @return id of the new run record
     */
    long createRun(long taskId, @NotNull Instant startedAt) throws StorageException;

    /**
     * Completes a pending run. A run that is already completed is left untouched.
     */
    void finalizeRunSuccess(long runId, int statusCode, @NotNull String summary, long durationMs,
                            @NotNull Instant completedAt) throws StorageException;

    void finalizeRunFailure(long runId, @NotNull String errorMessage, long durationMs,
                            @NotNull Instant completedAt) throws StorageException;

    @NotNull Optional<TaskRun> getRun(long runId) throws StorageException;

    /**
     * Most recent first.
     */
    @NotNull List<TaskRun> listRuns(long taskId, int limit, int offset) throws StorageException;

    long countRuns(long taskId) throws StorageException;

    /**
     * @return number of deleted runs
     */
    int deleteRunsOlderThan(@NotNull Instant cutoff) throws StorageException;

    /**
     * @return the latest run of the task, if any
     */
    default @Nullable TaskRun lastRun(long taskId) throws StorageException {
        List<TaskRun> runs = listRuns(taskId, 1, 0);
        return runs.isEmpty() ? null : runs.get(0);
    }
}
