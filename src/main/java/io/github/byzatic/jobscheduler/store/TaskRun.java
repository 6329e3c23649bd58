package io.github.byzatic.jobscheduler.store;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * One execution of a {@link ScheduledTask}. Created before any network I/O and completed
 * exactly once; never changed afterwards.
 */
public final class TaskRun {
    public enum Status {PENDING, SUCCESS, FAILED}

    public final long id;
    public final long taskId;
    public final Status status;
    public final Instant startedAt;
    @Nullable public final Instant completedAt;
    @Nullable public final Integer statusCode;
    @Nullable public final String responseSummary;
    @Nullable public final String errorMessage;
    @Nullable public final Long durationMs;

    public TaskRun(long id, long taskId, @NotNull Status status, @NotNull Instant startedAt,
                   @Nullable Instant completedAt, @Nullable Integer statusCode, @Nullable String responseSummary,
                   @Nullable String errorMessage, @Nullable Long durationMs) {
        this.id = id;
        this.taskId = taskId;
        this.status = status;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.statusCode = statusCode;
        this.responseSummary = responseSummary;
        this.errorMessage = errorMessage;
        this.durationMs = durationMs;
    }

    @Override
    public String toString() {
        return "TaskRun{id=" + id + ", taskId=" + taskId + ", status=" + status + ", startedAt=" + startedAt +
                ", completedAt=" + completedAt + ", statusCode=" + statusCode +
                (errorMessage != null ? ", errorMessage='" + errorMessage + '\'' : "") + '}';
    }
}
