package io.github.byzatic.jobscheduler.admin;

import io.github.byzatic.jobscheduler.admin.AdminResult.Kind;
import io.github.byzatic.jobscheduler.base_exceptions.InvalidScheduleException;
import io.github.byzatic.jobscheduler.base_exceptions.JobNotFoundException;
import io.github.byzatic.jobscheduler.base_exceptions.JobRegistryException;
import io.github.byzatic.jobscheduler.base_exceptions.RateLimitedException;
import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import io.github.byzatic.jobscheduler.base_exceptions.TaskNotFoundException;
import io.github.byzatic.jobscheduler.base_exceptions.TriggerUnavailableException;
import io.github.byzatic.jobscheduler.cron.CronExpr;
import io.github.byzatic.jobscheduler.registry.JobInfo;
import io.github.byzatic.jobscheduler.registry.JobRegistry;
import io.github.byzatic.jobscheduler.ssrf_guard.SsrfGuard;
import io.github.byzatic.jobscheduler.ssrf_guard.UrlRejectedException;
import io.github.byzatic.jobscheduler.store.ScheduledTask;
import io.github.byzatic.jobscheduler.store.TaskRun;
import io.github.byzatic.jobscheduler.store.TaskStore;
import io.github.byzatic.jobscheduler.tasks.TaskExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for admin-facing layers. Every operation returns an {@link AdminResult} whose
 * {@link Kind} separates missing jobs or tasks, bad input, rate limiting and internal failures,
 * so callers can render a message without inspecting exceptions.
 */
public class SchedulerAdminService {
    private final static Logger logger = LoggerFactory.getLogger(SchedulerAdminService.class);

    static final int NAME_MIN_LENGTH = 3;
    static final int NAME_MAX_LENGTH = 100;
    static final int URL_MAX_LENGTH = 2048;
    static final long TIMEOUT_MIN_SECONDS = 1;
    static final long TIMEOUT_MAX_SECONDS = 300;
    static final long TIMEOUT_DEFAULT_SECONDS = 30;
    static final int RUNS_PER_PAGE = 20;

    private final JobRegistry registry;
    private final TaskExecutor executor;
    private final TaskStore tasks;
    private final SsrfGuard guard;

    public SchedulerAdminService(@NotNull JobRegistry registry, @NotNull TaskExecutor executor,
                                 @NotNull TaskStore tasks, @NotNull SsrfGuard guard) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tasks = Objects.requireNonNull(tasks, "tasks");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    // ======== Jobs ========

    public @NotNull List<JobInfo> listJobs() {
        return registry.list();
    }

    public @NotNull AdminResult<Void> triggerJob(String source, String name) {
        if (isBlank(source) || isBlank(name)) return invalid("Job source and name are required");
        try {
            registry.triggerNow(source.trim(), name.trim());
            return AdminResult.ok("Job triggered");
        } catch (JobRegistryException e) {
            return failure("Failed to trigger job", e);
        }
    }

    public @NotNull AdminResult<Void> updateSchedule(String source, String name, String schedule) {
        if (isBlank(source) || isBlank(name) || isBlank(schedule)) {
            return invalid("Job source, name and schedule are required");
        }
        try {
            registry.updateSchedule(source.trim(), name.trim(), schedule.trim());
            return AdminResult.ok("Schedule updated");
        } catch (JobRegistryException e) {
            return failure("Failed to update schedule", e);
        }
    }

    public @NotNull AdminResult<Void> resetSchedule(String source, String name) {
        if (isBlank(source) || isBlank(name)) return invalid("Job source and name are required");
        try {
            registry.resetSchedule(source.trim(), name.trim());
            return AdminResult.ok("Schedule reset to default");
        } catch (JobRegistryException e) {
            return failure("Failed to reset schedule", e);
        }
    }

    // ======== Tasks ========

    /**
     * @param timeoutSeconds clamped to 1..300; {@code null} or non-positive means 30
     */
    public @NotNull AdminResult<ScheduledTask> createTask(String name, String url, String schedule,
                                                          @Nullable Long timeoutSeconds) {
        String error = validateTask(name, url, schedule);
        if (error != null) return invalid(error);

        ScheduledTask task;
        try {
            task = tasks.createTask(name.trim(), url.trim(), schedule.trim(), clampTimeout(timeoutSeconds), true);
        } catch (StorageException e) {
            logger.error("Failed to create scheduled task '{}'", name, e);
            return AdminResult.failure(Kind.INTERNAL_ERROR, "Failed to create task");
        }

        try {
            executor.addTask(task);
        } catch (InvalidScheduleException e) {
            logger.error("Failed to schedule new task {}", task.getId(), e);
            return AdminResult.failure(Kind.INVALID_INPUT, "Task saved but could not be scheduled: " + e.getMessage());
        }
        logger.info("Scheduled task {} ('{}') created", task.getId(), task.getName());
        return AdminResult.ok("Task created", task);
    }

    public @NotNull AdminResult<ScheduledTask> updateTask(long id, String name, String url, String schedule,
                                                          @Nullable Long timeoutSeconds) {
        String error = validateTask(name, url, schedule);
        if (error != null) return invalid(error);

        Optional<ScheduledTask> updated;
        try {
            updated = tasks.updateTask(id, name.trim(), url.trim(), schedule.trim(), clampTimeout(timeoutSeconds));
        } catch (StorageException e) {
            logger.error("Failed to update scheduled task {}", id, e);
            return AdminResult.failure(Kind.INTERNAL_ERROR, "Failed to update task");
        }
        if (updated.isEmpty()) return notFound(id);

        ScheduledTask task = updated.get();
        if (task.isActive()) {
            try {
                executor.rescheduleTask(task);
            } catch (InvalidScheduleException e) {
                logger.error("Failed to reschedule task {}", id, e);
            }
        }
        logger.info("Scheduled task {} ('{}') updated", id, task.getName());
        return AdminResult.ok("Task updated", task);
    }

    public @NotNull AdminResult<ScheduledTask> toggleTask(long id) {
        try {
            Optional<ScheduledTask> existing = tasks.getTask(id);
            if (existing.isEmpty()) return notFound(id);

            Optional<ScheduledTask> toggled = tasks.setTaskActive(id, !existing.get().isActive());
            if (toggled.isEmpty()) return notFound(id);

            ScheduledTask task = toggled.get();
            if (task.isActive()) {
                try {
                    executor.addTask(task);
                } catch (InvalidScheduleException e) {
                    logger.error("Failed to schedule toggled task {}", id, e);
                }
            } else {
                executor.removeTask(id);
            }
            String action = task.isActive() ? "enabled" : "disabled";
            logger.info("Scheduled task {} {}", id, action);
            return AdminResult.ok("Task " + action, task);
        } catch (StorageException e) {
            logger.error("Failed to toggle scheduled task {}", id, e);
            return AdminResult.failure(Kind.INTERNAL_ERROR, "Failed to toggle task");
        }
    }

    public @NotNull AdminResult<Void> deleteTask(long id) {
        try {
            Optional<ScheduledTask> existing = tasks.getTask(id);
            if (existing.isEmpty()) return notFound(id);

            executor.deleteTask(id);
            tasks.deleteTask(id);
            logger.info("Scheduled task {} ('{}') deleted", id, existing.get().getName());
            return AdminResult.ok("Task deleted");
        } catch (StorageException e) {
            logger.error("Failed to delete scheduled task {}", id, e);
            return AdminResult.failure(Kind.INTERNAL_ERROR, "Failed to delete task");
        }
    }

    public @NotNull AdminResult<Void> triggerTask(long id) {
        try {
            executor.triggerTask(id);
            return AdminResult.ok("Task triggered");
        } catch (JobRegistryException e) {
            return failure("Failed to trigger task", e);
        }
    }

    /**
     * @param page 1-based; out-of-range pages are moved to the nearest valid one
     */
    public @NotNull AdminResult<TaskRunPage> listTaskRuns(long id, int page) {
        try {
            Optional<ScheduledTask> task = tasks.getTask(id);
            if (task.isEmpty()) return notFound(id);

            long total = tasks.countRuns(id);
            int totalPages = (int) Math.max(1, (total + RUNS_PER_PAGE - 1) / RUNS_PER_PAGE);
            int current = Math.min(Math.max(page, 1), totalPages);
            List<TaskRun> runs = tasks.listRuns(id, RUNS_PER_PAGE, (current - 1) * RUNS_PER_PAGE);
            return AdminResult.ok(total + " runs", new TaskRunPage(task.get(), runs, current, totalPages, total));
        } catch (StorageException e) {
            logger.error("Failed to list runs of task {}", id, e);
            return AdminResult.failure(Kind.INTERNAL_ERROR, "Failed to list task runs");
        }
    }

    // ======== Internal ========

    /**
     * @return an error message, or {@code null} if the input is acceptable
     */
    @Nullable
    String validateTask(String name, String url, String schedule) {
        if (isBlank(name) || isBlank(url) || isBlank(schedule)) {
            return "Name, URL and schedule are required";
        }
        int nameLength = name.trim().length();
        if (nameLength < NAME_MIN_LENGTH || nameLength > NAME_MAX_LENGTH) {
            return "Name must be between " + NAME_MIN_LENGTH + " and " + NAME_MAX_LENGTH + " characters";
        }
        if (url.trim().length() > URL_MAX_LENGTH) {
            return "URL must be at most " + URL_MAX_LENGTH + " characters";
        }
        try {
            guard.validateUrl(url.trim());
        } catch (UrlRejectedException e) {
            return "Invalid URL: " + e.getMessage();
        }
        try {
            CronExpr.parseStandard(schedule);
        } catch (IllegalArgumentException e) {
            return "Invalid schedule: " + e.getMessage();
        }
        return null;
    }

    static long clampTimeout(@Nullable Long timeoutSeconds) {
        long timeout = timeoutSeconds == null || timeoutSeconds <= 0 ? TIMEOUT_DEFAULT_SECONDS : timeoutSeconds;
        return Math.min(Math.max(timeout, TIMEOUT_MIN_SECONDS), TIMEOUT_MAX_SECONDS);
    }

    private static <T> AdminResult<T> failure(String prefix, JobRegistryException e) {
        Kind kind;
        if (e instanceof JobNotFoundException || e instanceof TaskNotFoundException) {
            kind = Kind.NOT_FOUND;
        } else if (e instanceof InvalidScheduleException) {
            kind = Kind.INVALID_INPUT;
        } else if (e instanceof RateLimitedException) {
            kind = Kind.RATE_LIMITED;
        } else if (e instanceof TriggerUnavailableException) {
            kind = Kind.UNAVAILABLE;
        } else {
            kind = Kind.INTERNAL_ERROR;
            logger.error("{}", prefix, e);
        }
        return AdminResult.failure(kind, prefix + ": " + e.getMessage());
    }

    private static <T> AdminResult<T> invalid(String message) {
        return AdminResult.failure(Kind.INVALID_INPUT, message);
    }

    private static <T> AdminResult<T> notFound(long taskId) {
        return AdminResult.failure(Kind.NOT_FOUND, "Task not found: " + taskId);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
