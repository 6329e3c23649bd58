package io.github.byzatic.jobscheduler.admin;

import io.github.byzatic.jobscheduler.store.ScheduledTask;
import io.github.byzatic.jobscheduler.store.TaskRun;

import java.util.List;

/**
 * One page of a task's run history, most recent run first.
 */
public final class TaskRunPage {
    public final ScheduledTask task;
    public final List<TaskRun> runs;
    public final int page;
    public final int totalPages;
    public final long totalCount;

    TaskRunPage(ScheduledTask task, List<TaskRun> runs, int page, int totalPages, long totalCount) {
        this.task = task;
        this.runs = List.copyOf(runs);
        this.page = page;
        this.totalPages = totalPages;
        this.totalCount = totalCount;
    }
}
