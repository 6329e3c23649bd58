package io.github.byzatic.jobscheduler.tasks;

import io.github.byzatic.jobscheduler.base_exceptions.JobRegistryException;
import io.github.byzatic.jobscheduler.registry.JobCommand;
import io.github.byzatic.jobscheduler.registry.ManualTrigger;
import io.github.byzatic.jobscheduler.store.ScheduledTask;

/**
 * Registry capabilities of one polling task: scheduled runs execute the task as it was when it
 * was scheduled, manual triggers go through the executor's rate limiter.
 */
final class TaskJob implements JobCommand, ManualTrigger {
    private final TaskExecutor executor;
    private final ScheduledTask task;

    TaskJob(TaskExecutor executor, ScheduledTask task) {
        this.executor = executor;
        this.task = task;
    }

    @Override
    public void execute() {
        executor.executeTask(task);
    }

    @Override
    public void trigger() throws JobRegistryException {
        executor.triggerTask(task.getId());
    }
}
