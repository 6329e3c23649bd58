package io.github.byzatic.jobscheduler.cron;

/**
 * Unit of work fired by the {@link CronEngine}. Long-running tasks should check the token.
 */
@FunctionalInterface
public interface CronTask {
    void run(CancellationToken token) throws Exception;
}
