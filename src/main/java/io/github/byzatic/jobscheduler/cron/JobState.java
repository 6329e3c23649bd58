package io.github.byzatic.jobscheduler.cron;

/**
 * Lifecycle of the latest run of an engine entry.
 */
public enum JobState {SCHEDULED, RUNNING, COMPLETED, FAILED, CANCELLED}
