package io.github.byzatic.jobscheduler.registry;

import io.github.byzatic.jobscheduler.base_exceptions.JobRegistryException;

/**
 * Runs a job on demand. Implementations decide whether the work happens on the caller's thread
 * or is dispatched in the background.
 */
@FunctionalInterface
public interface ManualTrigger {
    void trigger() throws JobRegistryException;
}
