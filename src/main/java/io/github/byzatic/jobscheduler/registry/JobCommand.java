package io.github.byzatic.jobscheduler.registry;

/**
 * The work a registered job performs when its schedule fires.
 */
@FunctionalInterface
public interface JobCommand {
    void execute() throws Exception;
}
