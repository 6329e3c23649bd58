package io.github.byzatic.jobscheduler.base_exceptions;

/**
 * Both the new schedule and the rollback to the previous schedule were rejected by the engine.
 * The job stays registered but has no engine entry and will not fire until rescheduled.
 * <p>
 * The cause is the rollback failure; the original failure is attached as suppressed.
 */
public class CriticalRescheduleFailureException extends JobRegistryException {
    public CriticalRescheduleFailureException(String message, Throwable rollbackFailure, Throwable originalFailure) {
        super(message, rollbackFailure);
        if (originalFailure != null) addSuppressed(originalFailure);
    }

    public Throwable getOriginalFailure() {
        Throwable[] suppressed = getSuppressed();
        return suppressed.length > 0 ? suppressed[0] : null;
    }
}
