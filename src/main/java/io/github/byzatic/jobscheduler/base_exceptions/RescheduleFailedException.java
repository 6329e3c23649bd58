package io.github.byzatic.jobscheduler.base_exceptions;

/**
 * The new schedule could not be applied; the previous schedule was restored.
 */
public class RescheduleFailedException extends JobRegistryException {
    public RescheduleFailedException(String message) {
        super(message);
    }

    public RescheduleFailedException(Throwable cause) {
        super(cause);
    }

    public RescheduleFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public RescheduleFailedException(Throwable cause, String message) {
        super(message, cause);
    }
}
