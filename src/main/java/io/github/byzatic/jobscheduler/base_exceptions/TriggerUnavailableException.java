package io.github.byzatic.jobscheduler.base_exceptions;

public class TriggerUnavailableException extends JobRegistryException {
    public TriggerUnavailableException(String message) {
        super(message);
    }

    public TriggerUnavailableException(Throwable cause) {
        super(cause);
    }

    public TriggerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public TriggerUnavailableException(Throwable cause, String message) {
        super(message, cause);
    }
}
