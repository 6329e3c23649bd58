package io.github.byzatic.jobscheduler.base_exceptions;

public class InvalidScheduleException extends JobRegistryException {
    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(Throwable cause) {
        super(cause);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidScheduleException(Throwable cause, String message) {
        super(message, cause);
    }
}
