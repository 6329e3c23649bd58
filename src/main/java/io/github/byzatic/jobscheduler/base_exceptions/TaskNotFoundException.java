package io.github.byzatic.jobscheduler.base_exceptions;

public class TaskNotFoundException extends JobRegistryException {
    public TaskNotFoundException(String message) {
        super(message);
    }

    public TaskNotFoundException(Throwable cause) {
        super(cause);
    }

    public TaskNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public TaskNotFoundException(Throwable cause, String message) {
        super(message, cause);
    }
}
