package io.github.byzatic.jobscheduler.base_exceptions;

public class JobNotFoundException extends JobRegistryException {
    public JobNotFoundException(String message) {
        super(message);
    }

    public JobNotFoundException(Throwable cause) {
        super(cause);
    }

    public JobNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobNotFoundException(Throwable cause, String message) {
        super(message, cause);
    }
}
