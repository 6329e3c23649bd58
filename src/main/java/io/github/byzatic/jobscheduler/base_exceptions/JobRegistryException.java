package io.github.byzatic.jobscheduler.base_exceptions;

/**
 * Base of the recoverable errors returned by the job registry and the task executor.
 * Messages are human readable and safe to show to an operator.
 */
public class JobRegistryException extends Exception {
    public JobRegistryException(String message) {
        super(message);
    }

    public JobRegistryException(Throwable cause) {
        super(cause);
    }

    public JobRegistryException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobRegistryException(Throwable cause, String message) {
        super(message, cause);
    }
}
