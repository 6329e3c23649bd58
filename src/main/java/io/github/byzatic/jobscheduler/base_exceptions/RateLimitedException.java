package io.github.byzatic.jobscheduler.base_exceptions;

public class RateLimitedException extends JobRegistryException {
    public RateLimitedException(String message) {
        super(message);
    }

    public RateLimitedException(Throwable cause) {
        super(cause);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }

    public RateLimitedException(Throwable cause, String message) {
        super(message, cause);
    }
}
