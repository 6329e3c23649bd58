package io.github.byzatic.jobscheduler.base_exceptions;

public class StorageException extends Exception {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(Throwable cause) {
        super(cause);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(Throwable cause, String message) {
        super(message, cause);
    }
}
