package io.github.byzatic.jobscheduler.admin;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Outcome of an admin operation with a message fit for display.
 *
 * @param <T> payload of a successful operation, {@link Void} if there is none
 */
public final class AdminResult<T> {
    public enum Kind {
        OK,
        NOT_FOUND,
        INVALID_INPUT,
        RATE_LIMITED,
        UNAVAILABLE,
        INTERNAL_ERROR
    }

    private final Kind kind;
    private final String message;
    @Nullable
    private final T value;

    private AdminResult(Kind kind, String message, @Nullable T value) {
        this.kind = Objects.requireNonNull(kind);
        this.message = Objects.requireNonNull(message);
        this.value = value;
    }

    public static <T> @NotNull AdminResult<T> ok(@NotNull String message, @Nullable T value) {
        return new AdminResult<>(Kind.OK, message, value);
    }

    public static <T> @NotNull AdminResult<T> ok(@NotNull String message) {
        return new AdminResult<>(Kind.OK, message, null);
    }

    public static <T> @NotNull AdminResult<T> failure(@NotNull Kind kind, @NotNull String message) {
        if (kind == Kind.OK) throw new IllegalArgumentException("failure kind must not be OK");
        return new AdminResult<>(kind, message, null);
    }

    public boolean isSuccess() {
        return kind == Kind.OK;
    }

    public @NotNull Kind getKind() {
        return kind;
    }

    public @NotNull String getMessage() {
        return message;
    }

    public @Nullable T getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "AdminResult{" + kind + ": " + message + '}';
    }
}
