package io.github.byzatic.jobscheduler.ssrf_guard;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An outbound URL failed SSRF validation. {@link #getReason()} tells why.
 */
public class UrlRejectedException extends Exception {
    public enum Reason {
        EMPTY_URL,
        INVALID_URL,
        DISALLOWED_SCHEME,
        MISSING_HOSTNAME,
        BLOCKED_HOSTNAME,
        PRIVATE_OR_RESERVED_ADDRESS,
        DNS_RESOLUTION_FAILED,
        TOO_MANY_REDIRECTS
    }

    private final Reason reason;

    public UrlRejectedException(@NotNull Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public UrlRejectedException(@NotNull Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public @NotNull Reason getReason() {
        return reason;
    }
}
