package io.github.byzatic.jobscheduler.cron;

import org.jetbrains.annotations.Nullable;

/**
 * Soft-stop signal handed to each run of an entry. The first stop request wins; later ones
 * do not replace its reason.
 */
public final class CancellationToken {
    @Nullable
    private volatile String stopReason;

    public boolean isStopRequested() {
        return stopReason != null;
    }

    /**
     * @return why the stop was requested, {@code null} while the run may continue
     */
    public @Nullable String reason() {
        return stopReason;
    }

    synchronized void requestStop(String reason) {
        if (stopReason == null) stopReason = reason == null ? "" : reason;
    }
}
