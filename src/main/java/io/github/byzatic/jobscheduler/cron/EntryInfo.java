package io.github.byzatic.jobscheduler.cron;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of an engine entry, taken at call time.
 */
public final class EntryInfo {
    public final UUID id;
    public final String cron;
    public final JobState state;
    @Nullable public final Instant nextRun;
    @Nullable public final Instant prevRun;
    @Nullable public final String lastError;

    EntryInfo(UUID id, String cron, JobState state, @Nullable Instant nextRun, @Nullable Instant prevRun, @Nullable String lastError) {
        this.id = id;
        this.cron = cron;
        this.state = state;
        this.nextRun = nextRun;
        this.prevRun = prevRun;
        this.lastError = lastError;
    }

    @Override
    public String toString() {
        return "EntryInfo{id=" + id + ", cron='" + cron + "', state=" + state +
                ", nextRun=" + nextRun + ", prevRun=" + prevRun +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") + '}';
    }
}
