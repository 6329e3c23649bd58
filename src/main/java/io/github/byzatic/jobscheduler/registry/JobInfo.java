package io.github.byzatic.jobscheduler.registry;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Snapshot of a registered job. Timing values are read from the engine when the snapshot is taken.
 */
public final class JobInfo {
    public final String source;
    public final String name;
    public final String description;
    public final String defaultSchedule;
    public final String effectiveSchedule;
    public final boolean overridden;
    @Nullable public final Instant nextRun;
    @Nullable public final Instant lastRun;
    public final boolean canTrigger;

    JobInfo(String source, String name, String description, String defaultSchedule, String effectiveSchedule,
            @Nullable Instant nextRun, @Nullable Instant lastRun, boolean canTrigger) {
        this.source = source;
        this.name = name;
        this.description = description;
        this.defaultSchedule = defaultSchedule;
        this.effectiveSchedule = effectiveSchedule;
        this.overridden = !effectiveSchedule.equals(defaultSchedule);
        this.nextRun = nextRun;
        this.lastRun = lastRun;
        this.canTrigger = canTrigger;
    }

    public String key() {
        return source + ":" + name;
    }

    @Override
    public String toString() {
        return "JobInfo{" + key() + ", schedule='" + effectiveSchedule + "'" +
                (overridden ? " (default '" + defaultSchedule + "')" : "") +
                ", nextRun=" + nextRun + ", lastRun=" + lastRun + ", canTrigger=" + canTrigger + '}';
    }
}
