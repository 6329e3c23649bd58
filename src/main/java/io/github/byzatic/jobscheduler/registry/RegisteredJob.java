package io.github.byzatic.jobscheduler.registry;

import io.github.byzatic.jobscheduler.cron.CronEngine;
import io.github.byzatic.jobscheduler.cron.EntryInfo;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.UUID;

/**
 * Registry-owned record of a job. Mutable fields are only touched under the registry's write lock.
 * The engine is referenced by entry id only.
 */
final class RegisteredJob {
    final JobKey key;
    final String description;
    final String defaultSchedule;
    final CronEngine engine;
    final JobCommand command;
    @Nullable final ManualTrigger trigger;

    String effectiveSchedule;
    @Nullable UUID entryId;

    RegisteredJob(@NotNull JobKey key, @NotNull String description, @NotNull String defaultSchedule,
                  @NotNull String effectiveSchedule, @NotNull CronEngine engine, @Nullable UUID entryId,
                  @NotNull JobCommand command, @Nullable ManualTrigger trigger) {
        this.key = key;
        this.description = description;
        this.defaultSchedule = defaultSchedule;
        this.effectiveSchedule = effectiveSchedule;
        this.engine = engine;
        this.entryId = entryId;
        this.command = command;
        this.trigger = trigger;
    }

    JobInfo snapshot() {
        Optional<EntryInfo> entry = entryId == null ? Optional.empty() : engine.entry(entryId);
        return new JobInfo(
                key.getSource(),
                key.getName(),
                description,
                defaultSchedule,
                effectiveSchedule,
                entry.map(e -> e.nextRun).orElse(null),
                entry.map(e -> e.prevRun).orElse(null),
                trigger != null
        );
    }
}
