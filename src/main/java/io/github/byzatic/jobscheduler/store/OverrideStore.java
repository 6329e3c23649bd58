package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * Persisted schedule overrides keyed by {@code (source, name)}. Absence of a row means the job
 * runs on its default schedule.
 */
public interface OverrideStore {
    /**
     * Creates the override table if it does not exist. Idempotent.
     */
    void ensureSchema() throws StorageException;

    @NotNull Optional<String> getOverride(@NotNull String source, @NotNull String name) throws StorageException;

    void upsertOverride(@NotNull String source, @NotNull String name, @NotNull String overrideSchedule) throws StorageException;

    void deleteOverride(@NotNull String source, @NotNull String name) throws StorageException;
}
