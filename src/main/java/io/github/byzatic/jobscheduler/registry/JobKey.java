package io.github.byzatic.jobscheduler.registry;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * {@code source:name} identity of a registered job.
 */
public final class JobKey {
    private final String source;
    private final String name;

    public JobKey(@NotNull String source, @NotNull String name) {
        this.source = Objects.requireNonNull(source, "source");
        this.name = Objects.requireNonNull(name, "name");
    }

    public @NotNull String getSource() {
        return source;
    }

    public @NotNull String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobKey)) return false;
        JobKey jobKey = (JobKey) o;
        return source.equals(jobKey.source) && name.equals(jobKey.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, name);
    }

    @Override
    public String toString() {
        return source + ":" + name;
    }
}
