package io.github.byzatic.jobscheduler.store;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A user-defined HTTP polling task as stored by the application.
 */
public final class ScheduledTask {
    private final long id;
    private final String name;
    private final String url;
    private final String schedule;
    private final long timeoutSeconds;
    private final boolean active;

    public ScheduledTask(long id, @NotNull String name, @NotNull String url, @NotNull String schedule,
                         long timeoutSeconds, boolean active) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.url = Objects.requireNonNull(url, "url");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.timeoutSeconds = timeoutSeconds;
        this.active = active;
    }

    public long getId() {
        return id;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull String getUrl() {
        return url;
    }

    public @NotNull String getSchedule() {
        return schedule;
    }

    /**
     * Zero or negative means "use the default timeout".
     */
    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduledTask)) return false;
        ScheduledTask that = (ScheduledTask) o;
        return id == that.id && timeoutSeconds == that.timeoutSeconds && active == that.active
                && name.equals(that.name) && url.equals(that.url) && schedule.equals(that.schedule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, url, schedule, timeoutSeconds, active);
    }

    @Override
    public String toString() {
        return "ScheduledTask{id=" + id + ", name='" + name + "', url='" + url + "', schedule='" + schedule +
                "', timeoutSeconds=" + timeoutSeconds + ", active=" + active + '}';
    }
}
