package io.github.byzatic.jobscheduler.cron;

import java.util.UUID;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dispatch queue element: one pending fire of an entry. Fires due at the same millisecond
 * leave the queue in the order they were enqueued.
 */
final class ScheduledEntry implements Delayed {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    final UUID jobId;
    final long triggerAtMillis;
    private final long seq = SEQUENCE.getAndIncrement();

    ScheduledEntry(UUID jobId, long triggerAtMillis) {
        this.jobId = jobId;
        this.triggerAtMillis = triggerAtMillis;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(triggerAtMillis - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        if (o == this) return 0;
        if (o instanceof ScheduledEntry) {
            ScheduledEntry other = (ScheduledEntry) o;
            int byTime = Long.compare(triggerAtMillis, other.triggerAtMillis);
            return byTime != 0 ? byTime : Long.compare(seq, other.seq);
        }
        return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
    }

    @Override
    public String toString() {
        return "ScheduledEntry{" + jobId + " at " + triggerAtMillis + '}';
    }
}
