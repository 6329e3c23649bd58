package io.github.byzatic.jobscheduler.cron;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

final class JobRecord {
    final UUID id;
    final CronExpr cron;
    final CronTask task;
    final boolean disallowOverlap;

    volatile JobState state = JobState.SCHEDULED;
    volatile Instant nextFire = null;
    volatile Instant prevFire = null;
    volatile String lastError = null;

    final AtomicReference<CancellationToken> tokenRef = new AtomicReference<>();
    final AtomicBoolean removed = new AtomicBoolean(false);
    final AtomicBoolean isRunning = new AtomicBoolean(false); // overlap guard

    JobRecord(UUID id, CronExpr cron, CronTask task, boolean disallowOverlap) {
        this.id = id;
        this.cron = cron;
        this.task = task;
        this.disallowOverlap = disallowOverlap;
    }

    EntryInfo snapshot() {
        return new EntryInfo(id, cron.toString(), state, nextFire, prevFire, lastError);
    }
}
