package io.github.byzatic.jobscheduler.token_bucket_limiter;

/**
 * Admission check for manual task triggers. {@link #tryAcquire()} answers at once and never waits
 * for a permit to become available.
 */
public interface Limiter {
    /**
     * @return {@code true} if a permit was taken, {@code false} if the caller has to come back later
     */
    boolean tryAcquire();
}
