package io.github.byzatic.jobscheduler.token_bucket_limiter;

import com.google.common.base.Ticker;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.time.Duration;
import java.util.Objects;

/**
 * A lightweight, thread-safe token-bucket rate limiter.
 * <p>
 * The bucket starts full with {@code capacity} tokens and gains one token every
 * {@code refillInterval}, never exceeding {@code capacity}. Time is read from a Guava
 * {@link Ticker} so tests can drive it.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Limiter limiter = new SimpleTokenBucketLimiter(1, Duration.ofSeconds(10)); // one permit per 10s
 * if (limiter.tryAcquire()) {
 *     // do work
 * } else {
 *     // reject
 * }
 * }</pre>
 */
@ThreadSafe
public final class SimpleTokenBucketLimiter implements Limiter {
    private final long refillNanos;
    private final long capacityNanos;
    private final Ticker ticker;

    // tokens held, measured in nanoseconds of refill time
    @GuardedBy("this")
    private long creditNanos;
    @GuardedBy("this")
    private long lastNanos;

    /**
     * @param capacity       burst size, must be &gt;= 1
     * @param refillInterval time to regain one token, must be positive
     */
    public SimpleTokenBucketLimiter(int capacity, Duration refillInterval) {
        this(capacity, refillInterval, Ticker.systemTicker());
    }

    public SimpleTokenBucketLimiter(int capacity, Duration refillInterval, Ticker ticker) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        Objects.requireNonNull(refillInterval, "refillInterval");
        if (refillInterval.isZero() || refillInterval.isNegative()) {
            throw new IllegalArgumentException("refillInterval must be positive");
        }
        this.refillNanos = refillInterval.toNanos();
        this.capacityNanos = Math.multiplyExact(refillNanos, (long) capacity);
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.creditNanos = capacityNanos;
        this.lastNanos = ticker.read();
    }

    /** {@inheritDoc} */
    @Override
    public synchronized boolean tryAcquire() {
        long now = ticker.read();
        long elapsed = now - lastNanos;
        lastNanos = now;

        creditNanos = Math.min(capacityNanos, creditNanos + elapsed);
        if (creditNanos >= refillNanos) {
            creditNanos -= refillNanos;
            return true;
        }
        return false;
    }
}
