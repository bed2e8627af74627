package com.darboux.integration;

import com.darboux.exception.IntegrationCancelledException;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by the summation loops once per
 * subinterval.
 *
 * <p>A token is cancelled explicitly through {@link #cancel()}, or implicitly
 * once its optional deadline has passed.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private CancellationToken(long timeoutMs) {
        this.hasDeadline = timeoutMs > 0;
        this.deadlineNanos = hasDeadline ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : 0L;
    }

    /**
     * Creates a token without a deadline.
     *
     * @return a new token
     */
    public static CancellationToken create() {
        return new CancellationToken(0L);
    }

    /**
     * Creates a token that cancels itself after the given time.
     *
     * @param timeoutMs the time budget in milliseconds; 0 means no deadline
     * @return a new token
     */
    public static CancellationToken withTimeout(long timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must not be negative");
        }
        return new CancellationToken(timeoutMs);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            cancelled.set(true);
            return true;
        }
        return false;
    }

    /**
     * Throws if the token is cancelled or the calling thread was interrupted.
     *
     * @throws IntegrationCancelledException if work should stop
     */
    public void throwIfCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new IntegrationCancelledException("summation thread interrupted");
        }
        if (isCancelled()) {
            throw new IntegrationCancelledException(
                hasDeadline ? "time limit exceeded" : "cancelled on request");
        }
    }
}
