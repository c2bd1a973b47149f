package com.hcltech.kpc.common.async;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot broadcast shutdown signal.
 * <p>
 * Cancellation is cooperative: every blocking point of a loop that owns a token must
 * wait through {@link #await(Duration)} (or poll {@link #isCancelled()}) so that it
 * observes the signal within one wait interval.
 * <p>
 * Thread-safe. {@link #cancel()} is idempotent.
 */
public final class CancellationToken {

    private final CountDownLatch signal = new CountDownLatch(1);

    /** Broadcast the signal to every current and future waiter. */
    public void cancel() {
        signal.countDown();
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    /**
     * Timed, cancellable wait.
     *
     * @return true if the token was cancelled (or the calling thread was interrupted)
     *         before the timeout elapsed; false if the full timeout elapsed.
     *         On interrupt the interrupt flag is restored.
     */
    public boolean await(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        try {
            return signal.await(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
