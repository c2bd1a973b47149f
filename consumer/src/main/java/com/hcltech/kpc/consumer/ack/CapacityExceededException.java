package com.hcltech.kpc.consumer.ack;

/**
 * Thrown by {@link AckManager#track(long)} when the number of unresolved offsets already
 * equals the configured maximum. Recoverable: retry after a resolution frees a slot.
 */
public class CapacityExceededException extends Exception {

    private final int maxOutstanding;

    public CapacityExceededException(int maxOutstanding) {
        super("ack manager is at capacity: " + maxOutstanding + " unresolved offsets");
        this.maxOutstanding = maxOutstanding;
    }

    public int maxOutstanding() {
        return maxOutstanding;
    }
}
