package com.hcltech.kpc.consumer;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.SynchronousQueue;

/**
 * Knobs for one partition consumer.
 *
 * @param concurrency           number of downstream workers resolving messages
 * @param outputBufferCapacity  capacity of the output queue shared with the workers (0 = hand-off)
 * @param maxProcessingTime     commit period, and the drain budget when the feed ends
 * @param capacityRetryInterval wait between retries when the ack tracker is full
 * @param pollInterval          longest a blocking point waits before re-checking for shutdown
 * @param deadLetter            retry policy for dead-letter sends
 */
public record ConsumerOptions(
        int concurrency,
        int outputBufferCapacity,
        Duration maxProcessingTime,
        Duration capacityRetryInterval,
        Duration pollInterval,
        DeadLetterOptions deadLetter
) {
    public ConsumerOptions {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency >= 1");
        if (outputBufferCapacity < 0) throw new IllegalArgumentException("outputBufferCapacity >= 0");
        requirePositive(maxProcessingTime, "maxProcessingTime");
        requirePositive(capacityRetryInterval, "capacityRetryInterval");
        requirePositive(pollInterval, "pollInterval");
        Objects.requireNonNull(deadLetter, "deadLetter");
    }

    public static ConsumerOptions of(int concurrency, int outputBufferCapacity, Duration maxProcessingTime) {
        return new ConsumerOptions(concurrency, outputBufferCapacity, maxProcessingTime,
                Duration.ofMillis(100), Duration.ofMillis(100), DeadLetterOptions.defaults());
    }

    /** Upper bound on unresolved offsets: every worker busy, the buffer full, and one in hand. */
    public int maxOutstanding() {
        return concurrency + outputBufferCapacity + 1;
    }

    /** An output queue sized by {@link #outputBufferCapacity()}. */
    public <T> BlockingQueue<T> newOutputQueue() {
        return outputBufferCapacity == 0 ? new SynchronousQueue<>() : new ArrayBlockingQueue<>(outputBufferCapacity);
    }

    public ConsumerOptions withCapacityRetryInterval(Duration d) {
        return new ConsumerOptions(concurrency, outputBufferCapacity, maxProcessingTime, d, pollInterval, deadLetter);
    }

    public ConsumerOptions withPollInterval(Duration d) {
        return new ConsumerOptions(concurrency, outputBufferCapacity, maxProcessingTime, capacityRetryInterval, d, deadLetter);
    }

    public ConsumerOptions withDeadLetter(DeadLetterOptions d) {
        return new ConsumerOptions(concurrency, outputBufferCapacity, maxProcessingTime, capacityRetryInterval, pollInterval, d);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " > 0");
    }
}
