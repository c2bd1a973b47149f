package com.hcltech.kpc.consumer;

import java.time.Duration;
import java.util.Objects;

/** Backoff knobs for retrying dead-letter sends. */
public record DeadLetterOptions(
        Duration initialBackoff,
        int multiplier,
        Duration maxBackoff,
        double jitter
) {
    public DeadLetterOptions {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isZero() || initialBackoff.isNegative()) throw new IllegalArgumentException("initialBackoff > 0");
        if (maxBackoff.compareTo(initialBackoff) < 0) throw new IllegalArgumentException("maxBackoff >= initialBackoff");
        if (multiplier < 1) throw new IllegalArgumentException("multiplier >= 1");
        if (jitter < 0 || jitter >= 1) throw new IllegalArgumentException("jitter in [0, 1)");
    }

    public static DeadLetterOptions defaults() {
        return new DeadLetterOptions(Duration.ofMillis(10), 2, Duration.ofSeconds(10), 0.2);
    }
}
