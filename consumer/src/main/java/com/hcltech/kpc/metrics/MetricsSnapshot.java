package com.hcltech.kpc.metrics;

import java.util.Map;

/** Immutable view of a {@link MetricsRegistry} at one instant. */
public record MetricsSnapshot<S>(
        long timestampMs,
        Map<String, Long> counterTotals,            // "kafka.partition.messages-in" -> 12345
        Map<String, Map<S, Long>> countersByShard,  // "kafka.partition.messages-in" -> { orders-0: 1000, ... }
        Map<String, Map<S, Long>> gaugesByShard     // "kafka.partition.backlog" -> { orders-0: 42, ... }
) {
}
