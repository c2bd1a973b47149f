package com.hcltech.kpc.metrics;

import com.hcltech.kpc.common.ITimeService;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Thread-safe, fire-and-forget telemetry sink:
 * <ul>
 *   <li>COUNTERS: increment-only, per shard ({@link LongAdder})</li>
 *   <li>GAUGES: last value set, per shard ({@link AtomicLong})</li>
 * </ul>
 *
 * @param <S> shard type, e.g. Kafka {@code TopicPartition}
 */
public final class MetricsRegistry<S> {

    private final ITimeService time;
    private final ConcurrentHashMap<String, ConcurrentHashMap<S, LongAdder>> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentHashMap<S, AtomicLong>> gauges = new ConcurrentHashMap<>();

    public MetricsRegistry() {
        this(ITimeService.real);
    }

    public MetricsRegistry(ITimeService time) {
        this.time = Objects.requireNonNull(time, "time");
    }

    public void inc(String metricName, S shard) {
        incBy(metricName, shard, 1);
    }

    /** Ignores non-positive deltas. */
    public void incBy(String metricName, S shard, long delta) {
        if (delta <= 0) return;
        counters
                .computeIfAbsent(metricName, __ -> new ConcurrentHashMap<>())
                .computeIfAbsent(shard, __ -> new LongAdder())
                .add(delta);
    }

    public void set(String metricName, S shard, long value) {
        gauges
                .computeIfAbsent(metricName, __ -> new ConcurrentHashMap<>())
                .computeIfAbsent(shard, __ -> new AtomicLong())
                .set(value);
    }

    /** Current counter value, 0 if never incremented. */
    public long counter(String metricName, S shard) {
        var byShard = counters.get(metricName);
        if (byShard == null) return 0L;
        LongAdder a = byShard.get(shard);
        return a == null ? 0L : a.sum();
    }

    /** Last gauge value, or {@code null} if never set. */
    public Long gauge(String metricName, S shard) {
        var byShard = gauges.get(metricName);
        if (byShard == null) return null;
        AtomicLong g = byShard.get(shard);
        return g == null ? null : g.get();
    }

    public MetricsSnapshot<S> snapshot() {
        Map<String, Map<S, Long>> countersByShard = counters.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        e -> e.getValue().entrySet().stream()
                                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, x -> x.getValue().sum()))));

        Map<String, Long> counterTotals = countersByShard.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        e -> e.getValue().values().stream().mapToLong(Long::longValue).sum()));

        Map<String, Map<S, Long>> gaugesByShard = gauges.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        e -> e.getValue().entrySet().stream()
                                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, x -> x.getValue().get()))));

        return new MetricsSnapshot<>(time.currentTimeMillis(), counterTotals, countersByShard, gaugesByShard);
    }
}
