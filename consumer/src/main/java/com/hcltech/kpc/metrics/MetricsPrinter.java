package com.hcltech.kpc.metrics;

/**
 * Publishes a metrics snapshot. The scheduler computes delta and rate for one
 * primary counter (e.g. messages-in).
 */
public interface MetricsPrinter<S> {
    void print(MetricsSnapshot<S> snap, long delta, double rate, String primaryCounterName);
}
