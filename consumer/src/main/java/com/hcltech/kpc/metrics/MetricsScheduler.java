package com.hcltech.kpc.metrics;

import com.hcltech.kpc.common.ITimeService;
import com.hcltech.kpc.common.async.CancellationToken;
import com.hcltech.kpc.common.async.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;

/** Prints a registry snapshot every period on a daemon thread until closed. */
public final class MetricsScheduler<S> implements AutoCloseable, Runnable {

    private final MetricsRegistry<S> registry;
    private final MetricsPrinter<S> printer;
    private final Duration period;
    private final String primaryCounterName;
    private final ITimeService time;
    private final CancellationToken stop = new CancellationToken();

    private Thread thread;
    private long lastTime;
    private long lastTotal = 0L;

    public MetricsScheduler(MetricsRegistry<S> registry,
                            MetricsPrinter<S> printer,
                            Duration period,
                            String primaryCounterName,
                            ITimeService time) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.printer = Objects.requireNonNull(printer, "printer");
        this.period = Objects.requireNonNull(period, "period");
        this.primaryCounterName = Objects.requireNonNull(primaryCounterName, "primaryCounterName");
        this.time = Objects.requireNonNull(time, "time");
        this.lastTime = time.currentTimeMillis();
    }

    public MetricsScheduler(MetricsRegistry<S> registry, MetricsPrinter<S> printer, Duration period) {
        this(registry, printer, period, MetricNames.PARTITION_MESSAGES_IN, ITimeService.real);
    }

    public synchronized void start() {
        if (thread != null) throw new IllegalStateException("metrics scheduler already started");
        thread = new DaemonThreadFactory("metrics-scheduler").newThread(this);
        thread.start();
    }

    @Override
    public void run() {
        while (!stop.await(period)) {
            tick();
        }
    }

    /** One print cycle. */
    void tick() {
        long now = time.currentTimeMillis();
        MetricsSnapshot<S> snap = registry.snapshot();
        long total = snap.counterTotals().getOrDefault(primaryCounterName, 0L);
        long delta = total - lastTotal;
        double rate = (now > lastTime) ? (delta * 1000.0) / (now - lastTime) : 0.0;

        printer.print(snap, delta, rate, primaryCounterName);

        lastTime = now;
        lastTotal = total;
    }

    @Override
    public void close() {
        stop.cancel();
        Thread t;
        synchronized (this) {
            t = thread;
        }
        if (t != null) {
            try {
                t.join(5000);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
