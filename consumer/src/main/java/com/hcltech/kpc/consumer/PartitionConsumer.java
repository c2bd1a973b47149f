package com.hcltech.kpc.consumer;

import com.hcltech.kpc.common.ITimeService;
import com.hcltech.kpc.common.async.CancellationToken;
import com.hcltech.kpc.common.async.DaemonThreadFactory;
import com.hcltech.kpc.common.lifecycle.LifecycleState;
import com.hcltech.kpc.common.lifecycle.RunLifecycle;
import com.hcltech.kpc.consumer.ack.AckId;
import com.hcltech.kpc.consumer.ack.AckManager;
import com.hcltech.kpc.consumer.ack.CapacityExceededException;
import com.hcltech.kpc.consumer.dlq.DeadLetterQueue;
import com.hcltech.kpc.metrics.MetricNames;
import com.hcltech.kpc.metrics.MetricsRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes one topic-partition.
 * <p>
 * Two loops run on their own daemon threads once {@link #start()} is called:
 * <ul>
 *   <li>intake: client -> {@link AckManager#track} -> {@link Message} -> output queue, in offset order</li>
 *   <li>commit: every {@code maxProcessingTime}, push {@link AckManager#commitLevel()} to the client</li>
 * </ul>
 * Both loops watch one {@link CancellationToken}. {@link #stop()} and {@link #drain(Duration)}
 * cancel it, optionally wait for in-flight messages, do a final checkpoint and close the client.
 * That sequence runs exactly once however many callers race on it.
 * <p>
 * A message abandoned on shutdown was never acked, so it never advances the commit level and
 * will be redelivered by the broker.
 */
public final class PartitionConsumer<K, V> {
    private static final Logger log = LoggerFactory.getLogger(PartitionConsumer.class);

    private final PartitionClient<K, V> client;
    private final BlockingQueue<Message<K, V>> output;
    private final DeadLetterQueue<K, V> deadLetters;
    private final ConsumerOptions options;
    private final MetricsRegistry<TopicPartition> metrics;
    private final ITimeService time;

    private final TopicPartition tp;
    private final AckManager ackManager;
    private final CancellationToken stopSignal = new CancellationToken();
    private final RunLifecycle lifecycle;
    private final ExecutorService loops;
    private final AtomicInteger undelivered = new AtomicInteger();

    public PartitionConsumer(PartitionClient<K, V> client,
                             BlockingQueue<Message<K, V>> output,
                             DeadLetterQueue<K, V> deadLetters,
                             ConsumerOptions options,
                             MetricsRegistry<TopicPartition> metrics) {
        this(client, output, deadLetters, options, metrics, ITimeService.real);
    }

    public PartitionConsumer(PartitionClient<K, V> client,
                             BlockingQueue<Message<K, V>> output,
                             DeadLetterQueue<K, V> deadLetters,
                             ConsumerOptions options,
                             MetricsRegistry<TopicPartition> metrics,
                             ITimeService time) {
        this.client = Objects.requireNonNull(client, "client");
        this.output = Objects.requireNonNull(output, "output");
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters");
        this.options = Objects.requireNonNull(options, "options");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.time = Objects.requireNonNull(time, "time");

        this.tp = new TopicPartition(client.topic(), client.partition());
        this.ackManager = new AckManager(options.maxOutstanding());
        String name = client.topic() + "-partition-" + client.partition();
        this.lifecycle = new RunLifecycle(name);
        this.loops = Executors.newFixedThreadPool(2, new DaemonThreadFactory(DaemonThreadFactory.safeName(name)));
    }

    /**
     * Spawns the intake and commit loops.
     *
     * @throws IllegalStateException if already started or already stopped
     */
    public void start() {
        lifecycle.start(() -> {
            loops.execute(this::intakeLoop);
            loops.execute(this::commitLoop);
            metrics.inc(MetricNames.PARTITION_STARTED, tp);
        });
    }

    /** Immediate shutdown: does not wait for in-flight messages. */
    public void stop() {
        shutdown(Duration.ZERO);
    }

    /**
     * Graceful shutdown: stops intake now, gives in-flight messages up to {@code d} to be
     * resolved, then checkpoints and closes. {@code drain(Duration.ZERO)} is {@link #stop()}.
     */
    public void drain(Duration d) {
        shutdown(Objects.requireNonNull(d, "d"));
    }

    public LifecycleState state() {
        return lifecycle.state();
    }

    public TopicPartition topicPartition() {
        return tp;
    }

    /** Current commit level of this partition, -1 if nothing is committable yet. */
    public long commitLevel() {
        return ackManager.commitLevel();
    }

    /** Number of delivered or in-delivery messages not yet resolved. */
    public int pending() {
        return ackManager.pending();
    }

    /** Messages tracked but abandoned by shutdown before reaching the output queue. */
    public int undelivered() {
        return undelivered.get();
    }

    // ---------------------------------------------------------------- intake

    private void intakeLoop() {
        logInfo("partition consumer started");
        try {
            while (!stopSignal.isCancelled()) {
                ConsumerRecord<K, V> rec = client.poll(options.pollInterval());
                if (stopSignal.isCancelled()) break;
                if (rec == null) {
                    if (client.isFeedClosed() && !stopSignal.isCancelled()) {
                        logInfo("partition message feed closed");
                        drain(options.maxProcessingTime());
                        return;
                    }
                    continue;
                }
                recordIntake(rec);
                deliver(rec);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (stopSignal.isCancelled()) return;
            log.error("intake loop failed for {}, stopping", tp, e);
            stop();
            return;
        }
        logInfo("partition consumer intake stopped");
    }

    private void recordIntake(ConsumerRecord<K, V> rec) {
        if (rec.timestamp() >= 0) {
            metrics.set(MetricNames.PARTITION_LAG, tp, Math.max(0, time.currentTimeMillis() - rec.timestamp()));
        }
        metrics.set(MetricNames.PARTITION_READ_OFFSET, tp, rec.offset());
        metrics.inc(MetricNames.PARTITION_MESSAGES_IN, tp);
    }

    private void deliver(ConsumerRecord<K, V> rec) throws InterruptedException {
        AckId id = trackOffset(rec.offset());
        if (id == null) return;
        Message<K, V> msg = new PartitionMessage<>(rec, id, ackManager, deadLetters, metrics, tp);
        long waitMs = options.pollInterval().toMillis();
        while (!stopSignal.isCancelled()) {
            if (output.offer(msg, waitMs, TimeUnit.MILLISECONDS)) return;
        }
        // tracked but never handed to a worker: holds the commit level, nobody will resolve it
        undelivered.incrementAndGet();
    }

    /**
     * Registers the offset, waiting out a full tracker. A full tracker means maxOutstanding is
     * smaller than the real number of messages in flight.
     *
     * @return the handle, or null if shutdown was signalled while waiting
     */
    AckId trackOffset(long offset) {
        while (true) {
            try {
                return ackManager.track(offset);
            } catch (CapacityExceededException e) {
                metrics.inc(MetricNames.PARTITION_ACKMGR_LIST_FULL, tp);
                log.error("ack manager ran out of capacity topic={} partition={} maxOutstanding={}",
                        tp.topic(), tp.partition(), e.maxOutstanding());
                if (stopSignal.await(options.capacityRetryInterval())) return null;
            }
        }
    }

    // ---------------------------------------------------------------- commit

    private void commitLoop() {
        while (!stopSignal.await(options.maxProcessingTime())) {
            try {
                markOffset();
            } catch (RuntimeException e) {
                log.warn("checkpoint failed for {}", tp, e);
            }
        }
    }

    /** Pushes the current commit level to the client, if there is one. */
    void markOffset() {
        long level = ackManager.commitLevel();
        if (level < 0) return;
        client.markPartitionOffset(tp.topic(), tp.partition(), level, "");
        metrics.set(MetricNames.PARTITION_COMMIT_OFFSET, tp, level);
        metrics.set(MetricNames.PARTITION_BACKLOG, tp, Math.max(0L, client.highWaterMarkOffset() - level));
        log.debug("kafka checkpoint topic={} partition={} offset={}", tp.topic(), tp.partition(), level);
    }

    // ---------------------------------------------------------------- shutdown

    private void shutdown(Duration d) {
        lifecycle.stop(() -> {
            stopSignal.cancel();
            awaitInFlight(d);
            try {
                markOffset();
            } catch (RuntimeException e) {
                metrics.inc(MetricNames.PARTITION_CLOSE_FAILED, tp);
                log.warn("final checkpoint failed for {}", tp, e);
            }
            try {
                client.close();
            } catch (Exception e) {
                metrics.inc(MetricNames.PARTITION_CLOSE_FAILED, tp);
                log.warn("failed to close partition client for {}", tp, e);
            }
            loops.shutdown();
            metrics.inc(MetricNames.PARTITION_STOPPED, tp);
            logInfo("partition consumer stopped");
        });
    }

    /** Waits until every offset a worker holds is resolved, or {@code d} has elapsed. */
    private void awaitInFlight(Duration d) {
        if (d.isZero() || d.isNegative()) return;
        long deadline = System.nanoTime() + d.toNanos();
        long stepMs = Math.max(1, Math.min(options.pollInterval().toMillis(), 10));
        try {
            while (ackManager.pending() > undelivered.get()) {
                long leftNanos = deadline - System.nanoTime();
                if (leftNanos <= 0) return;
                TimeUnit.MILLISECONDS.sleep(Math.min(stepMs, TimeUnit.NANOSECONDS.toMillis(leftNanos) + 1));
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private void logInfo(String msg) {
        log.info("{} topic={} partition={}", msg, tp.topic(), tp.partition());
    }
}
