package com.hcltech.kpc.consumer.dlq;

import com.hcltech.kpc.common.async.CancellationToken;
import com.hcltech.kpc.consumer.DeadLetterOptions;
import com.hcltech.kpc.metrics.MetricNames;
import com.hcltech.kpc.metrics.MetricsRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.utils.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries {@link DeadLetterProducer#sendMessage} with exponential backoff until it succeeds.
 * No record is ever dropped: the only ways out of {@link #add} are success, {@link #close()},
 * or interruption of the calling worker.
 * <p>
 * Thread-safe; any number of workers may call {@link #add} concurrently.
 */
public final class RetryingDeadLetterQueue<K, V> implements DeadLetterQueue<K, V> {
    private static final Logger log = LoggerFactory.getLogger(RetryingDeadLetterQueue.class);

    private final DeadLetterProducer<K, V> producer;
    private final ExponentialBackoff backoff;
    private final MetricsRegistry<TopicPartition> metrics;
    private final CancellationToken closed = new CancellationToken();

    public RetryingDeadLetterQueue(DeadLetterProducer<K, V> producer,
                                   DeadLetterOptions options,
                                   MetricsRegistry<TopicPartition> metrics) {
        this.producer = Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(options, "options");
        this.backoff = new ExponentialBackoff(
                options.initialBackoff().toMillis(),
                options.multiplier(),
                options.maxBackoff().toMillis(),
                options.jitter());
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void add(ConsumerRecord<K, V> record) {
        Objects.requireNonNull(record, "record");
        TopicPartition tp = new TopicPartition(record.topic(), record.partition());
        long attempts = 0;
        while (true) {
            if (closed.isCancelled()) {
                throw new DeadLetterException("dead letter queue closed before " + tp + "@" + record.offset() + " was handed off");
            }
            try {
                DeadLetterReceipt receipt = producer.sendMessage(record);
                metrics.inc(MetricNames.DLQ_SENT, tp);
                log.debug("dead lettered {}@{} -> partition={} offset={}",
                        tp, record.offset(), receipt.partition(), receipt.offset());
                return;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new DeadLetterException("interrupted while dead lettering " + tp + "@" + record.offset(), ie);
            } catch (Exception e) {
                metrics.inc(MetricNames.DLQ_SEND_FAILED, tp);
                long delayMs = backoff.backoff(attempts++);
                log.warn("dead letter send failed for {}@{} attempt={} retryInMs={}: {}",
                        tp, record.offset(), attempts, delayMs, e.toString());
                if (closed.await(Duration.ofMillis(delayMs))) {
                    throw new DeadLetterException("gave up dead lettering " + tp + "@" + record.offset()
                            + " after " + attempts + " attempts", e);
                }
            }
        }
    }

    @Override
    public void close() {
        closed.cancel();
        try {
            producer.close();
        } catch (Exception e) {
            log.warn("failed to close dead letter producer", e);
        }
    }
}
