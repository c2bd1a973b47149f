package com.hcltech.kpc.kafkaconsumer;

import com.hcltech.kpc.consumer.PartitionClient;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link PartitionClient} over a Kafka {@link Consumer} that is manually assigned one partition.
 * <p>
 * KafkaConsumer is not thread-safe, so every call into it happens under one lock, and only
 * {@link #poll(Duration)} and {@link #close()} make them. Marks are held in memory and committed
 * by the polling thread before each fetch, and once more on close.
 * The committed offset is {@code marked + 1}, the next offset to read.
 */
public final class KafkaPartitionClient<K, V> implements PartitionClient<K, V> {
    private static final Logger log = LoggerFactory.getLogger(KafkaPartitionClient.class);

    private final Consumer<K, V> consumer;
    private final TopicPartition tp;
    private final Object consumerLock = new Object();

    // polling thread only
    private final ArrayDeque<ConsumerRecord<K, V>> buffered = new ArrayDeque<>();
    private long lastHandedOut = -1L;

    private final AtomicLong marked = new AtomicLong(-1L);
    private volatile String markedMetadata = "";
    private long committed = -1L; // guarded by consumerLock

    private final AtomicLong highWaterMark = new AtomicLong(0L);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean feedClosed;

    public KafkaPartitionClient(Consumer<K, V> consumer, TopicPartition tp) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.tp = Objects.requireNonNull(tp, "tp");
        consumer.assign(List.of(tp));
    }

    @Override
    public String topic() {
        return tp.topic();
    }

    @Override
    public int partition() {
        return tp.partition();
    }

    @Override
    public ConsumerRecord<K, V> poll(Duration timeout) {
        ConsumerRecord<K, V> next = nextBuffered();
        if (next != null || feedClosed || closed.get()) return next;

        synchronized (consumerLock) {
            if (closed.get()) return null;
            try {
                commitMarked();
            } catch (WakeupException e) {
                return null;
            } catch (KafkaException e) {
                log.warn("commit failed for {}, will retry on next poll", tp, e);
            }
            ConsumerRecords<K, V> records;
            try {
                records = consumer.poll(timeout);
            } catch (WakeupException e) {
                return null;
            }
            for (ConsumerRecord<K, V> r : records.records(tp)) buffered.add(r);
            refreshHighWaterMark();
        }
        return nextBuffered();
    }

    private ConsumerRecord<K, V> nextBuffered() {
        ConsumerRecord<K, V> r;
        while ((r = buffered.poll()) != null) {
            // a re-fetch after a consumer-side reset can repeat offsets we already handed out
            if (r.offset() > lastHandedOut) {
                lastHandedOut = r.offset();
                return r;
            }
        }
        return null;
    }

    private void refreshHighWaterMark() {
        OptionalLong lag = consumer.currentLag(tp);
        long hwm = lag.isPresent() ? consumer.position(tp) + lag.getAsLong() : lastHandedOutOrBuffered() + 1;
        highWaterMark.accumulateAndGet(hwm, Math::max);
    }

    private long lastHandedOutOrBuffered() {
        ConsumerRecord<K, V> last = buffered.peekLast();
        return last == null ? lastHandedOut : Math.max(lastHandedOut, last.offset());
    }

    /** Stops the record feed; buffered records are still returned. Use on partition revocation. */
    public void closeFeed() {
        feedClosed = true;
    }

    @Override
    public boolean isFeedClosed() {
        return closed.get() || (feedClosed && buffered.isEmpty());
    }

    @Override
    public long highWaterMarkOffset() {
        return highWaterMark.get();
    }

    @Override
    public void markPartitionOffset(String topic, int partition, long offset, String metadata) {
        if (!tp.topic().equals(topic) || tp.partition() != partition) {
            throw new IllegalArgumentException("client for " + tp + " cannot mark " + topic + "-" + partition);
        }
        if (offset < 0) return;
        markedMetadata = metadata == null ? "" : metadata;
        marked.accumulateAndGet(offset, Math::max);
    }

    /** Last offset marked as processed, -1 if none. */
    public long markedOffset() {
        return marked.get();
    }

    private void commitMarked() {
        long m = marked.get();
        if (m <= committed) return;
        consumer.commitSync(Map.of(tp, new OffsetAndMetadata(m + 1, markedMetadata)));
        committed = m;
        log.debug("committed topic={} partition={} next={}", tp.topic(), tp.partition(), m + 1);
    }

    /** Commits the last mark and closes the consumer. Idempotent. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        feedClosed = true;
        consumer.wakeup();
        synchronized (consumerLock) {
            try {
                try {
                    commitMarked();
                } catch (WakeupException e) {
                    // wakeup was not consumed by a poll; it is now
                    commitMarked();
                }
            } finally {
                consumer.close();
                log.info("kafka partition client closed topic={} partition={} committed={}",
                        tp.topic(), tp.partition(), committed);
            }
        }
    }
}
