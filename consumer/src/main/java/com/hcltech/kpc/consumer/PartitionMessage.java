package com.hcltech.kpc.consumer;

import com.hcltech.kpc.consumer.ack.AckId;
import com.hcltech.kpc.consumer.ack.AckManager;
import com.hcltech.kpc.consumer.dlq.DeadLetterQueue;
import com.hcltech.kpc.metrics.MetricNames;
import com.hcltech.kpc.metrics.MetricsRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Headers;

import java.util.Objects;

/** {@link Message} bound to the ack tracker and dead-letter queue of its partition. */
final class PartitionMessage<K, V> implements Message<K, V> {

    private final ConsumerRecord<K, V> record;
    private final AckId ackId;
    private final AckManager ackManager;
    private final DeadLetterQueue<K, V> deadLetters;
    private final MetricsRegistry<TopicPartition> metrics;
    private final TopicPartition tp;

    PartitionMessage(ConsumerRecord<K, V> record,
                     AckId ackId,
                     AckManager ackManager,
                     DeadLetterQueue<K, V> deadLetters,
                     MetricsRegistry<TopicPartition> metrics,
                     TopicPartition tp) {
        this.record = Objects.requireNonNull(record, "record");
        this.ackId = Objects.requireNonNull(ackId, "ackId");
        this.ackManager = Objects.requireNonNull(ackManager, "ackManager");
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tp = Objects.requireNonNull(tp, "tp");
    }

    @Override
    public String topic() {
        return record.topic();
    }

    @Override
    public int partition() {
        return record.partition();
    }

    @Override
    public long offset() {
        return record.offset();
    }

    @Override
    public K key() {
        return record.key();
    }

    @Override
    public V value() {
        return record.value();
    }

    @Override
    public Headers headers() {
        return record.headers();
    }

    @Override
    public long timestamp() {
        return record.timestamp();
    }

    @Override
    public ConsumerRecord<K, V> record() {
        return record;
    }

    @Override
    public void ack() {
        ackManager.ack(ackId);
        metrics.inc(MetricNames.PARTITION_ACKS, tp);
    }

    @Override
    public void nack() {
        ackManager.nack(ackId);
        metrics.inc(MetricNames.PARTITION_NACKS, tp);
        deadLetters.add(record);
        ackManager.ack(ackId);
    }

    @Override
    public String toString() {
        return "Message{" + tp + "@" + record.offset() + "}";
    }
}
