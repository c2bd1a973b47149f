package com.hcltech.kpc.consumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.time.Duration;

/**
 * Broker-side reader for a single topic-partition.
 * <p>
 * Records come out of {@link #poll(Duration)} in strictly increasing offset order. When the
 * feed ends (partition revoked, reader shut down) {@code poll} returns {@code null} and
 * {@link #isFeedClosed()} reports true; records already buffered are returned first.
 */
public interface PartitionClient<K, V> extends AutoCloseable {

    String topic();

    int partition();

    /** Next record, or {@code null} if none arrived within {@code timeout} or the feed is closed. */
    ConsumerRecord<K, V> poll(Duration timeout) throws InterruptedException;

    /** True once {@link #poll(Duration)} will never return another record. */
    boolean isFeedClosed();

    /** Offset the broker will assign to the next record produced to this partition. */
    long highWaterMarkOffset();

    /** Checkpoints {@code offset} as fully processed. Marks below an earlier mark are ignored. */
    void markPartitionOffset(String topic, int partition, long offset, String metadata);
}
