package com.hcltech.kpc.consumer.dlq;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/** Durable diversion for records whose processing failed. */
public interface DeadLetterQueue<K, V> extends AutoCloseable {

    /**
     * Blocks until the record has been durably handed off.
     *
     * @throws DeadLetterException if the queue is closed, or the calling thread interrupted,
     *                             before the hand-off succeeded
     */
    void add(ConsumerRecord<K, V> record);

    /** Abandons in-progress retries and releases the producer. */
    @Override
    void close();
}
