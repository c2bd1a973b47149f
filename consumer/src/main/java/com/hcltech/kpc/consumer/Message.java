package com.hcltech.kpc.consumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Headers;

/**
 * One record handed to a downstream worker. The worker owns it until it calls exactly one of
 * {@link #ack()} or {@link #nack()}.
 */
public interface Message<K, V> {

    String topic();

    int partition();

    long offset();

    K key();

    V value();

    Headers headers();

    /** Record timestamp in epoch millis, -1 if the broker did not supply one. */
    long timestamp();

    ConsumerRecord<K, V> record();

    /** Processing succeeded. */
    void ack();

    /**
     * Processing failed: hand the record to the dead-letter queue, blocking while sends are
     * retried, then resolve it. Until the hand-off succeeds the offset is not committable.
     *
     * @throws com.hcltech.kpc.consumer.dlq.DeadLetterException if the hand-off was abandoned;
     *         the offset then stays uncommitted and will be redelivered
     */
    void nack();
}
