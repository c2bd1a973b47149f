package com.hcltech.kpc.consumer.dlq;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/** Single attempt at publishing a failed record to the dead-letter destination. */
public interface DeadLetterProducer<K, V> extends AutoCloseable {

    /**
     * Publishes the record and waits for the broker to accept it.
     *
     * @throws Exception on any failure; the caller decides whether to retry
     */
    DeadLetterReceipt sendMessage(ConsumerRecord<K, V> record) throws Exception;
}
