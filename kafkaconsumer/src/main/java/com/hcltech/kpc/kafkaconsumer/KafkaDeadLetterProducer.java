package com.hcltech.kpc.kafkaconsumer;

import com.hcltech.kpc.consumer.dlq.DeadLetterProducer;
import com.hcltech.kpc.consumer.dlq.DeadLetterReceipt;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeader;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutionException;

/**
 * Re-publishes a failed record to a dead-letter topic, keeping its key, value and headers and
 * adding where it came from. Blocks until the broker acknowledges the write.
 */
public final class KafkaDeadLetterProducer<K, V> implements DeadLetterProducer<K, V> {

    public static final String ORIGIN_TOPIC = "kpc.origin.topic";
    public static final String ORIGIN_PARTITION = "kpc.origin.partition";
    public static final String ORIGIN_OFFSET = "kpc.origin.offset";

    private final Producer<K, V> producer;
    private final String topic;

    public KafkaDeadLetterProducer(Producer<K, V> producer, String topic) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.topic = Objects.requireNonNull(topic, "topic");
    }

    public String topic() {
        return topic;
    }

    @Override
    public DeadLetterReceipt sendMessage(ConsumerRecord<K, V> record) throws Exception {
        ProducerRecord<K, V> out = new ProducerRecord<>(topic, record.key(), record.value());
        for (Header h : record.headers()) {
            out.headers().add(h);
        }
        out.headers().add(header(ORIGIN_TOPIC, record.topic()));
        out.headers().add(header(ORIGIN_PARTITION, Integer.toString(record.partition())));
        out.headers().add(header(ORIGIN_OFFSET, Long.toString(record.offset())));

        try {
            RecordMetadata md = producer.send(out).get();
            return new DeadLetterReceipt(md.partition(), md.offset());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception) throw (Exception) e.getCause();
            throw e;
        }
    }

    private static Header header(String key, String value) {
        return new RecordHeader(key, value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void close() {
        producer.close();
    }
}
