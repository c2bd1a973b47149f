package com.hcltech.kpc.kafkaconsumer;

import com.hcltech.kpc.consumer.dlq.DeadLetterReceipt;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaDeadLetterProducerTest {

    @Mock
    Producer<String, String> producer;

    @Captor
    ArgumentCaptor<ProducerRecord<String, String>> sent;

    private static ConsumerRecord<String, String> failed() {
        ConsumerRecord<String, String> r = new ConsumerRecord<>("orders", 3, 42L, "key-42", "bad payload");
        r.headers().add("traceparent", "00-abc-01".getBytes(StandardCharsets.UTF_8));
        return r;
    }

    private static String header(ProducerRecord<?, ?> r, String key) {
        Header h = r.headers().lastHeader(key);
        return h == null ? null : new String(h.value(), StandardCharsets.UTF_8);
    }

    @Test
    void republishesKeyValueAndHeaders_withOrigin() throws Exception {
        RecordMetadata md = new RecordMetadata(new TopicPartition("orders.dlq", 1), 40L, 0, 0L, 0, 0);
        when(producer.send(any(ProducerRecord.class))).thenReturn(CompletableFuture.completedFuture(md));

        var dlq = new KafkaDeadLetterProducer<>(producer, "orders.dlq");
        DeadLetterReceipt receipt = dlq.sendMessage(failed());

        assertEquals(new DeadLetterReceipt(1, 40L), receipt);
        verify(producer).send(sent.capture());
        ProducerRecord<String, String> out = sent.getValue();
        assertEquals("orders.dlq", out.topic());
        assertNull(out.partition());
        assertEquals("key-42", out.key());
        assertEquals("bad payload", out.value());
        assertEquals("00-abc-01", header(out, "traceparent"));
        assertEquals("orders", header(out, KafkaDeadLetterProducer.ORIGIN_TOPIC));
        assertEquals("3", header(out, KafkaDeadLetterProducer.ORIGIN_PARTITION));
        assertEquals("42", header(out, KafkaDeadLetterProducer.ORIGIN_OFFSET));
    }

    @Test
    void brokerFailureIsRethrownUnwrapped() {
        when(producer.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.<RecordMetadata>failedFuture(new TimeoutException("no ack from broker")));

        var dlq = new KafkaDeadLetterProducer<>(producer, "orders.dlq");
        TimeoutException e = assertThrows(TimeoutException.class, () -> dlq.sendMessage(failed()));
        assertEquals("no ack from broker", e.getMessage());
    }

    @Test
    void closeClosesTheProducer() {
        new KafkaDeadLetterProducer<>(producer, "orders.dlq").close();
        verify(producer).close();
    }
}
