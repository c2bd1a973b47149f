package com.hcltech.kpc.kafkaconsumer;

import com.hcltech.kpc.consumer.ConsumerOptions;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.SynchronousQueue;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void loadsValuesAndDefaultsFromClasspath() {
        AppConfig cfg = AppConfig.load("test-app.properties");

        assertEquals(new TopicPartition("orders", 7), cfg.topicPartition());
        assertEquals("orders.dlq", cfg.dlqTopic());
        assertEquals("kpc-1", cfg.clientId());

        ConsumerOptions opts = cfg.consumerOptions();
        assertEquals(8, opts.concurrency());
        assertEquals(0, opts.outputBufferCapacity());
        assertEquals(9, opts.maxOutstanding());
        assertEquals(Duration.ofMillis(1500), opts.maxProcessingTime());
        assertEquals(Duration.ofMillis(100), opts.pollInterval());
        assertEquals(Duration.ofMillis(100), opts.capacityRetryInterval());
        assertEquals(Duration.ofMillis(10), opts.deadLetter().initialBackoff());
        assertInstanceOf(SynchronousQueue.class, opts.newOutputQueue());
    }

    @Test
    void consumerPropertiesNeverAutoCommit() {
        Properties p = AppConfig.load("test-app.properties").consumerProperties();

        assertEquals("broker-1:9092,broker-2:9092", p.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("orders-group", p.get(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals("false", p.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        assertEquals("50", p.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
        assertEquals(StringDeserializer.class.getName(), p.get(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG));
        assertFalse(p.containsKey("kafka.topic"));
    }

    @Test
    void producerPropertiesPassThroughOverrides() {
        Properties p = AppConfig.load("test-app.properties").producerProperties();

        assertEquals("1", p.get(ProducerConfig.ACKS_CONFIG));
        assertEquals("kpc-1-dlq", p.get(ProducerConfig.CLIENT_ID_CONFIG));
        assertFalse(p.containsKey(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
    }

    @Test
    void emptyPropertiesUseDefaults() {
        AppConfig cfg = new AppConfig(new Properties());
        assertEquals("test-topic", cfg.topic());
        assertEquals("test-topic.dlq", cfg.dlqTopic());
        assertEquals(0, cfg.partition());
        assertEquals(ConsumerOptions.of(4, 16, Duration.ofMillis(5000)).maxOutstanding(),
                cfg.consumerOptions().maxOutstanding());
        assertEquals("all", cfg.producerProperties().get(ProducerConfig.ACKS_CONFIG));
    }

    @Test
    void missingResourceFails() {
        assertThrows(IllegalStateException.class, () -> AppConfig.load("does-not-exist.properties"));
    }

    @Test
    void badNumberFails() {
        Properties p = new Properties();
        p.setProperty("consumer.concurrency", "lots");
        assertThrows(NumberFormatException.class, () -> new AppConfig(p).consumerOptions());
    }
}
