package com.hcltech.kpc.kafkaconsumer;

import com.hcltech.kpc.consumer.ConsumerOptions;
import com.hcltech.kpc.consumer.DeadLetterOptions;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * AppConfig:
 *  - Consumer knobs (concurrency, buffer, processing time, retry and poll intervals, DLQ backoff)
 *  - Kafka connection and partition to consume
 *  - Ready-made Properties for the KafkaConsumer and the dead-letter KafkaProducer
 *  - Loaded from application.properties on the classpath.
 */
public final class AppConfig {

    private final Properties props;

    AppConfig(Properties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /** Load application.properties from classpath. */
    public static AppConfig load() {
        return load("application.properties");
    }

    public static AppConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream is = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) props.load(is);
            else throw new IllegalStateException(resource + " not found on classpath");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        }
        return new AppConfig(props);
    }

    // ---------------- what to consume ----------------

    public String topic() {
        return get("kafka.topic", "test-topic");
    }

    public int partition() {
        return getInt("kafka.partition", 0);
    }

    public TopicPartition topicPartition() {
        return new TopicPartition(topic(), partition());
    }

    public String dlqTopic() {
        return get("kafka.dlq.topic", topic() + ".dlq");
    }

    // ---------------- consumer knobs ----------------

    public int concurrency() {
        return getInt("consumer.concurrency", 4);
    }

    public int bufferCapacity() {
        return getInt("consumer.buffer.capacity", 16);
    }

    public long maxProcessingMs() {
        return getLong("consumer.max.processing.ms", 5000);
    }

    public long capacityRetryMs() {
        return getLong("consumer.capacity.retry.ms", 100);
    }

    public long pollMs() {
        return getLong("consumer.poll.ms", 100);
    }

    public long dlqInitialBackoffMs() {
        return getLong("dlq.backoff.initial.ms", 10);
    }

    public long dlqMaxBackoffMs() {
        return getLong("dlq.backoff.max.ms", 10_000);
    }

    public int metricsPrintMs() {
        return getInt("metrics.print.ms", 2000);
    }

    public ConsumerOptions consumerOptions() {
        DeadLetterOptions dlq = new DeadLetterOptions(
                Duration.ofMillis(dlqInitialBackoffMs()), 2, Duration.ofMillis(dlqMaxBackoffMs()), 0.2);
        return ConsumerOptions.of(concurrency(), bufferCapacity(), Duration.ofMillis(maxProcessingMs()))
                .withCapacityRetryInterval(Duration.ofMillis(capacityRetryMs()))
                .withPollInterval(Duration.ofMillis(pollMs()))
                .withDeadLetter(dlq);
    }

    // ---------------- Kafka-specific ----------------

    public String clientId() {
        return get("kafka.client.id", "kpc-1");
    }

    public String groupId() {
        return get("kafka.group.id", "kpc-group");
    }

    public String bootstrapServers() {
        return get("kafka.bootstrap.servers", "localhost:9092");
    }

    /** Properties for the partition's KafkaConsumer. Raw {@code kafka.consumer.*} keys pass through. */
    public Properties consumerProperties() {
        Properties out = passThrough("kafka.consumer.");
        out.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers());
        out.put(ConsumerConfig.GROUP_ID_CONFIG, groupId());
        out.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId());
        out.putIfAbsent(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        out.putIfAbsent(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        out.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        return out;
    }

    /** Properties for the dead-letter KafkaProducer. Raw {@code kafka.producer.*} keys pass through. */
    public Properties producerProperties() {
        Properties out = passThrough("kafka.producer.");
        out.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers());
        out.put(ProducerConfig.CLIENT_ID_CONFIG, clientId() + "-dlq");
        out.putIfAbsent(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        out.putIfAbsent(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        out.putIfAbsent(ProducerConfig.ACKS_CONFIG, "all");
        return out;
    }

    // ---------------- Helpers ----------------

    private Properties passThrough(String prefix) {
        Properties out = new Properties();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(prefix)) out.put(key.substring(prefix.length()), props.getProperty(key));
        }
        return out;
    }

    private String get(String key, String def) {
        return Objects.toString(props.getProperty(key), def);
    }

    private int getInt(String key, int def) {
        return Integer.parseInt(get(key, Integer.toString(def)).trim());
    }

    private long getLong(String key, long def) {
        return Long.parseLong(get(key, Long.toString(def)).trim());
    }
}
