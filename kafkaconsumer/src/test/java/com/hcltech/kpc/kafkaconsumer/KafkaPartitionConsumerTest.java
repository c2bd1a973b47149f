package com.hcltech.kpc.kafkaconsumer;

import com.hcltech.kpc.common.lifecycle.LifecycleState;
import com.hcltech.kpc.consumer.ConsumerOptions;
import com.hcltech.kpc.consumer.DeadLetterOptions;
import com.hcltech.kpc.consumer.Message;
import com.hcltech.kpc.consumer.PartitionConsumer;
import com.hcltech.kpc.consumer.dlq.RetryingDeadLetterQueue;
import com.hcltech.kpc.metrics.MetricNames;
import com.hcltech.kpc.metrics.MetricsRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/** PartitionConsumer over a real KafkaPartitionClient backed by Kafka's MockConsumer and MockProducer. */
class KafkaPartitionConsumerTest {

    private static final TopicPartition TP = new TopicPartition("orders", 0);

    private final List<Long> commits = new CopyOnWriteArrayList<>();
    private MockConsumer<String, String> kafka;
    private MockProducer<String, String> dlqKafka;
    private MetricsRegistry<TopicPartition> metrics;
    private RetryingDeadLetterQueue<String, String> dlq;
    private PartitionConsumer<String, String> consumer;
    private BlockingQueue<Message<String, String>> output;

    @BeforeEach
    void setUp() {
        kafka = new MockConsumer<>(OffsetResetStrategy.EARLIEST) {
            @Override
            public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
                super.commitSync(offsets);
                commits.add(offsets.get(TP).offset());
            }
        };
        kafka.updateBeginningOffsets(Map.of(TP, 0L));
        dlqKafka = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        metrics = new MetricsRegistry<>();

        ConsumerOptions opts = ConsumerOptions.of(2, 4, Duration.ofMillis(20))
                .withPollInterval(Duration.ofMillis(5))
                .withDeadLetter(new DeadLetterOptions(Duration.ofMillis(1), 2, Duration.ofMillis(5), 0.0));
        output = opts.newOutputQueue();
        dlq = new RetryingDeadLetterQueue<>(new KafkaDeadLetterProducer<>(dlqKafka, "orders.dlq"), opts.deadLetter(), metrics);
        consumer = new PartitionConsumer<>(new KafkaPartitionClient<>(kafka, TP), output, dlq, opts, metrics);
    }

    @AfterEach
    void tearDown() {
        consumer.stop();
        dlq.close();
    }

    private void produce(long from, long toExclusive) {
        for (long o = from; o < toExclusive; o++) {
            kafka.addRecord(new ConsumerRecord<>(TP.topic(), TP.partition(), o, "k" + o, o == 3 ? "" : "v" + o));
        }
    }

    private Message<String, String> next() throws InterruptedException {
        Message<String, String> m = output.poll(5, TimeUnit.SECONDS);
        assertNotNull(m, "expected a message");
        return m;
    }

    @Test
    void ackedAndDeadLetteredOffsetsAreCommittedToKafka() throws Exception {
        consumer.start();
        produce(0, 5);

        for (long expected = 0; expected < 5; expected++) {
            Message<String, String> m = next();
            assertEquals(expected, m.offset());
            if (m.value().isEmpty()) m.nack();
            else m.ack();
        }

        consumer.drain(Duration.ofSeconds(5));

        assertEquals(LifecycleState.STOPPED, consumer.state());
        assertTrue(kafka.closed());
        assertEquals(5L, commits.get(commits.size() - 1), "committed offset is the next one to read");
        assertEquals(1, dlqKafka.history().size());
        assertEquals("orders.dlq", dlqKafka.history().get(0).topic());
        assertEquals("k3", dlqKafka.history().get(0).key());
        assertEquals(1, metrics.counter(MetricNames.DLQ_SENT, TP));
    }

    @Test
    void unresolvedOffsetIsNotCommitted() throws Exception {
        consumer.start();
        produce(0, 3);

        Message<String, String> m0 = next();
        Message<String, String> m1 = next();
        Message<String, String> m2 = next();
        m0.ack();
        m2.ack();

        consumer.drain(Duration.ofMillis(50));

        assertTrue(kafka.closed());
        assertEquals(1L, commits.get(commits.size() - 1));
        assertEquals(1, consumer.pending());
        assertEquals(1, m1.offset());
    }
}
