package com.hcltech.kpc.kafkaconsumer;

import com.hcltech.kpc.common.async.DaemonThreadFactory;
import com.hcltech.kpc.common.lifecycle.LifecycleState;
import com.hcltech.kpc.consumer.ConsumerOptions;
import com.hcltech.kpc.consumer.Message;
import com.hcltech.kpc.consumer.PartitionConsumer;
import com.hcltech.kpc.consumer.dlq.DeadLetterException;
import com.hcltech.kpc.consumer.dlq.RetryingDeadLetterQueue;
import com.hcltech.kpc.metrics.LoggingMetricsPrinter;
import com.hcltech.kpc.metrics.MetricsRegistry;
import com.hcltech.kpc.metrics.MetricsScheduler;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws InterruptedException {
        // 1) Load config
        AppConfig cfg = AppConfig.load();
        ConsumerOptions options = cfg.consumerOptions();
        TopicPartition tp = cfg.topicPartition();

        // 2) Metrics
        MetricsRegistry<TopicPartition> registry = new MetricsRegistry<>();
        MetricsScheduler<TopicPartition> scheduler = new MetricsScheduler<>(
                registry, new LoggingMetricsPrinter<>(), Duration.ofMillis(cfg.metricsPrintMs()));

        // 3) Kafka partition client + dead-letter queue
        KafkaPartitionClient<String, String> client =
                new KafkaPartitionClient<>(new KafkaConsumer<>(cfg.consumerProperties()), tp);
        RetryingDeadLetterQueue<String, String> dlq = new RetryingDeadLetterQueue<>(
                new KafkaDeadLetterProducer<>(new KafkaProducer<String, String>(cfg.producerProperties()), cfg.dlqTopic()),
                options.deadLetter(),
                registry);

        // 4) Partition consumer
        BlockingQueue<Message<String, String>> output = options.newOutputQueue();
        PartitionConsumer<String, String> consumer = new PartitionConsumer<>(client, output, dlq, options, registry);

        // 5) Workers
        ExecutorService workers = Executors.newFixedThreadPool(options.concurrency(), new DaemonThreadFactory("worker"));
        for (int i = 0; i < options.concurrency(); i++) {
            workers.execute(() -> work(output, consumer));
        }

        // 6) Run
        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, draining {}", tp);
            consumer.drain(options.maxProcessingTime());
            dlq.close();
            workers.shutdownNow();
            scheduler.close();
            done.countDown();
        }, "shutdown"));

        scheduler.start();
        consumer.start();
        log.info("Consuming {} with {} workers, dead letters to {}", tp, options.concurrency(), cfg.dlqTopic());
        done.await();
    }

    /** Demo processing: blank values are rejected to the dead-letter topic, everything else is acked. */
    static void work(BlockingQueue<Message<String, String>> output, PartitionConsumer<String, String> consumer) {
        try {
            while (consumer.state() != LifecycleState.STOPPED || !output.isEmpty()) {
                Message<String, String> msg = output.poll(100, TimeUnit.MILLISECONDS);
                if (msg == null) continue;
                if (msg.value() == null || msg.value().isBlank()) {
                    log.warn("rejecting offset {} of {}-{}", msg.offset(), msg.topic(), msg.partition());
                    try {
                        msg.nack();
                    } catch (DeadLetterException e) {
                        log.warn("dead-letter hand-off abandoned, offset {} will be redelivered", msg.offset(), e);
                    }
                } else {
                    log.debug("processed offset {} key={}", msg.offset(), msg.key());
                    msg.ack();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
