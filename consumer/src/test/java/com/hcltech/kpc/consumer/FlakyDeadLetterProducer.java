package com.hcltech.kpc.consumer;

import com.hcltech.kpc.consumer.dlq.DeadLetterProducer;
import com.hcltech.kpc.consumer.dlq.DeadLetterReceipt;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Fails the first {@code failures} sends, then accepts everything. */
public class FlakyDeadLetterProducer implements DeadLetterProducer<String, String> {

    private final AtomicInteger failuresLeft;
    public final AtomicInteger attempts = new AtomicInteger();
    public final List<Long> sent = new CopyOnWriteArrayList<>();
    public final AtomicInteger closes = new AtomicInteger();

    public FlakyDeadLetterProducer(int failures) {
        this.failuresLeft = new AtomicInteger(failures);
    }

    public void failNext(int n) {
        failuresLeft.set(n);
    }

    @Override
    public DeadLetterReceipt sendMessage(ConsumerRecord<String, String> record) throws Exception {
        attempts.incrementAndGet();
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new Exception("intermittent error");
        }
        sent.add(record.offset());
        return new DeadLetterReceipt(0, sent.size() - 1);
    }

    @Override
    public void close() {
        closes.incrementAndGet();
    }
}
