package com.hcltech.kpc.metrics;

/** Metric names emitted by the partition consumer core. */
public final class MetricNames {
    private MetricNames() {
    }

    // lifecycle
    public static final String PARTITION_STARTED = "kafka.partition.started";
    public static final String PARTITION_STOPPED = "kafka.partition.stopped";
    public static final String PARTITION_CLOSE_FAILED = "kafka.partition.close-failed";

    // intake
    public static final String PARTITION_LAG = "kafka.partition.lag";
    public static final String PARTITION_READ_OFFSET = "kafka.partition.read-offset";
    public static final String PARTITION_MESSAGES_IN = "kafka.partition.messages-in";
    public static final String PARTITION_ACKMGR_LIST_FULL = "kafka.partition.ackmgr.list-full";

    // commit
    public static final String PARTITION_COMMIT_OFFSET = "kafka.partition.commit-offset";
    public static final String PARTITION_BACKLOG = "kafka.partition.backlog";

    // resolution
    public static final String PARTITION_ACKS = "kafka.partition.acks";
    public static final String PARTITION_NACKS = "kafka.partition.nacks";

    // dead letter
    public static final String DLQ_SENT = "kafka.dlq.sent";
    public static final String DLQ_SEND_FAILED = "kafka.dlq.send-failed";
}
