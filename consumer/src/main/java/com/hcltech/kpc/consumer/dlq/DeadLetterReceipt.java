package com.hcltech.kpc.consumer.dlq;

/** Where the dead-letter copy of a record landed. */
public record DeadLetterReceipt(int partition, long offset) {
}
