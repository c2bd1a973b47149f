package com.hcltech.kpc.consumer.dlq;

/** A dead-letter hand-off was abandoned before it succeeded. Nothing was acknowledged. */
public class DeadLetterException extends RuntimeException {

    public DeadLetterException(String message) {
        super(message);
    }

    public DeadLetterException(String message, Throwable cause) {
        super(message, cause);
    }
}
