package com.hcltech.kpc.consumer.ack;

/** An {@link AckId} was resolved twice, or presented to a manager that did not issue it. */
public class StaleAckIdException extends IllegalStateException {

    public StaleAckIdException(String message) {
        super(message);
    }
}
