package com.hcltech.kpc.consumer.ack;

/**
 * Opaque handle for one tracked offset: a generation-checked index into the owning
 * {@link AckManager}'s slot arena. Valid for exactly one resolution.
 */
public final class AckId {

    private final Object owner;
    private final int slot;
    private final int generation;
    private final long offset;

    AckId(Object owner, int slot, int generation, long offset) {
        this.owner = owner;
        this.slot = slot;
        this.generation = generation;
        this.offset = offset;
    }

    Object owner() {
        return owner;
    }

    int slot() {
        return slot;
    }

    int generation() {
        return generation;
    }

    /** The tracked offset this handle resolves. */
    public long offset() {
        return offset;
    }

    @Override
    public String toString() {
        return "AckId{offset=" + offset + ", slot=" + slot + ", gen=" + generation + "}";
    }
}
