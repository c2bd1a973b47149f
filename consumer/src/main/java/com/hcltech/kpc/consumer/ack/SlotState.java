package com.hcltech.kpc.consumer.ack;

/** State of one slot in a {@link BoundedOffsetList}. */
enum SlotState {
    /** On the free list. */
    FREE,
    /** Tracked, not yet resolved. */
    PENDING,
    /** Processing failed; still unresolved until the dead-letter hand-off succeeds. */
    NACKED
}
