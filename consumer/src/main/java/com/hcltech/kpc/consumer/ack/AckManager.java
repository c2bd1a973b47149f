package com.hcltech.kpc.consumer.ack;

import java.util.Objects;

/**
 * Bounded, thread-safe tracker of in-flight offsets for one partition.
 * <p>
 * The intake loop registers offsets in strictly increasing order with {@link #track(long)};
 * any number of workers resolve them out of order with {@link #ack(AckId)} and
 * {@link #nack(AckId)}; the commit loop reads {@link #commitLevel()}.
 * <p>
 * Invariants:
 * <ul>
 *   <li>At most {@code maxOutstanding} offsets are unresolved at any time.</li>
 *   <li>The commit level never passes an unresolved offset, and never decreases.</li>
 *   <li>A nacked offset is still unresolved: it holds the commit level back until it is acked
 *       (normally after a successful dead-letter hand-off).</li>
 * </ul>
 */
public final class AckManager {

    /** Returned by {@link #commitLevel()} while no offset has been committable yet. */
    public static final long NOTHING_COMMITTED = BoundedOffsetList.NO_OFFSET;

    private final Object lock = new Object();
    private final BoundedOffsetList list;
    private long committed = NOTHING_COMMITTED;

    public AckManager(int maxOutstanding) {
        if (maxOutstanding < 1) throw new IllegalArgumentException("maxOutstanding must be >= 1");
        this.list = new BoundedOffsetList(maxOutstanding);
    }

    /**
     * Registers the next offset. Never blocks.
     *
     * @throws CapacityExceededException when {@code maxOutstanding} offsets are already unresolved
     * @throws IllegalArgumentException  when the offset is not after the last tracked offset
     */
    public AckId track(long offset) throws CapacityExceededException {
        synchronized (lock) {
            int slot = list.add(offset);
            if (slot == BoundedOffsetList.NIL) {
                throw new CapacityExceededException(list.capacity());
            }
            return new AckId(this, slot, list.generation(slot), offset);
        }
    }

    /**
     * Resolves the offset. Valid on a pending or nacked handle.
     *
     * @throws StaleAckIdException if the handle is already resolved or was issued elsewhere
     */
    public void ack(AckId id) {
        synchronized (lock) {
            int slot = liveSlot(id, "ack");
            list.remove(slot);
        }
    }

    /**
     * Records that processing failed. The offset stays unresolved, and keeps its slot, until
     * {@link #ack(AckId)} is called for it.
     *
     * @throws StaleAckIdException if the handle is already resolved or already nacked
     */
    public void nack(AckId id) {
        synchronized (lock) {
            int slot = liveSlot(id, "nack");
            if (list.state(slot) == SlotState.NACKED) {
                throw new StaleAckIdException("offset " + id.offset() + " already nacked");
            }
            list.markNacked(slot);
        }
    }

    /**
     * The largest offset O such that O and every offset tracked before it are resolved,
     * or {@link #NOTHING_COMMITTED}. Monotonic across calls.
     */
    public long commitLevel() {
        synchronized (lock) {
            long level = list.resolvedPrefixEnd();
            if (level > committed) committed = level;
            return committed;
        }
    }

    /** Number of unresolved offsets, nacked ones included. */
    public int pending() {
        synchronized (lock) {
            return list.size();
        }
    }

    /** Oldest unresolved offset, or -1 when nothing is outstanding. */
    public long oldestPending() {
        synchronized (lock) {
            return list.oldestOffset();
        }
    }

    public int maxOutstanding() {
        return list.capacity();
    }

    private int liveSlot(AckId id, String op) {
        Objects.requireNonNull(id, "id");
        if (id.owner() != this) {
            throw new StaleAckIdException(op + " of " + id + " issued by another ack manager");
        }
        if (!list.isLive(id.slot(), id.generation())) {
            throw new StaleAckIdException(op + " of already resolved offset " + id.offset());
        }
        return id.slot();
    }
}
