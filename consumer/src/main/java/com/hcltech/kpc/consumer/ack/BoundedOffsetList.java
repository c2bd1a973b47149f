package com.hcltech.kpc.consumer.ack;

/**
 * Fixed-size arena of offset slots, threaded into an offset-ordered doubly linked list.
 * <p>
 * Only unresolved entries occupy a slot: a slot goes back on the free list the moment its
 * entry is removed, wherever it sits in the order. Each slot carries a generation that is
 * bumped on every allocation, so a handle (slot, generation) can be checked for staleness.
 * <p>
 * Offsets must be added in strictly increasing order. For every entry the list remembers
 * the offset added just before it; that is what makes the commit level computable in O(1):
 * everything before the oldest live entry has been resolved.
 * <p>
 * Not thread-safe: callers synchronise.
 */
final class BoundedOffsetList {

    static final int NIL = -1;
    static final long NO_OFFSET = -1L;

    private final int capacity;

    private final long[] offsets;
    private final long[] predecessors;   // offset added immediately before this one
    private final int[] generations;
    private final SlotState[] states;
    private final int[] prev;
    private final int[] next;            // also chains the free list

    private int head = NIL;              // oldest live entry
    private int tail = NIL;              // newest live entry
    private int freeHead;
    private int size;

    private long lastAdded = NO_OFFSET;

    BoundedOffsetList(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.offsets = new long[capacity];
        this.predecessors = new long[capacity];
        this.generations = new int[capacity];
        this.states = new SlotState[capacity];
        this.prev = new int[capacity];
        this.next = new int[capacity];
        for (int i = 0; i < capacity; i++) {
            states[i] = SlotState.FREE;
            prev[i] = NIL;
            next[i] = i + 1 < capacity ? i + 1 : NIL;
        }
        this.freeHead = 0;
    }

    /**
     * Appends an offset at the tail.
     *
     * @return the slot index, or {@link #NIL} when every slot is in use
     * @throws IllegalArgumentException if offset is not greater than the last added offset
     */
    int add(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, was " + offset);
        }
        if (lastAdded != NO_OFFSET && offset <= lastAdded) {
            throw new IllegalArgumentException("offset " + offset + " is not after last tracked offset " + lastAdded);
        }
        if (freeHead == NIL) return NIL;

        int slot = freeHead;
        freeHead = next[slot];

        offsets[slot] = offset;
        predecessors[slot] = lastAdded;
        generations[slot]++;
        states[slot] = SlotState.PENDING;
        prev[slot] = tail;
        next[slot] = NIL;
        if (tail != NIL) next[tail] = slot;
        else head = slot;
        tail = slot;

        lastAdded = offset;
        size++;
        return slot;
    }

    /** Unlinks a live slot and returns it to the free list. */
    void remove(int slot) {
        if (states[slot] == SlotState.FREE) {
            throw new IllegalStateException("slot " + slot + " is not in use");
        }
        int p = prev[slot];
        int n = next[slot];
        if (p != NIL) next[p] = n;
        else head = n;
        if (n != NIL) prev[n] = p;
        else tail = p;

        states[slot] = SlotState.FREE;
        prev[slot] = NIL;
        next[slot] = freeHead;
        freeHead = slot;
        size--;
    }

    boolean isLive(int slot, int generation) {
        return slot >= 0 && slot < capacity
                && states[slot] != SlotState.FREE
                && generations[slot] == generation;
    }

    SlotState state(int slot) {
        return states[slot];
    }

    void markNacked(int slot) {
        states[slot] = SlotState.NACKED;
    }

    int generation(int slot) {
        return generations[slot];
    }

    long offset(int slot) {
        return offsets[slot];
    }

    /**
     * Offset of the newest entry such that it and everything added before it are resolved,
     * or {@link #NO_OFFSET} if there is none.
     */
    long resolvedPrefixEnd() {
        return head == NIL ? lastAdded : predecessors[head];
    }

    /** Offset of the oldest unresolved entry, or {@link #NO_OFFSET}. */
    long oldestOffset() {
        return head == NIL ? NO_OFFSET : offsets[head];
    }

    long lastAdded() {
        return lastAdded;
    }

    int size() {
        return size;
    }

    int capacity() {
        return capacity;
    }

    boolean isFull() {
        return freeHead == NIL;
    }

    boolean isEmpty() {
        return size == 0;
    }
}
