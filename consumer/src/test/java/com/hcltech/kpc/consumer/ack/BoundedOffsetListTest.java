package com.hcltech.kpc.consumer.ack;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundedOffsetListTest {

    @Test
    void addUntilFull_thenNil() {
        BoundedOffsetList list = new BoundedOffsetList(3);
        assertNotEquals(BoundedOffsetList.NIL, list.add(5));
        assertNotEquals(BoundedOffsetList.NIL, list.add(6));
        assertNotEquals(BoundedOffsetList.NIL, list.add(7));
        assertTrue(list.isFull());
        assertEquals(BoundedOffsetList.NIL, list.add(8));
        assertEquals(3, list.size());
    }

    @Test
    void removingFromTheMiddle_freesASlot_butKeepsHead() {
        BoundedOffsetList list = new BoundedOffsetList(3);
        int a = list.add(5);
        int b = list.add(6);
        list.add(7);

        list.remove(b);
        assertEquals(2, list.size());
        assertEquals(5, list.oldestOffset());
        assertEquals(BoundedOffsetList.NO_OFFSET, list.resolvedPrefixEnd());

        list.remove(a);
        assertEquals(7, list.oldestOffset());
        assertEquals(6, list.resolvedPrefixEnd());
    }

    @Test
    void emptyList_reportsLastAddedAsPrefixEnd() {
        BoundedOffsetList list = new BoundedOffsetList(2);
        assertEquals(BoundedOffsetList.NO_OFFSET, list.resolvedPrefixEnd());
        int a = list.add(41);
        int b = list.add(42);
        list.remove(b);
        list.remove(a);
        assertTrue(list.isEmpty());
        assertEquals(42, list.resolvedPrefixEnd());
        assertEquals(BoundedOffsetList.NO_OFFSET, list.oldestOffset());
    }

    @Test
    void freedSlotIsReused_withNewGeneration() {
        BoundedOffsetList list = new BoundedOffsetList(1);
        int s = list.add(1);
        int gen = list.generation(s);
        list.remove(s);
        assertFalse(list.isLive(s, gen));

        int s2 = list.add(2);
        assertEquals(s, s2);
        assertNotEquals(gen, list.generation(s2));
        assertTrue(list.isLive(s2, list.generation(s2)));
        assertFalse(list.isLive(s2, gen));
    }

    @Test
    void offsetsMustIncrease() {
        BoundedOffsetList list = new BoundedOffsetList(4);
        list.add(10);
        assertThrows(IllegalArgumentException.class, () -> list.add(10));
        assertThrows(IllegalArgumentException.class, () -> list.add(9));
        assertThrows(IllegalArgumentException.class, () -> new BoundedOffsetList(4).add(-1));
    }

    @Test
    void gapsInOffsetsAreFine() {
        BoundedOffsetList list = new BoundedOffsetList(4);
        int a = list.add(10);
        list.add(15);
        list.remove(a);
        assertEquals(10, list.resolvedPrefixEnd());
        assertEquals(15, list.oldestOffset());
    }

    @Test
    void removingAFreeSlotThrows() {
        BoundedOffsetList list = new BoundedOffsetList(2);
        int a = list.add(1);
        list.remove(a);
        assertThrows(IllegalStateException.class, () -> list.remove(a));
    }
}
