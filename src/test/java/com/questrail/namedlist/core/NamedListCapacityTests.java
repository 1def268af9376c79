package com.questrail.namedlist.core;

import com.questrail.namedlist.api.Named;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamedListCapacityTests
{
    record Item(String name) implements Named { }

    private static NamedList<Item> filled(NamedList<Item> list, int count) {
        for (int i = 0; i < count; i++) {
            list.push(new Item("n" + i));
        }
        return list;
    }

    @Test
    void capacityHintAvoidsReallocation() {
        NamedList<Item> list = NamedList.withCapacity(32);
        assertEquals(32, list.capacity());

        filled(list, 32);

        assertEquals(32, list.capacity());
        assertEquals(32, list.size());
        list.assertConsistent();
    }

    @Test
    void zeroCapacityAllocatesNothing() {
        NamedList<Item> list = new NamedList<>(0);
        assertEquals(0, list.capacity());

        list.push(new Item("a"));
        assertTrue(list.capacity() >= 1);
    }

    @Test
    void negativeCapacityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new NamedList<Item>(-1));
    }

    @Test
    void reserveIsObservablyTransparent() {
        NamedList<Item> reserved = filled(new NamedList<>(), 3);
        reserved.reserve(50);
        int capacity = reserved.capacity();
        assertTrue(capacity >= 53);

        filled(reserved, 53);

        assertEquals(capacity, reserved.capacity());
        assertEquals(filled(new NamedList<>(), 53), reserved);
        assertEquals(filled(new NamedList<>(), 53).names(), reserved.names());
        reserved.assertConsistent();
    }

    @Test
    void reserveRejectsNegativeAndOverflow() {
        NamedList<Item> list = filled(new NamedList<>(), 2);

        assertThrows(IllegalArgumentException.class, () -> list.reserve(-1));
        assertThrows(IllegalStateException.class, () -> list.reserve(Integer.MAX_VALUE));

        assertEquals(2, list.size());
        list.assertConsistent();
    }

    @Test
    void shrinkToFitKeepsContents() {
        NamedList<Item> list = filled(NamedList.withCapacity(100), 7);

        list.shrinkToFit();

        assertEquals(7, list.capacity());
        assertEquals(filled(new NamedList<>(), 7), list);
        list.assertConsistent();

        list.clear();
        list.shrinkToFit();
        assertEquals(0, list.capacity());
    }

    @Test
    void configControlsInitialCapacity() {
        NamedListConfig config = NamedListConfig.builder()
                .withInitialCapacity(4)
                .withIndexLoadFactor(0.5f)
                .build();

        NamedList<Item> list = filled(new NamedList<>(config), 4);

        assertEquals(4, list.capacity());
        list.assertConsistent();
    }

    @Test
    void configRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new NamedListConfig(-1, 0.75f));
        assertThrows(IllegalArgumentException.class, () -> new NamedListConfig(4, -0.5f));
        assertThrows(IllegalArgumentException.class,
                () -> NamedListConfig.builder().withIndexLoadFactor(Float.NaN).build());
        assertEquals(NamedListConfig.DEFAULT_INITIAL_CAPACITY, NamedListConfig.defaults().initialCapacity());
    }

    @Test
    void slicesAreReadOnlyViewsInPositionOrder() {
        NamedList<Item> list = filled(new NamedList<>(), 5);

        assertEquals(List.of(new Item("n1"), new Item("n2")), list.slice(1, 3));
        assertEquals(List.of(new Item("n3"), new Item("n4")), list.sliceFrom(3));
        assertEquals(List.of(new Item("n0")), list.sliceTo(1));
        assertEquals(5, list.asList().size());
        assertTrue(list.slice(2, 2).isEmpty());
        assertTrue(list.sliceFrom(5).isEmpty());

        assertThrows(UnsupportedOperationException.class, () -> list.asList().set(0, new Item("x")));
        assertThrows(UnsupportedOperationException.class, () -> list.sliceTo(2).clear());
    }

    @Test
    void sliceBoundsAreChecked() {
        NamedList<Item> list = filled(new NamedList<>(), 3);

        assertThrows(IndexOutOfBoundsException.class, () -> list.slice(2, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> list.slice(-1, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> list.sliceTo(4));
        assertThrows(IndexOutOfBoundsException.class, () -> list.sliceFrom(4));
    }
}
