// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class AssertionStoreTest {

    private static AssertionRecord empty(long height) {
        return new AssertionRecord(height, List.of(), List.of(), List.of());
    }

    @Test
    void emptyStoreHasNoLatestHeight() {
        AssertionStore store = new AssertionStore();

        assertEquals(0, store.size());
        assertEquals(-1, store.latestHeight());
    }

    @Test
    void appendsInHeightOrder() {
        AssertionStore store = new AssertionStore();
        AssertionRecord first = empty(0);
        AssertionRecord second = empty(1);

        store.append(first);
        store.append(second);

        assertEquals(2, store.size());
        assertEquals(1, store.latestHeight());
        assertSame(first, store.get(0));
        assertSame(second, store.get(1));
    }

    @Test
    void rejectsGapInHeights() {
        AssertionStore store = new AssertionStore();
        store.append(empty(0));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> store.append(empty(2)));
        assertTrue(e.getMessage().contains("expected height 1"));
        assertEquals(1, store.size());
    }

    @Test
    void getOutsideRangeThrows() {
        AssertionStore store = new AssertionStore();
        store.append(empty(0));

        assertThrows(IndexOutOfBoundsException.class, () -> store.get(1));
        assertThrows(IndexOutOfBoundsException.class, () -> store.get(-1));
    }
}
