// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.txtracker.core.model.RawValue;
import sh.txtracker.core.model.TransactionRecord;
import sh.txtracker.core.types.Hash;

class TransactionIndexTest {

    private static final Hash TX = new Hash("0x" + "ab".repeat(32));

    private static TransactionRecord record(long height) {
        return new TransactionRecord(true, height, RawValue.of("0x01"), Hash.ZERO, Hash.ZERO,
                List.of(Hash.ZERO), List.of(), Hash.ZERO, Hash.ZERO);
    }

    @Test
    void unknownIdIsNotFound() {
        TransactionIndex index = new TransactionIndex();

        TransactionRecord result = index.lookup(TX);

        assertFalse(result.found());
        assertEquals(-1, result.assertionIndex());
    }

    @Test
    void putThenLookup() {
        TransactionIndex index = new TransactionIndex();
        TransactionRecord record = record(3);

        assertNull(index.put(TX, record));

        assertSame(record, index.lookup(TX));
        assertEquals(1, index.size());
    }

    @Test
    void laterRecordReplacesEarlierOne() {
        TransactionIndex index = new TransactionIndex();
        TransactionRecord first = record(0);
        TransactionRecord second = record(5);

        index.put(TX, first);
        TransactionRecord replaced = index.put(TX, second);

        assertSame(first, replaced);
        assertEquals(5, index.lookup(TX).assertionIndex());
        assertEquals(1, index.size());
    }
}
