// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.txtracker.core.types.Hash;

class TransactionRecordTest {

    @Test
    void notFoundHasNoData() {
        TransactionRecord record = TransactionRecord.notFound();
        assertFalse(record.found());
        assertEquals(-1, record.assertionIndex());
        assertNull(record.rawValue());
        assertNull(record.logsPreHash());
        assertTrue(record.logsValHashes().isEmpty());
        assertTrue(record.validatorSignatures().isEmpty());
    }

    @Test
    void foundRecordRequiresHashes() {
        assertThrows(NullPointerException.class, () -> new TransactionRecord(
                true, 0, RawValue.of("0x01"), null, Hash.ZERO, List.of(), List.of(), Hash.ZERO, Hash.ZERO));
    }

    @Test
    void foundRecordRejectsNegativeIndex() {
        assertThrows(IllegalArgumentException.class, () -> new TransactionRecord(
                true, -1, RawValue.of("0x01"), Hash.ZERO, Hash.ZERO, List.of(), List.of(), Hash.ZERO, Hash.ZERO));
    }
}
