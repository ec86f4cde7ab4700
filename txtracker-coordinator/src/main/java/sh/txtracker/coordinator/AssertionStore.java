// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only sequence of {@link AssertionRecord}s, indexed by height.
 *
 * <p>Not thread-safe. A store is confined to the thread of the
 * {@link RequestDispatcher} that owns it. It grows for the life of the
 * process: nothing is evicted or persisted.
 */
public final class AssertionStore {

    private final List<AssertionRecord> records = new ArrayList<>();

    /**
     * Appends the next record.
     *
     * @throws IllegalArgumentException if {@code record.height()} is not the current size
     */
    public void append(final AssertionRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.height() != records.size()) {
            throw new IllegalArgumentException(
                    "expected height " + records.size() + " but record has height " + record.height());
        }
        records.add(record);
    }

    public AssertionRecord get(final long height) {
        if (height < 0 || height >= records.size()) {
            throw new IndexOutOfBoundsException("height " + height + " outside [0, " + records.size() + ")");
        }
        return records.get((int) height);
    }

    public int size() {
        return records.size();
    }

    /**
     * Height of the newest assertion, {@code -1} when the store is empty.
     */
    public long latestHeight() {
        return records.size() - 1L;
    }
}
