// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.txtracker.core.model.TransactionRecord;
import sh.txtracker.core.types.Hash;

/**
 * Transaction identifier to {@link TransactionRecord}, filled as assertions are ingested.
 *
 * <p>Not thread-safe; confined to the owning {@link RequestDispatcher}'s thread.
 */
public final class TransactionIndex {

    private final Map<Hash, TransactionRecord> transactions = new HashMap<>();

    /**
     * Inserts or replaces the record for {@code id}.
     *
     * @return the replaced record, or {@code null} if {@code id} was new
     */
    public @Nullable TransactionRecord put(final Hash id, final TransactionRecord record) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(record, "record");
        return transactions.put(id, record);
    }

    /**
     * @return the record, or {@link TransactionRecord#notFound()} for an unknown id
     */
    public TransactionRecord lookup(final Hash id) {
        Objects.requireNonNull(id, "id");
        return transactions.getOrDefault(id, TransactionRecord.notFound());
    }

    public int size() {
        return transactions.size();
    }
}
