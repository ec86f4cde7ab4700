// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.util.List;
import java.util.Objects;

import sh.txtracker.core.types.Hash;

/**
 * Immutable per-assertion entry of the {@link AssertionStore}.
 *
 * <p>{@code cumulativeHashes[i] = HashChain.link(cumulativeHashes[i-1], valueHashes[i])},
 * with the chain seeded by {@link Hash#ZERO}.
 *
 * @param height           index of the assertion in the store
 * @param transactionLogs  one bundle per Stop/Return transaction, in transaction order
 * @param cumulativeHashes the log hash chain for this assertion's logs
 * @param valueHashes      the value hash of each log
 */
public record AssertionRecord(
        long height,
        List<TransactionLogBundle> transactionLogs,
        List<Hash> cumulativeHashes,
        List<Hash> valueHashes) {

    public AssertionRecord {
        if (height < 0) {
            throw new IllegalArgumentException("height cannot be negative: " + height);
        }
        Objects.requireNonNull(transactionLogs, "transactionLogs cannot be null");
        Objects.requireNonNull(cumulativeHashes, "cumulativeHashes cannot be null");
        Objects.requireNonNull(valueHashes, "valueHashes cannot be null");
        if (cumulativeHashes.size() != valueHashes.size()) {
            throw new IllegalArgumentException("cumulativeHashes (" + cumulativeHashes.size()
                    + ") and valueHashes (" + valueHashes.size() + ") must have the same length");
        }
        transactionLogs = List.copyOf(transactionLogs);
        cumulativeHashes = List.copyOf(cumulativeHashes);
        valueHashes = List.copyOf(valueHashes);
    }

    /**
     * Returns the last cumulative hash, or {@link Hash#ZERO} for an assertion without logs.
     */
    public Hash logsPostHash() {
        return cumulativeHashes.isEmpty() ? Hash.ZERO : cumulativeHashes.get(cumulativeHashes.size() - 1);
    }

    public int logCount() {
        return valueHashes.size();
    }
}
