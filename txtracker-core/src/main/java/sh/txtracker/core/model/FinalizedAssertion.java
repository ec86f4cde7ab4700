// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import java.util.List;
import java.util.Objects;

import sh.txtracker.core.types.Hash;
import sh.txtracker.core.types.HexData;

/**
 * An assertion finalized by the validators, as delivered by the validator feed.
 *
 * <p>{@code logs} lists every log value the assertion's execution produced. The
 * last {@code newLogCount} of them are new relative to already-pending state;
 * each new log value is the outcome of one transaction.
 *
 * <p>The record only checks shape. Protocol consistency (digest agreement,
 * {@code newLogCount <= logs.size()}) is checked at ingestion, where a
 * violation is fatal.
 *
 * @param executionDigest digest of the assertion that was executed
 * @param proposal        the proposal the validators signed
 * @param logs            all log values, in production order
 * @param newLogCount     size of the new suffix of {@code logs}
 * @param signatures      validator signatures over the proposal
 * @param onChainTxHash   hash of the transaction that confirmed the assertion on the host chain
 * @since 0.1.0
 */
public record FinalizedAssertion(
        Hash executionDigest,
        ProposalResults proposal,
        List<RawValue> logs,
        int newLogCount,
        List<HexData> signatures,
        Hash onChainTxHash) {

    public FinalizedAssertion {
        Objects.requireNonNull(executionDigest, "executionDigest cannot be null");
        Objects.requireNonNull(proposal, "proposal cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        Objects.requireNonNull(signatures, "signatures cannot be null");
        Objects.requireNonNull(onChainTxHash, "onChainTxHash cannot be null");
        logs = List.copyOf(logs);
        signatures = List.copyOf(signatures);
    }

    /**
     * Returns the new suffix of {@link #logs()}.
     *
     * @throws IndexOutOfBoundsException if {@code newLogCount} is outside {@code [0, logs.size()]}
     */
    public List<RawValue> newLogs() {
        return logs.subList(logs.size() - newLogCount, logs.size());
    }
}
