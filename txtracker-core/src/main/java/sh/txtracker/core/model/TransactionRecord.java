// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.txtracker.core.types.Hash;
import sh.txtracker.core.types.HexData;

/**
 * What the tracker knows about one transaction outcome.
 *
 * <p>The hash fields let a client prove the outcome on-chain: folding
 * {@code logsValHashes} onto {@code logsPreHash} yields the cumulative hash at
 * this transaction's log, and the chain continues to {@code logsPostHash}, the
 * assertion's final log hash.
 *
 * <p>Lookups for unknown identifiers return {@link #notFound()}, whose hash
 * fields are {@code null} and whose lists are empty.
 *
 * @param found               whether the transaction is known
 * @param assertionIndex      height of the owning assertion, {@code -1} when not found
 * @param rawValue            the raw outcome value
 * @param logsPreHash         cumulative hash before this transaction's window
 * @param logsPostHash        cumulative hash at the end of the owning assertion
 * @param logsValHashes       this transaction's window of value hashes
 * @param validatorSignatures signatures over the owning proposal
 * @param partialHash         partial hash of the owning proposal
 * @param onChainTxHash       host-chain transaction that confirmed the assertion
 * @since 0.1.0
 */
public record TransactionRecord(
        boolean found,
        long assertionIndex,
        @Nullable RawValue rawValue,
        @Nullable Hash logsPreHash,
        @Nullable Hash logsPostHash,
        List<Hash> logsValHashes,
        List<HexData> validatorSignatures,
        @Nullable Hash partialHash,
        @Nullable Hash onChainTxHash) {

    private static final TransactionRecord NOT_FOUND =
            new TransactionRecord(false, -1, null, null, null, List.of(), List.of(), null, null);

    public TransactionRecord {
        Objects.requireNonNull(logsValHashes, "logsValHashes cannot be null");
        Objects.requireNonNull(validatorSignatures, "validatorSignatures cannot be null");
        logsValHashes = List.copyOf(logsValHashes);
        validatorSignatures = List.copyOf(validatorSignatures);
        if (found) {
            Objects.requireNonNull(rawValue, "rawValue cannot be null");
            Objects.requireNonNull(logsPreHash, "logsPreHash cannot be null");
            Objects.requireNonNull(logsPostHash, "logsPostHash cannot be null");
            Objects.requireNonNull(partialHash, "partialHash cannot be null");
            Objects.requireNonNull(onChainTxHash, "onChainTxHash cannot be null");
            if (assertionIndex < 0) {
                throw new IllegalArgumentException("assertionIndex cannot be negative: " + assertionIndex);
            }
        }
    }

    public static TransactionRecord notFound() {
        return NOT_FOUND;
    }
}
