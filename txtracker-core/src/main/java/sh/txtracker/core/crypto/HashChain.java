// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.crypto;

import java.util.List;
import java.util.Objects;

import sh.txtracker.core.types.Hash;

/**
 * The cumulative log commitment shared with the on-chain verifier.
 *
 * <p>Each link is {@code keccak256(prev ‖ valueHash)} over two 32-byte words,
 * which is byte-for-byte what Solidity computes for
 * {@code keccak256(abi.encodePacked(bytes32 prev, bytes32 valueHash))}. The
 * chain is seeded with {@link Hash#ZERO}.
 *
 * @since 0.1.0
 */
public final class HashChain {

    private HashChain() {
        // Utility class
    }

    /**
     * Extends the chain by one value hash.
     *
     * @param previous  the previous cumulative hash, {@link Hash#ZERO} for the first link
     * @param valueHash the value hash being appended
     * @return the new cumulative hash
     */
    public static Hash link(final Hash previous, final Hash valueHash) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(valueHash, "valueHash");
        return Keccak256.hashOf(previous.toBytes(), valueHash.toBytes());
    }

    /**
     * Folds a window of value hashes onto a starting cumulative hash.
     * Verifiers use this to check that a transaction's window leads from its
     * pre-hash to the expected cumulative hash.
     *
     * @param start       the cumulative hash before the window
     * @param valueHashes the window, in chain order
     * @return the cumulative hash after the last element (or {@code start} if empty)
     */
    public static Hash fold(final Hash start, final List<Hash> valueHashes) {
        Objects.requireNonNull(valueHashes, "valueHashes");
        Hash acc = Objects.requireNonNull(start, "start");
        for (Hash valueHash : valueHashes) {
            acc = link(acc, valueHash);
        }
        return acc;
    }
}
