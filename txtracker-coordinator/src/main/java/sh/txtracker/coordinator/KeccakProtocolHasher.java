// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Objects;

import sh.txtracker.core.crypto.Keccak256;
import sh.txtracker.core.model.EthMessage;
import sh.txtracker.core.model.ProposalResults;
import sh.txtracker.core.model.RawValue;
import sh.txtracker.core.types.Hash;

/**
 * {@link ProtocolHasher} over Keccak-256 of Solidity-packed fields
 * ({@code bytes32} as 32 bytes, {@code address} as 20, {@code uint64} as 8
 * big-endian bytes, {@code uint256} as 32 big-endian bytes).
 *
 * <pre>
 * valueHash   = keccak256(encoded)
 * partialHash = keccak256(instanceId, uint64 sequenceNumber, beforeHash,
 *                         uint64 startBlock, uint64 endBlock,
 *                         newInboxHash, originalInboxHash, assertionDigest)
 * messageHash = keccak256(instanceId, destination, keccak256(data),
 *                         uint256 value, caller, uint64 sequenceNumber)
 * </pre>
 */
public final class KeccakProtocolHasher implements ProtocolHasher {

    public static final KeccakProtocolHasher INSTANCE = new KeccakProtocolHasher();

    private static final int WORD = 32;

    private KeccakProtocolHasher() {
    }

    @Override
    public Hash valueHash(final RawValue value) {
        Objects.requireNonNull(value, "value");
        return Keccak256.hashOf(value.encoded().toBytes());
    }

    @Override
    public Hash partialHash(final Hash instanceId, final ProposalResults proposal) {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(proposal, "proposal");
        return Keccak256.hashOf(
                instanceId.toBytes(),
                uint64(proposal.sequenceNumber()),
                proposal.beforeHash().toBytes(),
                uint64(proposal.timeBounds().startBlock()),
                uint64(proposal.timeBounds().endBlock()),
                proposal.newInboxHash().toBytes(),
                proposal.originalInboxHash().toBytes(),
                proposal.assertionDigest().toBytes());
    }

    @Override
    public Hash messageHash(final Hash instanceId, final EthMessage message) {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(message, "message");
        return Keccak256.hashOf(
                instanceId.toBytes(),
                message.destination().toBytes(),
                Keccak256.hash(message.data().toBytes()),
                uint256(message.value()),
                message.caller().toBytes(),
                uint64(message.sequenceNumber()));
    }

    private static byte[] uint64(final long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    private static byte[] uint256(final BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > WORD * 8) {
            throw new IllegalArgumentException("value does not fit in uint256: " + value);
        }
        final byte[] magnitude = value.toByteArray();
        final byte[] word = new byte[WORD];
        // toByteArray may carry a leading sign byte
        final int length = Math.min(magnitude.length, WORD);
        System.arraycopy(magnitude, magnitude.length - length, word, WORD - length, length);
        return word;
    }
}
