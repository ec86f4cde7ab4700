// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import sh.txtracker.core.types.Hash;

/**
 * Keccak-256 hashing (the Ethereum variant, not SHA3-256), backed by
 * BouncyCastle's {@code Keccak.Digest256}.
 *
 * <p>Digest instances are cached per thread. In practice every hash of the log
 * chain is computed on the single dispatcher thread, so one digest is reused for
 * the lifetime of the tracker. Call {@link #cleanup()} from pooled threads that
 * hash outside the dispatcher if the class loader is going away.
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * Computes the Keccak-256 hash of the input.
     *
     * @param input the data to hash
     * @return 32-byte digest
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the Keccak-256 hash of the concatenation of the inputs, without
     * building the concatenated array.
     *
     * @param inputs the parts to hash, in order
     * @return 32-byte digest
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Same as {@link #hash(byte[]...)} but wraps the digest as a {@link Hash}.
     */
    public static Hash hashOf(final byte[]... inputs) {
        return Hash.fromBytes(hash(inputs));
    }

    /**
     * Removes the cached digest from the current thread.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
