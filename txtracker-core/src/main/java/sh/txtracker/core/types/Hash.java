// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.txtracker.primitives.Hex;

/**
 * Hex-encoded 32-byte hash.
 * <p>
 * Used for value hashes, cumulative log hashes, partial hashes, message
 * identifiers and log topics. The value is stored in lowercase so two hashes
 * of the same bytes are always {@code equal}.
 *
 * @since 0.1.0
 */
public record Hash(@JsonValue String value) {
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The all-zero hash. Seeds every log hash chain.
     */
    public static final Hash ZERO = fromBytes(new byte[BYTE_LENGTH]);

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash(Hex.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
