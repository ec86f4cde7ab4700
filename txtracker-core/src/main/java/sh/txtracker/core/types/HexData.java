// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.txtracker.primitives.Hex;

/**
 * Immutable arbitrary-length byte payload rendered as {@code 0x}-prefixed hex.
 *
 * <p>Carries log data, validator signatures and raw outcome encodings. Instances
 * built from bytes keep the bytes and render the hex string on first use.
 *
 * <pre>{@code
 * HexData data = new HexData("0x1234abcd");
 * HexData sig = HexData.fromBytes(signatureBytes);
 * byte[] raw = data.toBytes();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;
    private volatile String value;

    /**
     * Creates a HexData from a {@code 0x}-prefixed string with an even number of digits.
     *
     * @param value the hex string
     */
    public HexData(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
        this.value = Hex.encode(raw);
    }

    private HexData(final byte[] raw) {
        this.raw = raw;
    }

    /**
     * Returns the lowercase hex string with {@code 0x} prefix.
     */
    @JsonValue
    public String value() {
        String v = value;
        if (v == null) {
            v = Hex.encode(raw);
            value = v;
        }
        return v;
    }

    /**
     * Returns a copy of the underlying bytes.
     */
    public byte[] toBytes() {
        return raw.clone();
    }

    /**
     * Creates HexData from bytes, copying the input.
     *
     * @param bytes the bytes, or null/empty for {@link #EMPTY}
     * @return the wrapped payload
     */
    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HexData other))
            return false;
        return Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[value=" + value() + ']';
    }
}
