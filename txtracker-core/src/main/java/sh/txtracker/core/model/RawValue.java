// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.txtracker.core.types.HexData;

/**
 * A raw outcome value as produced by the rollup machine, in its canonical
 * serialized form. The tracker never interprets it directly: it is hashed into
 * the log chain and handed to the outcome decoder.
 *
 * @param encoded the canonical serialization (required, may be empty)
 * @since 0.1.0
 */
public record RawValue(@JsonValue HexData encoded) {

    public RawValue {
        Objects.requireNonNull(encoded, "encoded");
    }

    public static RawValue of(final byte[] bytes) {
        return new RawValue(HexData.fromBytes(bytes));
    }

    public static RawValue of(final String hex) {
        return new RawValue(new HexData(hex));
    }
}
