// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for fixed-length {@code 0x}-prefixed hex strings.
 * Shared by {@link Address} and {@link Hash}.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Returns a pattern matching {@code 0x} followed by exactly
     * {@code byteLength * 2} hex digits (either case).
     *
     * @param byteLength the number of bytes the string must encode
     * @return the compiled pattern
     * @throws IllegalArgumentException if {@code byteLength} is not positive
     */
    public static Pattern fixedLength(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("byteLength must be positive, got: " + byteLength);
        }
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
