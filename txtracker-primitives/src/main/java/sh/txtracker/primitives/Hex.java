// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.primitives;

import java.util.Arrays;

/**
 * Lowercase hex encoding and decoding with optional {@code 0x} prefixes.
 *
 * <p>Every hash, address and opaque payload that leaves the tracker is rendered
 * through this class, so encodings are always lowercase and always prefixed.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLES = new int[128];

    static {
        Arrays.fill(NIBBLES, -1);
        for (int i = 0; i <= 9; i++) {
            NIBBLES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLES['a' + i] = 10 + i;
            NIBBLES['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix.
     *
     * @param hexString the string to decode
     * @return the decoded bytes (empty for {@code "0x"} or {@code ""})
     * @throws IllegalArgumentException if the input is null, has odd length or
     *                                  contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        final int digits = hexString.length() - start;
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final byte[] out = new byte[digits / 2];
        for (int i = 0; i < out.length; i++) {
            final int pos = start + i * 2;
            final int high = nibble(hexString.charAt(pos), hexString);
            final int low = nibble(hexString.charAt(pos + 1), hexString);
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }

    /**
     * Encodes bytes as a {@code 0x}-prefixed lowercase hex string.
     *
     * @param bytes the bytes to encode
     * @return the encoded string
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return the encoded string
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Returns {@code true} if the string starts with {@code 0x} or {@code 0X}.
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int nibble(final char c, final String input) {
        if (c >= NIBBLES.length || NIBBLES[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + input);
        }
        return NIBBLES[c];
    }
}
