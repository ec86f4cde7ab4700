// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HexTest {

    @Test
    void encodesLowercaseWithPrefix() {
        assertEquals("0x00ff10ab", Hex.encode(new byte[] {0x00, (byte) 0xFF, 0x10, (byte) 0xAB}));
    }

    @Test
    void encodesEmptyArray() {
        assertEquals("0x", Hex.encode(new byte[0]));
        assertEquals("", Hex.encodeNoPrefix(new byte[0]));
    }

    @Test
    void decodesWithAndWithoutPrefix() {
        assertArrayEquals(new byte[] {0x12, 0x34}, Hex.decode("0x1234"));
        assertArrayEquals(new byte[] {0x12, 0x34}, Hex.decode("1234"));
        assertArrayEquals(new byte[] {(byte) 0xAB}, Hex.decode("0XAB"));
    }

    @Test
    void decodesEmpty() {
        assertEquals(0, Hex.decode("0x").length);
        assertEquals(0, Hex.decode("").length);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0x123", "0xzz", "0x12g4", "0xéé"})
    void rejectsMalformedInput(String input) {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(input));
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(null));
    }

    @Test
    void prefixDetection() {
        assertTrue(Hex.hasPrefix("0xabcd"));
        assertTrue(Hex.hasPrefix("0Xabcd"));
        assertFalse(Hex.hasPrefix("x0"));
        assertFalse(Hex.hasPrefix(null));
    }
}
