// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import sh.txtracker.primitives.Hex;

class Keccak256Test {

    @AfterEach
    void cleanup() {
        Keccak256.cleanup();
    }

    @Test
    void hashesEmptyInput() {
        assertEquals(
                "0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(Keccak256.hash(new byte[0])));
    }

    @Test
    void hashesAbc() {
        assertEquals(
                "0x4e03657aea45a94fc7d47ba826c8d667c0d1e6e33a64a036ec44f58fa12d6c45",
                Hex.encode(Keccak256.hash("abc".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void multiPartHashEqualsHashOfConcatenation() {
        byte[] a = "hello ".getBytes(StandardCharsets.UTF_8);
        byte[] b = "world".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(
                Keccak256.hash("hello world".getBytes(StandardCharsets.UTF_8)),
                Keccak256.hash(a, b));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> Keccak256.hash((byte[]) null));
        assertThrows(NullPointerException.class, () -> Keccak256.hash(new byte[0], null));
    }
}
