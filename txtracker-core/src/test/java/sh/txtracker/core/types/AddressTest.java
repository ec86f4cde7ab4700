// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AddressTest {

    @Test
    void acceptsAndLowercases() {
        Address address = new Address("0x" + "AbCd".repeat(10));
        assertEquals("0x" + "abcd".repeat(10), address.value());
        assertEquals(20, address.toBytes().length);
    }

    @Test
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new Address("0x" + "zz".repeat(20)));
        assertThrows(NullPointerException.class, () -> new Address(null));
    }

    @Test
    void zeroAddress() {
        assertArrayEquals(new byte[20], Address.ZERO.toBytes());
    }
}
