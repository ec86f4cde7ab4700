// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.txtracker.core.types.Hash;

class HashChainTest {

    private static final Hash V0 = new Hash("0x" + "11".repeat(32));
    private static final Hash V1 = new Hash("0x" + "22".repeat(32));

    @Test
    void linkMatchesSolidityPackedKeccak() {
        // keccak256(abi.encodePacked(bytes32(0), bytes32(0)))
        assertEquals(
                new Hash("0xad3228b676f7d3cd4284a5443f17f1962b36e491b30a40b2405849e597ba5fb5"),
                HashChain.link(Hash.ZERO, Hash.ZERO));
    }

    @Test
    void linkIsKeccakOfConcatenation() {
        byte[] packed = new byte[64];
        System.arraycopy(V0.toBytes(), 0, packed, 0, 32);
        System.arraycopy(V1.toBytes(), 0, packed, 32, 32);
        assertEquals(Hash.fromBytes(Keccak256.hash(packed)), HashChain.link(V0, V1));
    }

    @Test
    void linkIsOrderSensitive() {
        assertNotEquals(HashChain.link(V0, V1), HashChain.link(V1, V0));
    }

    @Test
    void foldAppliesLinksInOrder() {
        Hash expected = HashChain.link(HashChain.link(Hash.ZERO, V0), V1);
        assertEquals(expected, HashChain.fold(Hash.ZERO, List.of(V0, V1)));
    }

    @Test
    void foldOfEmptyWindowIsStart() {
        assertEquals(V0, HashChain.fold(V0, List.of()));
    }
}
