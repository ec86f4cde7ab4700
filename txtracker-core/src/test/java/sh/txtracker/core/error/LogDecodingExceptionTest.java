// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.error;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.txtracker.core.model.EthMessage;
import sh.txtracker.core.types.Address;
import sh.txtracker.core.types.HexData;

class LogDecodingExceptionTest {

    @Test
    void carriesPartiallyDecodedMessage() {
        EthMessage message = new EthMessage(Address.ZERO, Address.ZERO, BigInteger.ZERO, HexData.EMPTY, 0);
        LogDecodingException e = new LogDecodingException("bad result", message, null);
        assertEquals(message, e.decodedMessage().orElseThrow());
    }

    @Test
    void messageIsOptional() {
        LogDecodingException e = new LogDecodingException("bad result", new IllegalStateException("x"));
        assertTrue(e.decodedMessage().isEmpty());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void hierarchyIsRootedAtTrackerException() {
        TrackerException halted = new TrackerHaltedException("closed", new ProtocolViolationException("digest"));
        assertInstanceOf(ProtocolViolationException.class, halted.getCause());
    }
}
