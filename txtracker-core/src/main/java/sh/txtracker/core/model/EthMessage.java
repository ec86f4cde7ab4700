// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import java.math.BigInteger;
import java.util.Objects;

import sh.txtracker.core.types.Address;
import sh.txtracker.core.types.HexData;

/**
 * The message (transaction) that produced an outcome.
 *
 * @param caller         the sender (required)
 * @param destination    the called contract (required)
 * @param value          value transferred, non-negative (required)
 * @param data           calldata (required, may be empty)
 * @param sequenceNumber sender-scoped sequence number, non-negative
 * @since 0.1.0
 */
public record EthMessage(
        Address caller,
        Address destination,
        BigInteger value,
        HexData data,
        long sequenceNumber) {

    public EthMessage {
        Objects.requireNonNull(caller, "caller cannot be null");
        Objects.requireNonNull(destination, "destination cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value cannot be negative: " + value);
        }
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber cannot be negative: " + sequenceNumber);
        }
    }
}
