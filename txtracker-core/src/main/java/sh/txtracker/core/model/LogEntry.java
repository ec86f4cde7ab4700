// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import java.util.List;
import java.util.Objects;

import sh.txtracker.core.types.Address;
import sh.txtracker.core.types.Hash;
import sh.txtracker.core.types.HexData;

/**
 * A log as returned by a log query.
 *
 * <p>Assertions stand in for blocks: {@code blockNumber} is the height of the
 * assertion holding the log and {@code logIndex} is the log's position among
 * all logs of that assertion.
 *
 * @param address         the emitting contract (required)
 * @param transactionHash identifier of the originating transaction (required)
 * @param blockNumber     height of the owning assertion
 * @param data            non-indexed payload (required, may be empty)
 * @param topics          indexed topics (required, may be empty)
 * @param logIndex        position within the owning assertion
 * @since 0.1.0
 */
public record LogEntry(
        Address address,
        Hash transactionHash,
        long blockNumber,
        HexData data,
        List<Hash> topics,
        long logIndex) {

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        topics = List.copyOf(topics);
    }
}
