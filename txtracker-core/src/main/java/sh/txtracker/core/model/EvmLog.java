// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import java.util.List;
import java.util.Objects;

import sh.txtracker.core.types.Address;
import sh.txtracker.core.types.Hash;
import sh.txtracker.core.types.HexData;

/**
 * An event log emitted by a contract during a transaction.
 *
 * @param contract the emitting contract (required)
 * @param topics   indexed topics, topic[0] usually the event signature (required, may be empty)
 * @param data     non-indexed payload (required, may be empty)
 * @since 0.1.0
 */
public record EvmLog(Address contract, List<Hash> topics, HexData data) {

    public EvmLog {
        Objects.requireNonNull(contract, "contract cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        topics = List.copyOf(topics);
    }

    /**
     * Positional prefix match: every supplied topic must equal the topic at the
     * same position, and the log must have at least as many topics as supplied.
     * An empty filter matches any log.
     *
     * @param filter the topic prefix
     * @return {@code true} if this log matches
     */
    public boolean matchesTopics(final List<Hash> filter) {
        if (filter.size() > topics.size()) {
            return false;
        }
        for (int i = 0; i < filter.size(); i++) {
            if (!filter.get(i).equals(topics.get(i))) {
                return false;
            }
        }
        return true;
    }
}
