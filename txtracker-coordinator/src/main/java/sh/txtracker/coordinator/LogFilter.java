// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.txtracker.core.model.EvmLog;
import sh.txtracker.core.model.LogEntry;
import sh.txtracker.core.types.Address;
import sh.txtracker.core.types.Hash;

/**
 * Criteria for a log query, and the query itself ({@link #find(AssertionStore)}).
 *
 * <p>
 * <strong>Height range:</strong> both bounds are inclusive and clamped to the
 * store. An empty {@code fromHeight} starts at 0 and an empty {@code toHeight}
 * ends at the newest assertion. A range that starts past the newest assertion,
 * or ends before it starts, yields no logs.
 *
 * <p>
 * <strong>Topics:</strong> positional prefix match. {@code [A, B]} matches logs
 * whose first two topics are {@code A} and {@code B}, whatever follows.
 *
 * <pre>{@code
 * LogFilter filter = LogFilter.byContract(token, List.of(transferSig));
 * LogFilter recent = new LogFilter(Optional.of(100L), Optional.empty(), Optional.empty(), List.of());
 * }</pre>
 *
 * @param fromHeight first height to search, or empty for 0
 * @param toHeight   last height to search, or empty for the newest
 * @param address    contract that must have emitted the log, or empty for any
 * @param topics     topic prefix, empty for any
 */
public record LogFilter(
        Optional<Long> fromHeight,
        Optional<Long> toHeight,
        Optional<Address> address,
        List<Hash> topics) {

    public LogFilter {
        fromHeight = fromHeight == null ? Optional.empty() : fromHeight;
        toHeight = toHeight == null ? Optional.empty() : toHeight;
        address = address == null ? Optional.empty() : address;
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    /**
     * Matches every log in the store.
     */
    public static LogFilter all() {
        return new LogFilter(Optional.empty(), Optional.empty(), Optional.empty(), List.of());
    }

    public static LogFilter byContract(final Address address, final List<Hash> topics) {
        Objects.requireNonNull(address, "address");
        return new LogFilter(Optional.empty(), Optional.empty(), Optional.of(address), topics);
    }

    /**
     * Returns {@code true} if {@code log} passes the address and topic criteria.
     */
    public boolean matches(final EvmLog log) {
        if (address.isPresent() && !address.get().equals(log.contract())) {
            return false;
        }
        return log.matchesTopics(topics);
    }

    /**
     * Runs the query against {@code store}. Reads only.
     *
     * @return matching logs by height, then transaction, then log order
     */
    public List<LogEntry> find(final AssertionStore store) {
        Objects.requireNonNull(store, "store");
        final long size = store.size();
        final long start = Math.max(0L, fromHeight.orElse(0L));
        if (start >= size) {
            return List.of();
        }
        final long end = toHeight.map(to -> to < size ? to + 1 : size).orElse(size);

        final List<LogEntry> out = new ArrayList<>();
        for (long height = start; height < end; height++) {
            final AssertionRecord assertion = store.get(height);
            long logIndex = 0;
            for (TransactionLogBundle bundle : assertion.transactionLogs()) {
                for (EvmLog log : bundle.logs()) {
                    if (matches(log)) {
                        out.add(new LogEntry(
                                log.contract(),
                                bundle.transactionHash(),
                                height,
                                log.data(),
                                log.topics(),
                                logIndex));
                    }
                    logIndex++;
                }
            }
        }
        return Collections.unmodifiableList(out);
    }
}
