// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.txtracker.core.crypto.HashChain;
import sh.txtracker.core.error.LogDecodingException;
import sh.txtracker.core.error.ProtocolViolationException;
import sh.txtracker.core.model.EvmResult;
import sh.txtracker.core.model.FinalizedAssertion;
import sh.txtracker.core.model.RawValue;
import sh.txtracker.core.model.TransactionRecord;
import sh.txtracker.core.types.Hash;

/**
 * Turns a {@link FinalizedAssertion} into its {@link AssertionRecord} and the
 * {@link TransactionRecord}s of its new transactions.
 *
 * <p>Building is pure: nothing is written to the store or index, so a failed
 * build leaves no trace. The caller applies the returned {@link Ingestion}.
 *
 * <h2>Transaction windows</h2>
 *
 * <p>With {@code M} logs of which the last {@code N} are new, the {@code i}-th
 * new transaction sits at position {@code p = M - N + i}. Its window of value
 * hashes ends at {@code p}. The first transaction's window starts at 0, since
 * the pending prefix was accumulated ahead of it. Every later window holds just
 * its own log. Windows therefore partition the assertion's value hashes, and
 * {@code HashChain.fold(logsPreHash, logsValHashes)} equals the cumulative hash
 * at {@code p}.
 *
 * <p>When pending logs precede the new ones ({@code M > N}), the first record's
 * {@code logsPreHash} is therefore {@link Hash#ZERO} and its window covers the
 * pending logs. Trackers that seed that record with {@code cumulative[M-N-1]}
 * produce different values for it, so records are not interchangeable with
 * theirs in that case.
 *
 * <h2>Decoding</h2>
 *
 * <p>A log whose outcome cannot be decoded still yields a record. Any exception
 * thrown by the {@link EvmResultDecoder} counts as a decode failure; only the
 * assertion-level checks in {@link #build} are fatal.
 */
public final class HashChainBuilder {

    private static final Logger log = LoggerFactory.getLogger(HashChainBuilder.class);

    private final Hash instanceId;
    private final ProtocolHasher hasher;
    private final EvmResultDecoder decoder;
    private final TrackerMetrics metrics;

    public HashChainBuilder(
            final Hash instanceId,
            final ProtocolHasher hasher,
            final EvmResultDecoder decoder,
            final TrackerMetrics metrics) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Result of building one assertion.
     *
     * @param assertion    the record to append to the store
     * @param transactions the records to upsert into the index, in transaction order
     */
    public record Ingestion(AssertionRecord assertion, List<IndexedTransaction> transactions) {
        public Ingestion {
            Objects.requireNonNull(assertion, "assertion");
            transactions = List.copyOf(transactions);
        }
    }

    /**
     * A transaction record with the identifier it is indexed under.
     */
    public record IndexedTransaction(Hash id, TransactionRecord record) {
        public IndexedTransaction {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(record, "record");
        }
    }

    /**
     * Builds the records for {@code assertion} at {@code height}.
     *
     * @throws ProtocolViolationException if the executed and proposed digests differ,
     *                                    or the new-log count does not fit the log list
     */
    public Ingestion build(final FinalizedAssertion assertion, final long height) {
        Objects.requireNonNull(assertion, "assertion");
        if (!assertion.executionDigest().equals(assertion.proposal().assertionDigest())) {
            throw new ProtocolViolationException("executed assertion " + assertion.executionDigest()
                    + " differs from proposed assertion " + assertion.proposal().assertionDigest()
                    + " (sequence " + assertion.proposal().sequenceNumber() + ")");
        }
        final List<RawValue> logs = assertion.logs();
        final int newLogCount = assertion.newLogCount();
        if (newLogCount < 0 || newLogCount > logs.size()) {
            throw new ProtocolViolationException("new log count " + newLogCount
                    + " outside [0, " + logs.size() + "] (sequence " + assertion.proposal().sequenceNumber() + ")");
        }
        final Hash partialHash = hasher.partialHash(instanceId, assertion.proposal());

        final List<Hash> valueHashes = new ArrayList<>(logs.size());
        final List<Hash> cumulativeHashes = new ArrayList<>(logs.size());
        Hash acc = Hash.ZERO;
        for (RawValue value : logs) {
            final Hash valueHash = hasher.valueHash(value);
            acc = HashChain.link(acc, valueHash);
            valueHashes.add(valueHash);
            cumulativeHashes.add(acc);
        }
        final Hash logsPostHash = acc;

        final List<TransactionLogBundle> bundles = new ArrayList<>();
        final List<IndexedTransaction> transactions = new ArrayList<>(newLogCount);
        final List<RawValue> newLogs = assertion.newLogs();
        final int firstNew = logs.size() - newLogCount;
        for (int i = 0; i < newLogCount; i++) {
            final int position = firstNew + i;
            final int windowStart = i == 0 ? 0 : position;
            final Hash logsPreHash = windowStart == 0 ? Hash.ZERO : cumulativeHashes.get(windowStart - 1);
            final List<Hash> window = valueHashes.subList(windowStart, position + 1);
            final RawValue raw = newLogs.get(i);

            final Hash id = decode(raw, valueHashes.get(position), height, bundles);
            final TransactionRecord record = new TransactionRecord(
                    true,
                    height,
                    raw,
                    logsPreHash,
                    logsPostHash,
                    window,
                    assertion.signatures(),
                    partialHash,
                    assertion.onChainTxHash());
            transactions.add(new IndexedTransaction(id, record));
        }

        return new Ingestion(new AssertionRecord(height, bundles, cumulativeHashes, valueHashes), transactions);
    }

    /**
     * Decodes one outcome, appending its bundle if it carries logs.
     *
     * @return the transaction identifier
     */
    private Hash decode(final RawValue raw, final Hash valueHash, final long height,
            final List<TransactionLogBundle> bundles) {
        final EvmResult result;
        try {
            result = Objects.requireNonNull(decoder.decode(raw), "decoder returned no result");
        } catch (RuntimeException e) {
            final LogDecodingException failure = e instanceof LogDecodingException decoding
                    ? decoding
                    : new LogDecodingException("decoder failed: " + e, e);
            log.warn("Assertion {} produced an invalid EVM result {}: {}", height, valueHash, failure.getMessage());
            try {
                metrics.onDecodeFailure(height, failure);
            } catch (RuntimeException callbackError) {
                log.error("Metrics callback onDecodeFailure failed", callbackError);
            }
            // keep the record addressable even without a message
            return failure.decodedMessage()
                    .map(message -> hasher.messageHash(instanceId, message))
                    .orElse(valueHash);
        }

        final Hash id = hasher.messageHash(instanceId, result.message());
        final boolean carriesLogs = switch (result.kind()) {
            case STOP, RETURN -> true;
            case REVERT -> false;
        };
        if (carriesLogs) {
            bundles.add(new TransactionLogBundle(id, result.message(), result.logs()));
        }
        return id;
    }
}
