// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import sh.txtracker.core.error.LogDecodingException;
import sh.txtracker.core.types.Hash;

/**
 * Callbacks for collecting tracker metrics.
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or any other metrics
 * system. All methods default to no-ops; {@link #noop()} is used when no
 * implementation is configured.
 * <p>
 * <strong>Threading:</strong> every callback except
 * {@link #onRingBufferSaturation(long, int)} runs on the dispatcher thread and
 * must not block. {@code onRingBufferSaturation} runs on publishing threads.
 */
public interface TrackerMetrics {

    /**
     * Called after an assertion has been appended to the store.
     *
     * @param height           the assertion's height
     * @param transactionCount number of transactions indexed from it
     */
    default void onAssertionIngested(long height, int transactionCount) {
    }

    /**
     * Called when a transaction outcome could not be decoded.
     *
     * @param height the height of the assertion being ingested
     * @param error  the decoding failure
     */
    default void onDecodeFailure(long height, LogDecodingException error) {
    }

    /**
     * Called when an ingested transaction replaces an existing record with the
     * same identifier.
     */
    default void onDuplicateTransaction(Hash transactionHash) {
    }

    /**
     * Called when the ring buffer's remaining capacity drops below 10%.
     *
     * @param remainingCapacity free slots
     * @param bufferSize        total slots
     */
    default void onRingBufferSaturation(long remainingCapacity, int bufferSize) {
    }

    /**
     * Called once when a fatal ingestion failure halts the tracker.
     */
    default void onHalt(Throwable cause) {
    }

    static TrackerMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

enum NoopMetrics implements TrackerMetrics {
    INSTANCE
}
