// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.time.Duration;
import java.util.Objects;

import sh.txtracker.core.types.Hash;

/**
 * Configuration for {@link RequestDispatcher}.
 *
 * <pre>{@code
 * TrackerConfig config = TrackerConfig.builder(instanceId)
 *         .ringBufferSize(4096)
 *         .waitStrategy(WaitStrategyType.YIELDING)
 *         .build();
 * }</pre>
 *
 * <p>Zero or {@code null} values fall back to the defaults.
 *
 * @param instanceId      rollup instance whose assertions are tracked (required)
 * @param ringBufferSize  request ring buffer slots, a power of 2 (default 1024)
 * @param waitStrategy    how the dispatcher thread waits for events (default BLOCKING)
 * @param threadName      name of the dispatcher thread (default {@code txtracker-dispatcher})
 * @param shutdownTimeout how long {@link RequestDispatcher#close()} waits to drain (default 5s)
 */
public record TrackerConfig(
        Hash instanceId,
        int ringBufferSize,
        WaitStrategyType waitStrategy,
        String threadName,
        Duration shutdownTimeout) {

    /**
     * Disruptor wait strategies, from lowest latency to lowest CPU use.
     */
    public enum WaitStrategyType {
        /** Spins on a dedicated core. */
        BUSY_SPIN,
        /** Spins, then yields. */
        YIELDING,
        /** Blocks, skipping the signal when nobody waits. */
        LITE_BLOCKING,
        /** Blocks on a lock and condition. Lowest CPU use. */
        BLOCKING
    }

    private static final int DEFAULT_RING_SIZE = 1024;
    private static final String DEFAULT_THREAD_NAME = "txtracker-dispatcher";
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    public TrackerConfig {
        Objects.requireNonNull(instanceId, "instanceId");
        if (ringBufferSize <= 0)
            ringBufferSize = DEFAULT_RING_SIZE;
        if (waitStrategy == null)
            waitStrategy = WaitStrategyType.BLOCKING;
        if (threadName == null || threadName.isBlank())
            threadName = DEFAULT_THREAD_NAME;
        if (shutdownTimeout == null || shutdownTimeout.isZero())
            shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        if ((ringBufferSize & (ringBufferSize - 1)) != 0) {
            throw new IllegalArgumentException(
                    "ringBufferSize must be a power of 2, got: " + ringBufferSize
                            + ", try: " + Integer.highestOneBit(ringBufferSize) * 2);
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout cannot be negative: " + shutdownTimeout);
        }
    }

    public static TrackerConfig withDefaults(final Hash instanceId) {
        return new TrackerConfig(instanceId, 0, null, null, null);
    }

    public static Builder builder(final Hash instanceId) {
        return new Builder(instanceId);
    }

    /**
     * Builder for {@link TrackerConfig}.
     */
    public static final class Builder {
        private final Hash instanceId;
        private int ringBufferSize = 0;
        private WaitStrategyType waitStrategy = null;
        private String threadName = null;
        private Duration shutdownTimeout = null;

        private Builder(final Hash instanceId) {
            this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        }

        /**
         * Sets the ring buffer size. Must be a power of 2. Default: 1024.
         */
        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        /**
         * Sets the wait strategy. Default: BLOCKING.
         */
        public Builder waitStrategy(WaitStrategyType waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        /**
         * Sets how long close() waits for queued requests. Default: 5 seconds.
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public TrackerConfig build() {
            return new TrackerConfig(instanceId, ringBufferSize, waitStrategy, threadName, shutdownTimeout);
        }
    }
}
