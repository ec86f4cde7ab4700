// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LiteBlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.txtracker.core.DebugLogger;
import sh.txtracker.core.crypto.Keccak256;
import sh.txtracker.core.error.TrackerHaltedException;
import sh.txtracker.core.model.FinalizedAssertion;
import sh.txtracker.core.model.LogEntry;
import sh.txtracker.core.model.TransactionRecord;
import sh.txtracker.core.types.Hash;

/**
 * Owns the {@link AssertionStore} and {@link TransactionIndex} and serializes
 * every ingestion and query through a single dispatcher thread.
 *
 * <p>
 * <strong>Threading model:</strong>
 * <ul>
 * <li>Any number of threads publish requests into an LMAX Disruptor ring buffer
 * (multi-producer).</li>
 * <li>One dispatcher thread consumes them in publication order. It is the only
 * thread that ever touches the store or the index, so neither needs a lock.</li>
 * <li>Each request carries its own {@link CompletableFuture}, completed exactly
 * once by the dispatcher thread.</li>
 * </ul>
 *
 * <p>
 * <strong>Ordering:</strong> publication order is the processing order. A query
 * published after a {@link #submitAssertion} call has returned, or after its
 * future has completed, observes that assertion. Unrelated concurrent callers
 * are ordered by whoever claims a ring slot first. Each request is processed
 * to completion before the next one starts, so no query sees a partially
 * ingested assertion.
 *
 * <p>
 * <strong>Delivery:</strong> completing a future never blocks, so a caller that
 * never reads its result cannot stall the dispatcher. Dependent stages attached
 * with the non-async {@code thenApply}/{@code thenAccept} variants run on the
 * dispatcher thread and delay everyone behind them; prefer the {@code *Async}
 * variants for anything slow.
 *
 * <p>
 * <strong>Flow control:</strong> a full ring buffer blocks publishers until the
 * dispatcher frees a slot. Store and index grow without bound for the life of
 * the process.
 *
 * <p>
 * <strong>Failure:</strong> if an assertion cannot be ingested (for example a
 * {@link sh.txtracker.core.error.ProtocolViolationException}), the dispatcher
 * halts. The store keeps every assertion ingested before the failure, and all
 * later requests fail with {@link TrackerHaltedException} carrying the cause.
 * Exceptions thrown by {@link TrackerMetrics} callbacks are logged and never
 * affect request processing.
 *
 * <pre>{@code
 * try (RequestDispatcher tracker = new RequestDispatcher(
 *         TrackerConfig.withDefaults(instanceId), decoder, creationTxHash)) {
 *     validatorFeed.forEach(tracker::submitAssertion);
 *     TransactionRecord tx = tracker.transactionByHash(txHash).join();
 *     List<LogEntry> logs = tracker.findLogs(LogFilter.byContract(token, List.of())).join();
 * }
 * }</pre>
 */
public final class RequestDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private static final double RING_BUFFER_SATURATION_THRESHOLD = 0.10;

    private final TrackerConfig config;
    private final HashChainBuilder builder;
    private final TrackerMetrics metrics;
    private final CompletableFuture<Hash> instanceCreationTxHash;

    // Confined to the dispatcher thread
    private final AssertionStore store = new AssertionStore();
    private final TransactionIndex index = new TransactionIndex();

    private final Disruptor<DispatchEvent> disruptor;
    private final RingBuffer<DispatchEvent> ringBuffer;

    // Guards the closed flag against publishers racing close()
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private boolean closed;

    private volatile @Nullable Throwable haltCause;

    // Progress of the dispatcher thread, read by close() when draining times out
    private volatile long lastHandledSequence = -1L;
    private volatile @Nullable Request<?> inFlight;

    /**
     * Creates and starts a dispatcher with Keccak protocol hashing and no metrics.
     *
     * @param config                 dispatcher settings
     * @param decoder                decoder for raw transaction outcomes
     * @param instanceCreationTxHash one-shot source of the rollup instance's creation transaction hash
     */
    public RequestDispatcher(
            final TrackerConfig config,
            final EvmResultDecoder decoder,
            final CompletableFuture<Hash> instanceCreationTxHash) {
        this(config, decoder, KeccakProtocolHasher.INSTANCE, TrackerMetrics.noop(), instanceCreationTxHash);
    }

    /**
     * Creates and starts a dispatcher.
     *
     * @param config                 dispatcher settings
     * @param decoder                decoder for raw transaction outcomes
     * @param hasher                 protocol hash constructions
     * @param metrics                metrics callbacks
     * @param instanceCreationTxHash one-shot source of the rollup instance's creation transaction hash
     */
    public RequestDispatcher(
            final TrackerConfig config,
            final EvmResultDecoder decoder,
            final ProtocolHasher hasher,
            final TrackerMetrics metrics,
            final CompletableFuture<Hash> instanceCreationTxHash) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.instanceCreationTxHash = Objects.requireNonNull(instanceCreationTxHash, "instanceCreationTxHash");
        this.builder = new HashChainBuilder(config.instanceId(), hasher, decoder, metrics);

        WaitStrategy waitStrategy = switch (config.waitStrategy()) {
            case BUSY_SPIN -> new BusySpinWaitStrategy();
            case YIELDING -> new YieldingWaitStrategy();
            case LITE_BLOCKING -> new LiteBlockingWaitStrategy();
            case BLOCKING -> new BlockingWaitStrategy();
        };

        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, config.threadName());
            t.setDaemon(true);
            return t;
        };

        this.disruptor = new Disruptor<>(
                DispatchEvent::new,
                config.ringBufferSize(),
                threadFactory,
                ProducerType.MULTI,
                waitStrategy);
        this.disruptor.handleEventsWith(new DispatchHandler());
        this.disruptor.start();
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("Started tracker for instance {} (ring buffer {}, {} wait strategy)",
                config.instanceId(), config.ringBufferSize(), config.waitStrategy());
    }

    // ==================== Requests ====================

    /**
     * Queues a finalized assertion for ingestion. Assertions must be submitted in
     * sequence order, without gaps.
     *
     * @return a future completing with the height the assertion was stored at
     */
    public CompletableFuture<Long> submitAssertion(final FinalizedAssertion assertion) {
        Objects.requireNonNull(assertion, "assertion");
        return publish(new Request.Ingest(assertion, new CompletableFuture<>()));
    }

    /**
     * @return a future completing with the height of the newest assertion, {@code -1} if none
     */
    public CompletableFuture<Long> assertionCount() {
        return publish(new Request.AssertionCount(new CompletableFuture<>()));
    }

    /**
     * @return a future completing with the hash of the transaction that created the
     *         rollup instance, once the upstream source provides it
     */
    public CompletableFuture<Hash> instanceCreationTxHash() {
        return publish(new Request.InstanceCreationTxHash(new CompletableFuture<>()));
    }

    /**
     * @return a future completing with the record for {@code transactionHash}, or
     *         {@link TransactionRecord#notFound()}
     */
    public CompletableFuture<TransactionRecord> transactionByHash(final Hash transactionHash) {
        Objects.requireNonNull(transactionHash, "transactionHash");
        return publish(new Request.TransactionByHash(transactionHash, new CompletableFuture<>()));
    }

    /**
     * @return a future completing with the logs matching {@code filter}
     * @see LogFilter#find(AssertionStore)
     */
    public CompletableFuture<List<LogEntry>> findLogs(final LogFilter filter) {
        Objects.requireNonNull(filter, "filter");
        return publish(new Request.FindLogs(filter, new CompletableFuture<>()));
    }

    /**
     * Returns {@code true} once a fatal ingestion failure has stopped the tracker.
     */
    public boolean isHalted() {
        return haltCause != null;
    }

    public TrackerConfig getConfig() {
        return config;
    }

    /**
     * Stops accepting requests, lets the dispatcher finish everything already
     * queued (up to {@link TrackerConfig#shutdownTimeout()}), then stops it.
     * Requests made after this call fail with {@link TrackerHaltedException}.
     */
    @Override
    public void close() {
        lifecycle.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lifecycle.writeLock().unlock();
        }

        try {
            disruptor.shutdown(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Dispatcher did not drain within {}, halting", config.shutdownTimeout());
            disruptor.halt();
            failUnprocessed();
        }
        DebugLogger.log("[CLOSE] instance=%s", config.instanceId());
        log.info("Stopped tracker for instance {} at height {}", config.instanceId(), store.latestHeight());
    }

    // ==================== Dispatch ====================

    private <T> CompletableFuture<T> publish(final Request<T> request) {
        lifecycle.readLock().lock();
        try {
            if (closed) {
                request.response().completeExceptionally(new TrackerHaltedException("tracker is closed"));
                return request.response();
            }
            final Throwable cause = haltCause;
            if (cause != null) {
                request.response().completeExceptionally(halted(cause));
                return request.response();
            }

            final int bufferSize = ringBuffer.getBufferSize();
            final long remainingCapacity = ringBuffer.remainingCapacity();
            if (remainingCapacity < bufferSize * RING_BUFFER_SATURATION_THRESHOLD) {
                notifyMetrics("onRingBufferSaturation",
                        () -> metrics.onRingBufferSaturation(remainingCapacity, bufferSize));
            }

            final long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).set(request);
            } finally {
                ringBuffer.publish(sequence);
            }
            return request.response();
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    private void handleEvent(final DispatchEvent event, final long sequence) {
        lastHandledSequence = sequence;
        final Request<?> request = event.request;
        // Events are reused by the ring buffer
        event.clear();
        if (request == null) {
            return;
        }

        final Throwable cause = haltCause;
        if (cause != null) {
            request.response().completeExceptionally(halted(cause));
            return;
        }

        inFlight = request;
        try {
            dispatch(request);
        } catch (RuntimeException e) {
            log.error("Request {} failed", request.getClass().getSimpleName(), e);
            request.response().completeExceptionally(e);
        } finally {
            inFlight = null;
        }
    }

    /**
     * Fails every request the halted dispatcher will not complete: the one it is
     * stuck on and everything queued behind it. A request the dispatcher still
     * finishes keeps whichever outcome lands first.
     */
    private void failUnprocessed() {
        final TrackerHaltedException closed = new TrackerHaltedException("tracker closed before the request was processed");
        int failed = 0;
        final Request<?> current = inFlight;
        if (current != null && current.response().completeExceptionally(closed)) {
            failed++;
        }
        // No publisher holds a claimed slot once closed is set
        final long cursor = ringBuffer.getCursor();
        for (long sequence = lastHandledSequence + 1; sequence <= cursor; sequence++) {
            final DispatchEvent event = ringBuffer.get(sequence);
            final Request<?> request = event.request;
            event.clear();
            if (request != null && request.response().completeExceptionally(closed)) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Failed {} requests left unprocessed by the halted dispatcher", failed);
        }
    }

    private void dispatch(final Request<?> request) {
        if (request instanceof Request.Ingest ingest) {
            ingest(ingest);
        } else if (request instanceof Request.AssertionCount count) {
            count.response().complete(store.latestHeight());
        } else if (request instanceof Request.InstanceCreationTxHash creation) {
            // Forwarded from the upstream source; never blocks this thread
            instanceCreationTxHash.whenComplete((hash, error) -> {
                if (error != null) {
                    creation.response().completeExceptionally(error);
                } else {
                    creation.response().complete(hash);
                }
            });
        } else if (request instanceof Request.TransactionByHash lookup) {
            final TransactionRecord record = index.lookup(lookup.transactionHash());
            DebugLogger.logQuery("[TX] %s found=%s", lookup.transactionHash(), record.found());
            lookup.response().complete(record);
        } else if (request instanceof Request.FindLogs find) {
            final List<LogEntry> logs = find.filter().find(store);
            DebugLogger.logQuery("[LOGS] %s -> %d entries", find.filter(), logs.size());
            find.response().complete(logs);
        } else {
            throw new IllegalStateException("Unknown request type: " + request.getClass().getName());
        }
    }

    private void ingest(final Request.Ingest request) {
        final long height = store.size();
        final HashChainBuilder.Ingestion ingestion;
        try {
            ingestion = builder.build(request.assertion(), height);
        } catch (RuntimeException e) {
            halt(height, e);
            request.response().completeExceptionally(e);
            return;
        }

        store.append(ingestion.assertion());
        final List<Hash> duplicates = new ArrayList<>();
        for (HashChainBuilder.IndexedTransaction tx : ingestion.transactions()) {
            final TransactionRecord previous = index.put(tx.id(), tx.record());
            if (previous != null) {
                log.warn("Transaction {} at height {} replaces the record from height {}",
                        tx.id(), height, previous.assertionIndex());
                duplicates.add(tx.id());
            }
        }

        log.debug("Ingested assertion {} with {} logs and {} transactions",
                height, ingestion.assertion().logCount(), ingestion.transactions().size());
        DebugLogger.logIngest("[INGEST] height=%d logsPostHash=%s", height, ingestion.assertion().logsPostHash());
        for (Hash duplicate : duplicates) {
            notifyMetrics("onDuplicateTransaction", () -> metrics.onDuplicateTransaction(duplicate));
        }
        final int transactionCount = ingestion.transactions().size();
        notifyMetrics("onAssertionIngested", () -> metrics.onAssertionIngested(height, transactionCount));
        request.response().complete(height);
    }

    private void halt(final long height, final Throwable cause) {
        log.error("Halting tracker: assertion at height {} could not be ingested", height, cause);
        haltCause = cause;
        notifyMetrics("onHalt", () -> metrics.onHalt(cause));
    }

    private void notifyMetrics(final String callback, final Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("Metrics callback {} failed", callback, e);
        }
    }

    private static TrackerHaltedException halted(final Throwable cause) {
        return new TrackerHaltedException("tracker halted after a fatal ingestion failure", cause);
    }

    // ==================== Events ====================

    /**
     * A request and its single-use response.
     */
    private sealed interface Request<T> {
        CompletableFuture<T> response();

        record Ingest(FinalizedAssertion assertion, CompletableFuture<Long> response) implements Request<Long> {
        }

        record AssertionCount(CompletableFuture<Long> response) implements Request<Long> {
        }

        record InstanceCreationTxHash(CompletableFuture<Hash> response) implements Request<Hash> {
        }

        record TransactionByHash(Hash transactionHash, CompletableFuture<TransactionRecord> response)
                implements Request<TransactionRecord> {
        }

        record FindLogs(LogFilter filter, CompletableFuture<List<LogEntry>> response)
                implements Request<List<LogEntry>> {
        }
    }

    /**
     * Consumer run on the dispatcher thread. Releases the thread's Keccak digest on shutdown.
     */
    private final class DispatchHandler implements EventHandler<DispatchEvent> {
        @Override
        public void onEvent(final DispatchEvent event, final long sequence, final boolean endOfBatch) {
            handleEvent(event, sequence);
        }

        @Override
        public void onShutdown() {
            Keccak256.cleanup();
        }
    }

    /**
     * Ring buffer slot. Pre-allocated and reused, so it is cleared once read.
     */
    static final class DispatchEvent {
        @Nullable Request<?> request;

        void set(final Request<?> request) {
            this.request = request;
        }

        void clear() {
            this.request = null;
        }
    }
}
