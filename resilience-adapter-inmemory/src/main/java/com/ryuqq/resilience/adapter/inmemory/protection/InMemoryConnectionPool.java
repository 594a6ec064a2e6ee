package com.ryuqq.resilience.adapter.inmemory.protection;

import com.ryuqq.resilience.core.cancel.CancellationToken;
import com.ryuqq.resilience.core.config.ConnectionPoolConfig;
import com.ryuqq.resilience.core.exception.OperationCancelledException;
import com.ryuqq.resilience.core.exception.PoolTimeoutException;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.model.PoolStats;
import com.ryuqq.resilience.core.protection.ConnectionPool;
import com.ryuqq.resilience.core.protection.PoolToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link ConnectionPool} SPI.
 *
 * <p>Bounds the number of concurrent calls per endpoint and queues the rest in FIFO order.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>slots:</strong> ConcurrentHashMap&lt;EndpointKey, EndpointSlots&gt; - one slot set per endpoint, created lazily</li>
 *   <li><strong>EndpointSlots.active:</strong> number of issued, unreleased tokens (always &lt;= maxConnections)</li>
 *   <li><strong>EndpointSlots.waiters:</strong> ArrayDeque&lt;Waiter&gt; - FIFO queue of blocked callers</li>
 * </ul>
 *
 * <p><strong>Hand-off:</strong> {@link #release(PoolToken)} completes the oldest waiter's future with a fresh
 * token while {@code active} stays unchanged, so a releasing thread can never lose the slot to a newcomer.
 * Queue removal and future completion both happen under the endpoint lock: a waiter that fails to remove
 * itself after a timeout or cancellation therefore already owns a slot (or a cancellation error).</p>
 *
 * <p><strong>Reset:</strong> {@link #reset()} swaps in an empty slot map. Tokens keep a reference to
 * the slot set that issued them, so outstanding releases and queued waiters drain inside the old
 * generation without corrupting the new counters.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ConnectionPool pool = new InMemoryConnectionPool(new ConnectionPoolConfig().withMaxConnections(5));
 *
 * PoolToken token = pool.acquire(endpoint, cancellationToken, 2000);
 * try {
 *     return transport.call(descriptor);
 * } finally {
 *     pool.release(token);
 * }
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConnectionPool.class);

    private final ConnectionPoolConfig config;
    private final Clock clock;
    private final AtomicLong connectionSequence = new AtomicLong();
    private volatile ConcurrentHashMap<EndpointKey, EndpointSlots> slots = new ConcurrentHashMap<>();

    public InMemoryConnectionPool(ConnectionPoolConfig config) {
        this(config, Clock.systemUTC());
    }

    public InMemoryConnectionPool(ConnectionPoolConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Free slot: increments {@code active} and returns immediately</li>
     *   <li>No free slot: enqueues a waiter and blocks on its future</li>
     *   <li>Timeout: removes the waiter and throws {@link PoolTimeoutException}</li>
     *   <li>Cancellation: the token's listener removes the waiter and fails it with
     *       {@link OperationCancelledException}</li>
     *   <li>Thread interrupt: treated like a cancellation (interrupt flag is restored)</li>
     * </ul>
     */
    @Override
    public PoolToken acquire(EndpointKey endpoint, CancellationToken cancellation, long acquireTimeoutMs) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (acquireTimeoutMs < 0) {
            throw new IllegalArgumentException("acquireTimeoutMs cannot be negative (current: " + acquireTimeoutMs + ")");
        }
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        token.throwIfCancelled();

        EndpointSlots endpointSlots = slots.computeIfAbsent(endpoint, EndpointSlots::new);
        Waiter waiter = new Waiter();

        endpointSlots.lock.lock();
        try {
            if (endpointSlots.active < config.maxConnections()) {
                endpointSlots.active++;
                return issue(endpointSlots);
            }
            endpointSlots.waiters.addLast(waiter);
            log.debug("Waiting for connection slot: endpoint={}, active={}, queued={}",
                endpoint, endpointSlots.active, endpointSlots.waiters.size());
        } finally {
            endpointSlots.lock.unlock();
        }

        CancellationToken.Registration registration = token.onCancel(() -> endpointSlots.fail(waiter,
            new OperationCancelledException("Cancelled while waiting for connection slot: " + endpoint
                + " (" + token.getReason() + ")")));
        try {
            return await(waiter, acquireTimeoutMs);
        } catch (TimeoutException e) {
            if (endpointSlots.remove(waiter)) {
                log.warn("Connection slot acquisition timed out: endpoint={}, timeoutMs={}", endpoint, acquireTimeoutMs);
                throw new PoolTimeoutException(endpoint, acquireTimeoutMs);
            }
            return handedOver(waiter);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (endpointSlots.remove(waiter)) {
                throw new OperationCancelledException("Interrupted while waiting for connection slot: " + endpoint, e);
            }
            return handedOver(waiter);
        } finally {
            registration.close();
        }
    }

    private static PoolToken await(Waiter waiter, long acquireTimeoutMs)
            throws TimeoutException, InterruptedException {
        try {
            return acquireTimeoutMs > 0
                ? waiter.future.get(acquireTimeoutMs, TimeUnit.MILLISECONDS)
                : waiter.future.get();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * The waiter is no longer queued, so its future has already been completed under the lock.
     */
    private static PoolToken handedOver(Waiter waiter) {
        try {
            return waiter.future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Unexpected connection slot failure", cause);
    }

    private PoolToken issue(EndpointSlots endpointSlots) {
        String connectionId = "conn-" + connectionSequence.incrementAndGet();
        return new SlotToken(connectionId, endpointSlots, clock.millis());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Oldest waiter present: hands the slot over ({@code active} unchanged)</li>
     *   <li>Nobody waiting: decrements {@code active}</li>
     *   <li>Duplicate release of the same token: ignored with a warning</li>
     * </ul>
     *
     * @throws IllegalArgumentException token is null or was not issued by an InMemoryConnectionPool
     */
    @Override
    public void release(PoolToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (!(token instanceof SlotToken)) {
            throw new IllegalArgumentException("token was not issued by InMemoryConnectionPool: " + token);
        }
        if (!token.markReleased()) {
            log.warn("Ignoring duplicate release: {}", token);
            return;
        }
        EndpointSlots endpointSlots = ((SlotToken) token).slots;
        endpointSlots.lock.lock();
        try {
            Waiter next = endpointSlots.waiters.pollFirst();
            if (next != null) {
                next.future.complete(issue(endpointSlots));
                log.debug("Connection slot handed over: endpoint={}, queued={}",
                    endpointSlots.endpoint, endpointSlots.waiters.size());
            } else {
                endpointSlots.active--;
            }
        } finally {
            endpointSlots.lock.unlock();
        }
    }

    @Override
    public int getActiveCount(EndpointKey endpoint) {
        EndpointSlots endpointSlots = slots.get(endpoint);
        if (endpointSlots == null) {
            return 0;
        }
        endpointSlots.lock.lock();
        try {
            return endpointSlots.active;
        } finally {
            endpointSlots.lock.unlock();
        }
    }

    @Override
    public int getWaitingCount(EndpointKey endpoint) {
        EndpointSlots endpointSlots = slots.get(endpoint);
        if (endpointSlots == null) {
            return 0;
        }
        endpointSlots.lock.lock();
        try {
            return endpointSlots.waiters.size();
        } finally {
            endpointSlots.lock.unlock();
        }
    }

    @Override
    public PoolStats getStats() {
        Map<EndpointKey, Integer> active = new HashMap<>();
        Map<EndpointKey, Integer> waiting = new HashMap<>();
        for (EndpointSlots endpointSlots : slots.values()) {
            endpointSlots.lock.lock();
            try {
                active.put(endpointSlots.endpoint, endpointSlots.active);
                waiting.put(endpointSlots.endpoint, endpointSlots.waiters.size());
            } finally {
                endpointSlots.lock.unlock();
            }
        }
        return new PoolStats(config.maxConnections(), active, waiting);
    }

    @Override
    public ConnectionPoolConfig getConfig() {
        return config;
    }

    @Override
    public void reset() {
        slots = new ConcurrentHashMap<>();
        log.info("Connection pool reset");
    }

    /**
     * Per-endpoint slot set: active count and FIFO wait queue under one lock.
     */
    private static final class EndpointSlots {

        private final EndpointKey endpoint;
        private final ReentrantLock lock = new ReentrantLock();
        private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();
        private int active;

        private EndpointSlots(EndpointKey endpoint) {
            this.endpoint = endpoint;
        }

        private boolean remove(Waiter waiter) {
            lock.lock();
            try {
                return waiters.remove(waiter);
            } finally {
                lock.unlock();
            }
        }

        private void fail(Waiter waiter, RuntimeException error) {
            lock.lock();
            try {
                if (waiters.remove(waiter)) {
                    waiter.future.completeExceptionally(error);
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private static final class Waiter {

        private final CompletableFuture<PoolToken> future = new CompletableFuture<>();
    }

    private static final class SlotToken extends PoolToken {

        private final EndpointSlots slots;

        private SlotToken(String connectionId, EndpointSlots slots, long acquiredAt) {
            super(connectionId, slots.endpoint, acquiredAt);
            this.slots = slots;
        }
    }
}
