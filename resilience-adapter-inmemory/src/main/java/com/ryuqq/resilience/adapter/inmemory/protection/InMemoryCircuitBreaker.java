package com.ryuqq.resilience.adapter.inmemory.protection;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.model.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.statemachine.CircuitBreakerTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link CircuitBreaker} SPI for a single endpoint.
 *
 * <p>All state is guarded by one {@link ReentrantLock}. The lock is held only while reading or
 * mutating counters, never while the protected operation runs.</p>
 *
 * <p><strong>State Machine:</strong></p>
 * <pre>
 *     CLOSED ──(failures &gt;= threshold)──&gt; OPEN
 *        ^                                  │
 *        │                                  │
 *    (success)                    (resetTimeout expires,
 *        │                         first caller only)
 *        │                                  │
 *        └──────── HALF_OPEN &lt;──────────────┘
 *                     │
 *                 (failure)
 *                     │
 *                     └──────&gt; OPEN
 * </pre>
 *
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li><strong>Single probe:</strong> the caller that moves OPEN → HALF_OPEN is the only one
 *       admitted until it records a result; everyone else is rejected.</li>
 *   <li><strong>Failure count:</strong> failures add up until a success, however far apart
 *       they arrive. {@code monitoringPeriodMs} is not consulted.</li>
 *   <li><strong>Success:</strong> resets the failure count and closes the circuit.</li>
 *   <li><strong>Failure while OPEN:</strong> a late failure from a call admitted before the trip
 *       pushes {@code nextAttemptTime} forward.</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CircuitBreaker cb = new InMemoryCircuitBreaker(
 *     EndpointKey.of("GET", "/workflows"), new CircuitBreakerConfig(), Clock.systemUTC());
 *
 * TransportResponse response = cb.execute(() -&gt; transport.call(descriptor));
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final EndpointKey endpoint;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private long lastFailureTime;
    private long nextAttemptTime;
    private boolean probeInFlight;

    public InMemoryCircuitBreaker(EndpointKey endpoint, CircuitBreakerConfig config) {
        this(endpoint, config, Clock.systemUTC());
    }

    public InMemoryCircuitBreaker(EndpointKey endpoint, CircuitBreakerConfig config, Clock clock) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.endpoint = endpoint;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public EndpointKey getEndpoint() {
        return endpoint;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    if (clock.millis() < nextAttemptTime) {
                        return false;
                    }
                    moveTo(CircuitBreakerState.HALF_OPEN);
                    probeInFlight = true;
                    log.info("Circuit breaker half-open, admitting probe: endpoint={}", endpoint);
                    return true;
                case HALF_OPEN:
                    if (probeInFlight) {
                        return false;
                    }
                    probeInFlight = true;
                    return true;
                default:
                    throw new IllegalStateException("Unknown circuit breaker state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess() {
        lock.lock();
        try {
            CircuitBreakerState previous = state;
            failureCount = 0;
            probeInFlight = false;
            moveTo(CircuitBreakerState.CLOSED);
            if (previous != CircuitBreakerState.CLOSED) {
                log.info("Circuit breaker closed: endpoint={}, previous={}", endpoint, previous);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(Throwable throwable) {
        lock.lock();
        try {
            long now = clock.millis();
            failureCount++;
            lastFailureTime = now;

            if (state == CircuitBreakerState.HALF_OPEN) {
                probeInFlight = false;
                open(now, throwable);
            } else if (failureCount >= config.failureThreshold()) {
                open(now, throwable);
            }
        } finally {
            lock.unlock();
        }
    }

    private void open(long now, Throwable cause) {
        CircuitBreakerState previous = state;
        moveTo(CircuitBreakerState.OPEN);
        nextAttemptTime = now + config.resetTimeoutMs();
        if (previous != CircuitBreakerState.OPEN) {
            log.warn("Circuit breaker opened: endpoint={}, failures={}, retryAfterMs={}, cause={}",
                endpoint, failureCount, config.resetTimeoutMs(), cause == null ? null : cause.toString());
        }
    }

    private void moveTo(CircuitBreakerState next) {
        state = CircuitBreakerTransition.transition(state, next);
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(state, failureCount, lastFailureTime, nextAttemptTime);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            moveTo(CircuitBreakerState.CLOSED);
            failureCount = 0;
            lastFailureTime = 0L;
            nextAttemptTime = 0L;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
        log.info("Circuit breaker reset: endpoint={}", endpoint);
    }

    @Override
    public String toString() {
        return "InMemoryCircuitBreaker{" + endpoint + ", " + snapshot() + '}';
    }
}
