/**
 * In-memory protection adapters: per-endpoint circuit breaker and connection pool.
 *
 * <h2>Concurrency Model</h2>
 *
 * <ul>
 *   <li><strong>InMemoryCircuitBreaker:</strong> one {@link java.util.concurrent.locks.ReentrantLock} per
 *       breaker; the protected call never runs under the lock</li>
 *   <li><strong>InMemoryConnectionPool:</strong> one lock per endpoint guarding the active count and the
 *       FIFO wait queue; blocked callers park on a {@link java.util.concurrent.CompletableFuture}</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>Single JVM:</strong> state is not shared across processes</li>
 *   <li><strong>No persistence:</strong> breaker state is lost on restart</li>
 * </ul>
 *
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.ConnectionPool
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.protection;
