package com.ryuqq.resilience.adapter.runner.contract;

import com.ryuqq.resilience.adapter.runner.DefaultResilientClient;
import com.ryuqq.resilience.core.cancel.CancellationToken;
import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.ConnectionPoolConfig;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.contract.ExecuteOptions;
import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.OperationCancelledException;
import com.ryuqq.resilience.core.exception.PoolTimeoutException;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.model.TransportResponse;
import com.ryuqq.resilience.core.protection.ConnectionPool;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Contract Test: Connection Pool bound and fairness through the client.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Bound: in-flight transport calls never exceed maxConnections</li>
 *   <li>Fairness: waiters are admitted in arrival order</li>
 *   <li>Timeout: a waiter gives up with PoolTimeoutException</li>
 *   <li>Cancellation: a cancelled waiter leaves the queue immediately</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class ConnectionPoolContractTest extends AbstractContractTest {

    private static final EndpointKey KEY = EndpointKey.of("GET", "/workflows");

    private DefaultResilientClient clientWithMax(int maxConnections) {
        return newClient(RetryConfig.noRetry(), new CircuitBreakerConfig(),
                new ConnectionPoolConfig().withMaxConnections(maxConnections));
    }

    private TransportResponse blockUntil(CountDownLatch gate) {
        try {
            if (!gate.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
        return TransportResponse.of(200, "ok");
    }

    private void awaitCondition(String description, BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for: " + description);
            }
            sleep(5);
        }
    }

    @Test
    void testPoolBound_InFlightNeverExceedsMax() throws Exception {
        // Given
        DefaultResilientClient client = clientWithMax(3);
        transport.otherwise(request -> {
            sleep(15);
            return TransportResponse.of(200, "ok");
        });
        ExecutorService executor = Executors.newFixedThreadPool(10);

        // When
        try {
            List<Future<TransportResponse>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                futures.add(executor.submit(() -> client.execute(RequestDescriptor.get("/workflows"))));
            }
            for (Future<TransportResponse> future : futures) {
                assertEquals("ok", future.get(10, TimeUnit.SECONDS).data());
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertTrue(transport.getMaxInFlight() <= 3,
                "max in-flight was " + transport.getMaxInFlight());
        assertEquals(0, client.getRegistry().getConnectionPool().getActiveCount(KEY));
    }

    @Test
    void testPoolFairness_WaitersAdmittedInArrivalOrder() throws Exception {
        // Given: one slot held by the first request
        DefaultResilientClient client = clientWithMax(1);
        ConnectionPool pool = client.getRegistry().getConnectionPool();
        CountDownLatch gate = new CountDownLatch(1);
        transport.thenAnswer(request -> blockUntil(gate));
        ExecutorService executor = Executors.newFixedThreadPool(4);

        try {
            List<Future<TransportResponse>> futures = new ArrayList<>();
            futures.add(executor.submit(() -> client.execute(RequestDescriptor.get("/workflows?n=0"))));
            awaitCondition("first request in transport", () -> transport.getInFlight() == 1);

            // When: three more requests queue up one after another
            for (int n = 1; n <= 3; n++) {
                String url = "/workflows?n=" + n;
                futures.add(executor.submit(() -> client.execute(RequestDescriptor.get(url))));
                int expectedWaiting = n;
                awaitCondition("waiter " + n + " queued", () -> pool.getWaitingCount(KEY) == expectedWaiting);
            }
            gate.countDown();
            for (Future<TransportResponse> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        List<String> order = transport.getCalls().stream()
                .map(RequestDescriptor::url)
                .collect(Collectors.toList());
        assertEquals(List.of("/workflows?n=0", "/workflows?n=1", "/workflows?n=2", "/workflows?n=3"), order);
    }

    @Test
    void testPoolTimeout_WaiterGivesUp() throws Exception {
        // Given
        DefaultResilientClient client = clientWithMax(1);
        CountDownLatch gate = new CountDownLatch(1);
        transport.thenAnswer(request -> blockUntil(gate));
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<TransportResponse> holder = executor.submit(() -> client.execute(RequestDescriptor.get("/workflows")));
            awaitCondition("holder in transport", () -> transport.getInFlight() == 1);

            // When
            try {
                client.execute(RequestDescriptor.get("/workflows"),
                        ExecuteOptions.defaults().withAcquireTimeoutMs(50L));
                fail("Expected PoolTimeoutException");
            } catch (PoolTimeoutException e) {
                // Then
                assertEquals(KEY, e.getEndpoint());
            }
            assertEquals(0, client.getRegistry().getConnectionPool().getWaitingCount(KEY));

            gate.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, transport.getCallCount());
    }

    @Test
    void testPoolCancellation_WaiterLeavesQueue() throws Exception {
        // Given
        DefaultResilientClient client = clientWithMax(1);
        ConnectionPool pool = client.getRegistry().getConnectionPool();
        CountDownLatch gate = new CountDownLatch(1);
        transport.thenAnswer(request -> blockUntil(gate));
        CancellationToken token = CancellationToken.create();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<TransportResponse> holder = executor.submit(() -> client.execute(RequestDescriptor.get("/workflows")));
            awaitCondition("holder in transport", () -> transport.getInFlight() == 1);
            Future<TransportResponse> waiter = executor.submit(() -> client.execute(RequestDescriptor.get("/workflows"),
                    ExecuteOptions.defaults().withCancellationToken(token)));
            awaitCondition("waiter queued", () -> pool.getWaitingCount(KEY) == 1);

            // When
            token.cancel("user aborted");

            // Then
            try {
                waiter.get(5, TimeUnit.SECONDS);
                fail("Expected OperationCancelledException");
            } catch (ExecutionException e) {
                assertInstanceOf(OperationCancelledException.class, e.getCause());
            }
            assertEquals(0, pool.getWaitingCount(KEY));

            gate.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(0, pool.getActiveCount(KEY));
        assertEquals(1, transport.getCallCount());
    }
}
