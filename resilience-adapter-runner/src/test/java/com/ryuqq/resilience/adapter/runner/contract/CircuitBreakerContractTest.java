package com.ryuqq.resilience.adapter.runner.contract;

import com.ryuqq.resilience.adapter.runner.DefaultResilientClient;
import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.ConnectionPoolConfig;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.HttpStatusException;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.model.TransportResponse;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Contract Test: Circuit Breaker trip and recovery through the client.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Trip: failureThreshold consecutive failures open the breaker</li>
 *   <li>Recovery: after resetTimeout a single probe closes it again</li>
 *   <li>Isolation: one endpoint's breaker does not gate another endpoint</li>
 *   <li>Reset: resetCircuitBreakers restores CLOSED for every endpoint</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class CircuitBreakerContractTest extends AbstractContractTest {

    private static final RequestDescriptor LIST = RequestDescriptor.get("/workflows");
    private static final EndpointKey LIST_KEY = EndpointKey.of("GET", "/workflows");

    private DefaultResilientClient tripAfterFive() {
        DefaultResilientClient client = newClient(RetryConfig.noRetry(),
                new CircuitBreakerConfig(5, 30_000, 60_000), new ConnectionPoolConfig());
        transport.thenRespondTimes(5, 500, null);
        for (int i = 0; i < 5; i++) {
            assertThrows(HttpStatusException.class, () -> client.execute(LIST));
        }
        return client;
    }

    @Test
    void testBreakerTrip_SixthCallRejectedWithoutTransport() {
        // Given: five consecutive failures
        DefaultResilientClient client = tripAfterFive();

        // When & Then: sixth call is rejected without reaching the transport
        assertThrows(CircuitOpenException.class, () -> client.execute(LIST));
        assertEquals(5, transport.getCallCount(),
                "OPEN breaker must not invoke the transport");
        assertBreakerState(client, LIST_KEY, CircuitBreakerState.OPEN);
    }

    @Test
    void testBreakerRecovery_ProbeAfterResetTimeoutCloses() {
        // Given: tripped breaker, transport healthy again
        DefaultResilientClient client = tripAfterFive();
        transport.otherwiseRespond(200, "ok");

        // When: still inside resetTimeout
        clock.advance(Duration.ofSeconds(29));
        assertThrows(CircuitOpenException.class, () -> client.execute(LIST));

        // When: resetTimeout elapsed
        clock.advance(Duration.ofSeconds(2));
        TransportResponse response = client.execute(LIST);

        // Then
        assertEquals("ok", response.data());
        assertBreakerState(client, LIST_KEY, CircuitBreakerState.CLOSED);
        assertEquals(0, client.getRegistry().circuitBreaker(LIST_KEY).snapshot().failureCount());
    }

    @Test
    void testBreakerRecovery_FailedProbeReopens() {
        // Given
        DefaultResilientClient client = tripAfterFive();
        transport.thenRespond(503, null);
        clock.advance(Duration.ofSeconds(31));

        // When: probe fails
        assertThrows(HttpStatusException.class, () -> client.execute(LIST));

        // Then: OPEN again with a fresh window
        assertBreakerState(client, LIST_KEY, CircuitBreakerState.OPEN);
        assertThrows(CircuitOpenException.class, () -> client.execute(LIST));
        assertEquals(6, transport.getCallCount());
    }

    @Test
    void testBreakerIsolation_OtherEndpointUnaffected() {
        // Given
        DefaultResilientClient client = tripAfterFive();
        transport.otherwiseRespond(200, "agents");

        // When
        TransportResponse response = client.execute(RequestDescriptor.get("/agents"));

        // Then
        assertEquals("agents", response.data());
        assertBreakerState(client, EndpointKey.of("GET", "/agents"), CircuitBreakerState.CLOSED);
        assertBreakerState(client, LIST_KEY, CircuitBreakerState.OPEN);
    }

    @Test
    void testResetCircuitBreakers_RestoresClosed() {
        // Given
        DefaultResilientClient client = tripAfterFive();
        transport.otherwiseRespond(200, "ok");

        // When
        client.resetCircuitBreakers();

        // Then
        assertEquals("ok", client.execute(LIST).data());
        assertBreakerState(client, LIST_KEY, CircuitBreakerState.CLOSED);
    }

    @Test
    void testSetCircuitBreakerConfig_AppliesToBreakersCreatedAfterwards() {
        // Given
        DefaultResilientClient client = newClient(RetryConfig.noRetry(),
                new CircuitBreakerConfig(5, 30_000, 60_000), new ConnectionPoolConfig());
        client.setCircuitBreakerConfig(new CircuitBreakerConfig(1, 30_000, 60_000));
        transport.thenRespond(500, null);

        // When
        assertThrows(HttpStatusException.class, () -> client.execute(LIST));

        // Then
        assertBreakerState(client, LIST_KEY, CircuitBreakerState.OPEN);
    }
}
