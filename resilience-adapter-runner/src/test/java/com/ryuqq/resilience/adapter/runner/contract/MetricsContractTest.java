package com.ryuqq.resilience.adapter.runner.contract;

import com.ryuqq.resilience.adapter.inmemory.metrics.RingBufferMetricsRecorder;
import com.ryuqq.resilience.adapter.runner.DefaultResilientClient;
import com.ryuqq.resilience.application.stats.ConnectivityReport;
import com.ryuqq.resilience.application.stats.HealthStats;
import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.ConnectionPoolConfig;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.HttpStatusException;
import com.ryuqq.resilience.core.model.CallMetric;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: Call metrics and health reporting through the client.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Bound: N + 50 calls keep exactly the latest N metrics in order</li>
 *   <li>Health: statistics cover the last 100 calls</li>
 *   <li>Connectivity: a failing probe is reported instead of thrown</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class MetricsContractTest extends AbstractContractTest {

    private static final RequestDescriptor LIST = RequestDescriptor.get("/workflows");

    private DefaultResilientClient newNoRetryClient() {
        return newClient(RetryConfig.noRetry(), new CircuitBreakerConfig(), new ConnectionPoolConfig());
    }

    @Test
    void testMetricsBound_KeepsLatestInOrder() {
        // Given
        DefaultResilientClient client = newNoRetryClient();
        int capacity = RingBufferMetricsRecorder.DEFAULT_CAPACITY;
        long base = clock.millis();

        // When: N + 50 calls, one millisecond apart
        for (int i = 0; i < capacity + 50; i++) {
            client.execute(LIST);
            clock.advanceMillis(1);
        }

        // Then
        List<CallMetric> recent = client.getRecentMetrics(capacity + 50);
        assertEquals(capacity, recent.size());
        assertEquals(base + 50, recent.get(0).startTime());
        assertEquals(base + capacity + 49, recent.get(recent.size() - 1).startTime());
    }

    @Test
    void testHealthStats_LastHundredCalls() {
        // Given: 50 failures followed by 100 successes
        DefaultResilientClient client = newClient(RetryConfig.noRetry(),
                new CircuitBreakerConfig(1_000, 30_000, 60_000), new ConnectionPoolConfig());
        transport.thenRespondTimes(50, 404, null).otherwiseRespond(200, "ok");
        for (int i = 0; i < 50; i++) {
            assertThrows(HttpStatusException.class, () -> client.execute(LIST));
        }
        for (int i = 0; i < 100; i++) {
            client.execute(LIST);
        }

        // When
        HealthStats stats = client.getHealthStats();

        // Then
        assertEquals(HealthStats.WINDOW, stats.totalRequests());
        assertEquals(100.0, stats.successRate(), 0.001);
        assertEquals(CircuitBreakerState.CLOSED, stats.circuitBreakerStatus().get(EndpointKey.of("GET", "/workflows")));
        assertEquals(0.0, stats.poolUtilization(), 0.001);
        assertFalse(stats.hasOpenCircuit());
    }

    @Test
    void testHealthStats_ReportsOpenCircuit() {
        // Given
        DefaultResilientClient client = newClient(RetryConfig.noRetry(),
                new CircuitBreakerConfig(2, 30_000, 60_000), new ConnectionPoolConfig());
        transport.otherwiseRespond(500, null);
        assertThrows(HttpStatusException.class, () -> client.execute(LIST));
        assertThrows(HttpStatusException.class, () -> client.execute(LIST));

        // When
        HealthStats stats = client.getHealthStats();

        // Then
        assertTrue(stats.hasOpenCircuit());
        assertEquals(0.0, stats.successRate(), 0.001);
        assertEquals(2, stats.totalRequests());
    }

    @Test
    void testConnectivity_SuccessfulProbe() {
        // Given
        DefaultResilientClient client = newNoRetryClient();
        RequestDescriptor probe = RequestDescriptor.get("/health");

        // When
        ConnectivityReport report = client.checkConnectivity(probe);

        // Then
        assertTrue(report.connected());
        assertNull(report.error());
        assertEquals(1, report.recentMetrics().size());
        assertTrue(report.breakers().containsKey(EndpointKey.of("GET", "/health")));
        assertNotNull(report.poolStats());
    }

    @Test
    void testConnectivity_FailingProbeReportedNotThrown() {
        // Given
        DefaultResilientClient client = newClient(fastRetry(), new CircuitBreakerConfig(), new ConnectionPoolConfig());
        transport.otherwiseRespond(503, null);

        // When
        ConnectivityReport report = client.checkConnectivity(RequestDescriptor.get("/health"));

        // Then
        assertFalse(report.connected());
        assertTrue(report.error().contains("503"));
        assertEquals(1, transport.getCallCount(), "probe is not retried");
    }
}
