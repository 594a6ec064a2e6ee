package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.adapter.inmemory.metrics.RingBufferMetricsRecorder;
import com.ryuqq.resilience.adapter.inmemory.protection.InMemoryCircuitBreaker;
import com.ryuqq.resilience.adapter.inmemory.protection.InMemoryConnectionPool;
import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.ConnectionPoolConfig;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.model.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.ConnectionPool;
import com.ryuqq.resilience.core.spi.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resilience 상태 보관소.
 *
 * <p>엔드포인트별 Circuit Breaker(지연 생성), Connection Pool, 호출 메트릭, 기본 재시도 설정을
 * 한 곳에서 소유합니다. 프로세스 전역 싱글턴 대신 RequestExecutor와 Client에 주입됩니다.</p>
 *
 * <p><strong>설정 변경:</strong> {@link #setCircuitBreakerConfig}는 이후 생성되는 Breaker에만 적용됩니다.
 * {@link #resetCircuitBreakers()}로 기존 Breaker를 비우면 다음 호출부터 새 설정이 적용됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ResilienceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResilienceRegistry.class);

    private final ConcurrentHashMap<EndpointKey, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final ConnectionPool connectionPool;
    private final MetricsRecorder metricsRecorder;
    private final Clock clock;
    private volatile RetryConfig retryConfig;
    private volatile CircuitBreakerConfig circuitBreakerConfig;

    public ResilienceRegistry(RetryConfig retryConfig,
                              CircuitBreakerConfig circuitBreakerConfig,
                              ConnectionPool connectionPool,
                              MetricsRecorder metricsRecorder,
                              Clock clock) {
        if (retryConfig == null) {
            throw new IllegalArgumentException("retryConfig cannot be null");
        }
        if (circuitBreakerConfig == null) {
            throw new IllegalArgumentException("circuitBreakerConfig cannot be null");
        }
        if (connectionPool == null) {
            throw new IllegalArgumentException("connectionPool cannot be null");
        }
        if (metricsRecorder == null) {
            throw new IllegalArgumentException("metricsRecorder cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.retryConfig = retryConfig;
        this.circuitBreakerConfig = circuitBreakerConfig;
        this.connectionPool = connectionPool;
        this.metricsRecorder = metricsRecorder;
        this.clock = clock;
    }

    /**
     * 기본 설정의 In-memory 구성.
     *
     * @param clock 시계
     * @return ResilienceRegistry
     */
    public static ResilienceRegistry inMemory(Clock clock) {
        return inMemory(new RetryConfig(), new CircuitBreakerConfig(), new ConnectionPoolConfig(), clock);
    }

    /**
     * 지정한 설정의 In-memory 구성.
     *
     * @param retryConfig 기본 재시도 설정
     * @param circuitBreakerConfig Breaker 설정
     * @param poolConfig Pool 설정
     * @param clock 시계
     * @return ResilienceRegistry
     */
    public static ResilienceRegistry inMemory(RetryConfig retryConfig,
                                              CircuitBreakerConfig circuitBreakerConfig,
                                              ConnectionPoolConfig poolConfig,
                                              Clock clock) {
        return new ResilienceRegistry(
            retryConfig,
            circuitBreakerConfig,
            new InMemoryConnectionPool(poolConfig, clock),
            new RingBufferMetricsRecorder(),
            clock
        );
    }

    /**
     * 엔드포인트의 Circuit Breaker 조회 (없으면 현재 설정으로 생성).
     *
     * @param endpoint 엔드포인트 키
     * @return CircuitBreaker
     */
    public CircuitBreaker circuitBreaker(EndpointKey endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        return circuitBreakers.computeIfAbsent(endpoint,
            key -> new InMemoryCircuitBreaker(key, circuitBreakerConfig, clock));
    }

    /**
     * 엔드포인트별 Breaker 상태 (키 문자열 순).
     *
     * @return 상태 Map
     */
    public Map<EndpointKey, CircuitBreakerState> circuitBreakerStates() {
        Map<EndpointKey, CircuitBreakerState> states = new LinkedHashMap<>();
        circuitBreakers.entrySet().stream()
            .sorted(Map.Entry.comparingByKey(Comparator.comparing(EndpointKey::getValue)))
            .forEach(entry -> states.put(entry.getKey(), entry.getValue().getState()));
        return states;
    }

    /**
     * 엔드포인트별 Breaker 스냅샷 (키 문자열 순).
     *
     * @return 스냅샷 Map
     */
    public Map<EndpointKey, CircuitBreakerSnapshot> circuitBreakerSnapshots() {
        Map<EndpointKey, CircuitBreakerSnapshot> snapshots = new LinkedHashMap<>();
        circuitBreakers.entrySet().stream()
            .sorted(Map.Entry.comparingByKey(Comparator.comparing(EndpointKey::getValue)))
            .forEach(entry -> snapshots.put(entry.getKey(), entry.getValue().snapshot()));
        return snapshots;
    }

    /**
     * 모든 Circuit Breaker 제거.
     *
     * <p>다음 호출에서 CLOSED 상태의 Breaker가 현재 설정으로 새로 만들어집니다.</p>
     */
    public void resetCircuitBreakers() {
        circuitBreakers.clear();
        log.info("All circuit breakers reset");
    }

    /**
     * Breaker, Pool 카운터, 호출 메트릭 초기화.
     */
    public void reset() {
        circuitBreakers.clear();
        connectionPool.reset();
        metricsRecorder.clear();
        log.info("Resilience registry reset");
    }

    public ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    public MetricsRecorder getMetricsRecorder() {
        return metricsRecorder;
    }

    public Clock getClock() {
        return clock;
    }

    public RetryConfig getRetryConfig() {
        return retryConfig;
    }

    public void setRetryConfig(RetryConfig retryConfig) {
        if (retryConfig == null) {
            throw new IllegalArgumentException("retryConfig cannot be null");
        }
        this.retryConfig = retryConfig;
        log.info("Retry config updated: {}", retryConfig);
    }

    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }

    public void setCircuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig) {
        if (circuitBreakerConfig == null) {
            throw new IllegalArgumentException("circuitBreakerConfig cannot be null");
        }
        this.circuitBreakerConfig = circuitBreakerConfig;
        log.info("Circuit breaker config updated: {}", circuitBreakerConfig);
    }
}
