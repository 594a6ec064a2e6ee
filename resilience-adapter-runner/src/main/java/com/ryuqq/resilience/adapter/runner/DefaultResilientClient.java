package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.adapter.inmemory.cache.InMemoryOfflineCache;
import com.ryuqq.resilience.adapter.runner.recovery.PreloadTask;
import com.ryuqq.resilience.adapter.runner.recovery.RecoveryManager;
import com.ryuqq.resilience.application.client.RecoveryResult;
import com.ryuqq.resilience.application.client.ResilientClient;
import com.ryuqq.resilience.application.stats.ConnectivityReport;
import com.ryuqq.resilience.application.stats.HealthStats;
import com.ryuqq.resilience.application.stats.RecoveryStats;
import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.contract.ExecuteOptions;
import com.ryuqq.resilience.core.contract.RecoveryOptions;
import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.model.CallMetric;
import com.ryuqq.resilience.core.model.TransportResponse;
import com.ryuqq.resilience.core.recovery.FallbackStrategy;
import com.ryuqq.resilience.core.spi.MetricsRecorder;
import com.ryuqq.resilience.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@link ResilientClient} 기본 구현체.
 *
 * <p>요청 실행은 {@link RequestExecutor}, 복구 체인은 {@link RecoveryManager}에 위임하고,
 * 상태 조회는 {@link ResilienceRegistry}의 Breaker/Pool/메트릭을 조합해 만듭니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class DefaultResilientClient implements ResilientClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultResilientClient.class);

    /**
     * 연결 확인 보고서에 포함할 최근 메트릭 수.
     */
    static final int CONNECTIVITY_RECENT_METRICS = 10;

    private final ResilienceRegistry registry;
    private final RequestExecutor executor;
    private final RecoveryManager recoveryManager;

    public DefaultResilientClient(ResilienceRegistry registry, Transport transport, RecoveryManager recoveryManager) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (recoveryManager == null) {
            throw new IllegalArgumentException("recoveryManager cannot be null");
        }
        this.registry = registry;
        this.executor = new RequestExecutor(registry, transport);
        this.recoveryManager = recoveryManager;
    }

    /**
     * 기본 설정과 인메모리 구성요소로 생성.
     *
     * @param transport Transport
     * @return DefaultResilientClient
     */
    public static DefaultResilientClient inMemory(Transport transport) {
        return inMemory(transport, Clock.systemUTC());
    }

    /**
     * 기본 설정과 인메모리 구성요소로 생성 (Clock 지정).
     *
     * @param transport Transport
     * @param clock 시간 소스
     * @return DefaultResilientClient
     */
    public static DefaultResilientClient inMemory(Transport transport, Clock clock) {
        ResilienceRegistry registry = ResilienceRegistry.inMemory(clock);
        RecoveryManager recoveryManager = new RecoveryManager(new InMemoryOfflineCache(InMemoryOfflineCache.DEFAULT_TTL_MS, clock), clock);
        return new DefaultResilientClient(registry, transport, recoveryManager);
    }

    @Override
    public TransportResponse execute(RequestDescriptor descriptor, ExecuteOptions options) {
        return executor.execute(descriptor, options);
    }

    @Override
    public RecoveryResult<TransportResponse> executeWithFallback(String operationName,
                                                                 RequestDescriptor descriptor,
                                                                 RecoveryOptions options) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        return recoveryManager.executeWithFallback(
            operationName, () -> execute(descriptor), descriptor.cacheIdentity(), options);
    }

    @Override
    public <T> RecoveryResult<T> executeWithFallback(String operationName, Callable<T> primary,
                                                     Object args, RecoveryOptions options) {
        return recoveryManager.executeWithFallback(operationName, primary, args, options);
    }

    @Override
    public void addFallbackStrategy(String operationName, FallbackStrategy strategy) {
        recoveryManager.addFallbackStrategy(operationName, strategy);
    }

    @Override
    public boolean toggleFallbackStrategy(String operationName, String strategyName, boolean enabled) {
        return recoveryManager.toggleFallbackStrategy(operationName, strategyName, enabled);
    }

    /**
     * 캐시 예열.
     *
     * @param tasks 예열 작업
     * @return 저장에 성공한 작업 수
     * @see RecoveryManager#preloadCache(List)
     */
    public int preloadCache(List<PreloadTask> tasks) {
        return recoveryManager.preloadCache(tasks);
    }

    @Override
    public HealthStats getHealthStats() {
        MetricsRecorder metrics = registry.getMetricsRecorder();
        return new HealthStats(
            Math.min(metrics.size(), HealthStats.WINDOW),
            metrics.successRate(HealthStats.WINDOW),
            metrics.averageLatencyMs(HealthStats.WINDOW),
            registry.circuitBreakerStates(),
            registry.getConnectionPool().getStats().utilization()
        );
    }

    @Override
    public RecoveryStats getRecoveryStats() {
        return recoveryManager.getRecoveryStats();
    }

    @Override
    public List<CallMetric> getRecentMetrics(int limit) {
        return registry.getMetricsRecorder().recent(limit);
    }

    @Override
    public ConnectivityReport checkConnectivity(RequestDescriptor probe) {
        if (probe == null) {
            throw new IllegalArgumentException("probe cannot be null");
        }
        Clock clock = registry.getClock();
        long start = clock.millis();
        boolean connected;
        String error = null;
        try {
            execute(probe, ExecuteOptions.defaults().withSkipRetry(true));
            connected = true;
        } catch (RuntimeException e) {
            connected = false;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Connectivity check failed: {} {}, error={}", probe.method(), probe.url(), error);
        }
        long latencyMs = Math.max(0L, clock.millis() - start);
        return new ConnectivityReport(
            connected,
            latencyMs,
            error,
            registry.circuitBreakerSnapshots(),
            registry.getConnectionPool().getStats(),
            registry.getMetricsRecorder().recent(CONNECTIVITY_RECENT_METRICS)
        );
    }

    @Override
    public void resetCircuitBreakers() {
        registry.resetCircuitBreakers();
    }

    @Override
    public void reset() {
        registry.reset();
        recoveryManager.reset();
    }

    @Override
    public void setRetryConfig(RetryConfig retryConfig) {
        registry.setRetryConfig(retryConfig);
    }

    @Override
    public void setCircuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig) {
        registry.setCircuitBreakerConfig(circuitBreakerConfig);
    }

    public ResilienceRegistry getRegistry() {
        return registry;
    }

    public RecoveryManager getRecoveryManager() {
        return recoveryManager;
    }
}
