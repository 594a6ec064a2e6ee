package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.cancel.CancellationToken;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.contract.ExecuteOptions;
import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.HttpStatusException;
import com.ryuqq.resilience.core.model.CallMetric;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.model.TransportResponse;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.ConnectionPool;
import com.ryuqq.resilience.core.protection.PoolToken;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 재시도 요청 실행기.
 *
 * <p><strong>처리 흐름 (attempt 0..maxRetries):</strong></p>
 * <ol>
 *   <li>취소 여부 확인</li>
 *   <li>Connection Pool 슬롯 획득</li>
 *   <li>Circuit Breaker를 거쳐 Transport 호출 (non-2xx는 HttpStatusException)</li>
 *   <li>슬롯 반납</li>
 *   <li>실패 시 {@link RetryClassifier}로 재시도 여부 판단</li>
 *   <li>재시도 대상이면 backoff 후 다음 attempt, 아니면 원래 예외 전파</li>
 * </ol>
 *
 * <p>backoff sleep은 슬롯을 반납한 뒤에 수행되며, 취소 토큰으로 즉시 중단할 수 있습니다.
 * 호출 하나당 {@link CallMetric} 하나가 기록됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    /**
     * 요청 명세에 타임아웃이 없을 때 적용되는 기본값 (30초).
     */
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    private final ResilienceRegistry registry;
    private final Transport transport;

    public RequestExecutor(ResilienceRegistry registry, Transport transport) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.registry = registry;
        this.transport = transport;
    }

    /**
     * 요청 실행.
     *
     * @param descriptor 요청 명세
     * @param options 호출 옵션 (null이면 기본값)
     * @return 2xx 응답
     */
    public TransportResponse execute(RequestDescriptor descriptor, ExecuteOptions options) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        ExecuteOptions effective = options == null ? ExecuteOptions.defaults() : options;
        RequestDescriptor request = descriptor.hasTimeout() ? descriptor : descriptor.withTimeoutMs(DEFAULT_TIMEOUT_MS);
        EndpointKey endpoint = request.endpointKey();
        RetryConfig retryConfig = effective.effectiveRetryConfig(registry.getRetryConfig());
        BackoffCalculator backoff = new BackoffCalculator(retryConfig);
        CancellationToken cancellation = effective.cancellationToken();
        long acquireTimeoutMs = effective.acquireTimeoutMs() != null
            ? effective.acquireTimeoutMs()
            : registry.getConnectionPool().getConfig().acquireTimeoutMs();

        long startTime = registry.getClock().millis();
        int attempt = 0;
        try {
            while (true) {
                cancellation.throwIfCancelled();
                try {
                    TransportResponse response = attemptOnce(request, endpoint, effective, cancellation, acquireTimeoutMs);
                    record(endpoint, request.method(), startTime, response.statusCode(), true, attempt, null);
                    return response;
                } catch (RuntimeException e) {
                    if (!RetryClassifier.isRetryable(e, retryConfig) || attempt >= retryConfig.maxRetries()) {
                        throw e;
                    }
                    long delayMs = backoff.calculate(attempt);
                    log.warn("Attempt {} failed for {}, retrying in {}ms: {}",
                        attempt + 1, endpoint, delayMs, e.getMessage());
                    cancellation.sleep(delayMs);
                    attempt++;
                }
            }
        } catch (RuntimeException e) {
            Integer statusCode = e instanceof HttpStatusException ? ((HttpStatusException) e).getStatusCode() : null;
            record(endpoint, request.method(), startTime, statusCode, false, attempt, messageOf(e));
            throw e;
        }
    }

    private TransportResponse attemptOnce(RequestDescriptor request,
                                          EndpointKey endpoint,
                                          ExecuteOptions options,
                                          CancellationToken cancellation,
                                          long acquireTimeoutMs) {
        ConnectionPool pool = registry.getConnectionPool();
        PoolToken token = pool.acquire(endpoint, cancellation, acquireTimeoutMs);
        try {
            CircuitBreaker breaker = options.skipCircuitBreaker()
                ? new NoOpCircuitBreaker(endpoint)
                : registry.circuitBreaker(endpoint);
            return breaker.execute(() -> call(request));
        } finally {
            pool.release(token);
        }
    }

    private TransportResponse call(RequestDescriptor request) {
        TransportResponse response = transport.call(request);
        if (response == null) {
            throw new IllegalStateException("Transport returned null response: " + request.method() + " " + request.url());
        }
        if (!response.isSuccessful()) {
            throw new HttpStatusException(response.statusCode(), response.data());
        }
        return response;
    }

    private void record(EndpointKey endpoint, String method, long startTime,
                        Integer statusCode, boolean success, int retryCount, String error) {
        long endTime = Math.max(startTime, registry.getClock().millis());
        registry.getMetricsRecorder().record(
            new CallMetric(endpoint, method, startTime, endTime, statusCode, success, retryCount, error));
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
