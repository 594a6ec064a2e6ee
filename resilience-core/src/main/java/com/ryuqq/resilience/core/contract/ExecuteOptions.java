package com.ryuqq.resilience.core.contract;

import com.ryuqq.resilience.core.cancel.CancellationToken;
import com.ryuqq.resilience.core.config.RetryConfig;

/**
 * 호출 단위 실행 옵션 (불변 record).
 *
 * <ul>
 *   <li>skipCircuitBreaker: Circuit Breaker 게이트 생략 (기본 false)</li>
 *   <li>skipRetry: 재시도 없이 한 번만 시도 (기본 false)</li>
 *   <li>retryConfig: 이 호출에만 적용할 재시도 설정 (null이면 기본 설정)</li>
 *   <li>cancellationToken: 취소 토큰 (기본 {@link CancellationToken#none()})</li>
 *   <li>acquireTimeoutMs: 슬롯 획득 대기 상한 재정의 (null이면 Pool 설정값)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param skipCircuitBreaker Circuit Breaker 생략 여부
 * @param skipRetry 재시도 생략 여부
 * @param retryConfig 재시도 설정 재정의 (null 가능)
 * @param cancellationToken 취소 토큰
 * @param acquireTimeoutMs 슬롯 획득 대기 상한 재정의 (null 가능)
 */
public record ExecuteOptions(
    boolean skipCircuitBreaker,
    boolean skipRetry,
    RetryConfig retryConfig,
    CancellationToken cancellationToken,
    Long acquireTimeoutMs
) {

    private static final ExecuteOptions DEFAULTS = new ExecuteOptions(false, false, null, null, null);

    public ExecuteOptions {
        if (cancellationToken == null) {
            cancellationToken = CancellationToken.none();
        }
        if (acquireTimeoutMs != null && acquireTimeoutMs < 0) {
            throw new IllegalArgumentException("acquireTimeoutMs cannot be negative (current: " + acquireTimeoutMs + ")");
        }
    }

    public static ExecuteOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 실제 적용할 재시도 설정 결정.
     *
     * @param fallback 재정의가 없을 때 사용할 설정
     * @return skipRetry면 maxRetries=0으로 바꾼 설정
     */
    public RetryConfig effectiveRetryConfig(RetryConfig fallback) {
        RetryConfig base = retryConfig != null ? retryConfig : fallback;
        return skipRetry ? base.withMaxRetries(0) : base;
    }

    public ExecuteOptions withSkipCircuitBreaker(boolean skipCircuitBreaker) {
        return new ExecuteOptions(skipCircuitBreaker, skipRetry, retryConfig, cancellationToken, acquireTimeoutMs);
    }

    public ExecuteOptions withSkipRetry(boolean skipRetry) {
        return new ExecuteOptions(skipCircuitBreaker, skipRetry, retryConfig, cancellationToken, acquireTimeoutMs);
    }

    public ExecuteOptions withRetryConfig(RetryConfig retryConfig) {
        return new ExecuteOptions(skipCircuitBreaker, skipRetry, retryConfig, cancellationToken, acquireTimeoutMs);
    }

    public ExecuteOptions withCancellationToken(CancellationToken cancellationToken) {
        return new ExecuteOptions(skipCircuitBreaker, skipRetry, retryConfig, cancellationToken, acquireTimeoutMs);
    }

    public ExecuteOptions withAcquireTimeoutMs(Long acquireTimeoutMs) {
        return new ExecuteOptions(skipCircuitBreaker, skipRetry, retryConfig, cancellationToken, acquireTimeoutMs);
    }
}
