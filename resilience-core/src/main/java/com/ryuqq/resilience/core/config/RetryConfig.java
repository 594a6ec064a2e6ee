package com.ryuqq.resilience.core.config;

import java.util.Set;

/**
 * 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 최대 재시도 횟수 (기본 3, 총 시도 횟수는 maxRetries + 1)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간 (기본 1000ms)</li>
 *   <li>maxDelayMs: 대기 시간 상한 (기본 10000ms)</li>
 *   <li>backoffMultiplier: 지수 배수 (기본 2.0)</li>
 *   <li>retryableStatusCodes: 재시도 대상 HTTP 상태 코드 (기본 408, 429, 500, 502, 503, 504)</li>
 * </ul>
 *
 * <p><strong>대기 시간 계산:</strong> {@code min(baseDelayMs * backoffMultiplier^attempt, maxDelayMs)}</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseDelayMs 기본 대기 시간 (밀리초, 0 이상)
 * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상)
 * @param backoffMultiplier 지수 배수 (1.0 이상)
 * @param retryableStatusCodes 재시도 대상 상태 코드
 */
public record RetryConfig(
    int maxRetries,
    long baseDelayMs,
    long maxDelayMs,
    double backoffMultiplier,
    Set<Integer> retryableStatusCodes
) {

    /**
     * 기본 재시도 대상 상태 코드.
     */
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, baseDelayMs=1000, maxDelayMs=10000, backoffMultiplier=2.0</p>
     */
    public RetryConfig() {
        this(3, 1000, 10000, 2.0, DEFAULT_RETRYABLE_STATUS_CODES);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries cannot be negative (current: " + maxRetries + ")"
            );
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException(
                "backoffMultiplier must be >= 1.0 (current: " + backoffMultiplier + ")"
            );
        }
        retryableStatusCodes = retryableStatusCodes == null ? Set.of() : Set.copyOf(retryableStatusCodes);
    }

    /**
     * 재시도 없이 한 번만 시도하는 설정.
     *
     * @return maxRetries=0 설정
     */
    public static RetryConfig noRetry() {
        return new RetryConfig().withMaxRetries(0);
    }

    /**
     * 상태 코드가 재시도 대상인지 확인.
     *
     * @param statusCode HTTP 상태 코드
     * @return 재시도 대상이면 true
     */
    public boolean isRetryableStatus(int statusCode) {
        return retryableStatusCodes.contains(statusCode);
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, retryableStatusCodes);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withBaseDelayMs(long baseDelayMs) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, retryableStatusCodes);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, retryableStatusCodes);
    }

    /**
     * backoffMultiplier만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withBackoffMultiplier(double backoffMultiplier) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, retryableStatusCodes);
    }

    /**
     * retryableStatusCodes만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withRetryableStatusCodes(Set<Integer> retryableStatusCodes) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, retryableStatusCodes);
    }
}
