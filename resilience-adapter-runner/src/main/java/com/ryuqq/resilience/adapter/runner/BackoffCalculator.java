package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.config.RetryConfig;

/**
 * Exponential Backoff 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되 상한을 넘지 않도록 합니다.
 * jitterFactor를 지정하면 Thundering Herd를 피하기 위한 무작위 지연이 더해집니다 (기본 0).</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * multiplier^attempt, maxDelay)
 * delay = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, multiplier=2, maxDelay=10000ms, jitter 없음):</strong></p>
 * <ul>
 *   <li>attempt=0: 1000ms</li>
 *   <li>attempt=1: 2000ms</li>
 *   <li>attempt=2: 4000ms</li>
 *   <li>attempt=3: 8000ms</li>
 *   <li>attempt=4: 16000ms (capped at maxDelay=10000ms)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final double jitterFactor;

    /**
     * 재시도 설정 기반 생성 (jitter 없음).
     *
     * @param retryConfig 재시도 설정
     */
    public BackoffCalculator(RetryConfig retryConfig) {
        this(requireConfig(retryConfig).baseDelayMs(), retryConfig.maxDelayMs(),
            retryConfig.backoffMultiplier(), 0.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param multiplier 지수 배수 (1.0 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double multiplier, double jitterFactor) {
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
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
    }

    private static RetryConfig requireConfig(RetryConfig retryConfig) {
        if (retryConfig == null) {
            throw new IllegalArgumentException("retryConfig cannot be null");
        }
        return retryConfig;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 방금 실패한 attempt 인덱스 (0부터 시작)
     * @return 다음 attempt 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public long calculate(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt cannot be negative (current: " + attempt + ")"
            );
        }

        // 1. 지수적 백오프 (double 연산 후 상한 적용, overflow 없음)
        double exponential = Math.min(baseDelayMs * Math.pow(multiplier, attempt), (double) maxDelayMs);

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        double jitter = exponential * jitterFactor * Math.random();

        // 3. 최대값 제한
        return (long) Math.min(exponential + jitter, (double) maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
