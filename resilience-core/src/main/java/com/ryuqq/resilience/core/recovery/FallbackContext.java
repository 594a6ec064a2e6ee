package com.ryuqq.resilience.core.recovery;

/**
 * Fallback 전략 실행 컨텍스트.
 *
 * @param operationName 논리 operation 이름
 * @param args primary 호출 인자 (null 가능)
 * @param lastError 직전 실패 (primary 또는 이전 전략)
 * @param attemptCount 이번 전략을 포함한 fallback 시도 순번 (1부터)
 * @param maxAttempts 호출자가 지정한 시도 한도
 * @param startTime 복구 체인 시작 시각 (epoch millis)
 * @param cacheKey 이 호출의 오프라인 캐시 키
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record FallbackContext(
    String operationName,
    Object args,
    Throwable lastError,
    int attemptCount,
    int maxAttempts,
    long startTime,
    String cacheKey
) {

    public FallbackContext {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (lastError == null) {
            throw new IllegalArgumentException("lastError cannot be null");
        }
        if (attemptCount <= 0) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
    }
}
