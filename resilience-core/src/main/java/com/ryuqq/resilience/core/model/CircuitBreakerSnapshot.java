package com.ryuqq.resilience.core.model;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 상태 스냅샷 (조회 시점 기준, 불변).
 *
 * @param state 현재 상태
 * @param failureCount 누적 실패 수
 * @param lastFailureTime 마지막 실패 시각 (epoch millis, 실패가 없었으면 0)
 * @param nextAttemptTime OPEN 해제 예정 시각 (epoch millis, OPEN이 아니면 의미 없음)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    CircuitBreakerState state,
    int failureCount,
    long lastFailureTime,
    long nextAttemptTime
) {

    public CircuitBreakerSnapshot {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    public static CircuitBreakerSnapshot closed() {
        return new CircuitBreakerSnapshot(CircuitBreakerState.CLOSED, 0, 0L, 0L);
    }
}
