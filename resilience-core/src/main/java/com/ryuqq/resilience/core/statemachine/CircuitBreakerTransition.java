package com.ryuqq.resilience.core.statemachine;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (실패 임계값 도달)</li>
 *   <li>OPEN → HALF_OPEN (resetTimeout 경과 후 probe)</li>
 *   <li>HALF_OPEN → CLOSED (probe 성공)</li>
 *   <li>HALF_OPEN → OPEN (probe 실패)</li>
 *   <li>모든 상태 → CLOSED (성공 기록 또는 수동 reset)</li>
 *   <li>동일 상태 유지</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> CLOSED에서 HALF_OPEN으로, OPEN에서 probe 없이 OPEN 이외 상태로
 * 곧바로 넘어가는 전이는 없습니다 (CLOSED 강제 복귀 제외).</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitBreakerTransition {

    // Utility class - prevent instantiation
    private CircuitBreakerTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid circuit breaker transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == to || to == CircuitBreakerState.CLOSED) {
            return true;
        }
        switch (from) {
            case CLOSED:
                return to == CircuitBreakerState.OPEN;
            case OPEN:
                return to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN:
                return to == CircuitBreakerState.OPEN;
            default:
                return false;
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }
}
