package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (failureCount &gt;= failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (resetTimeout 경과 후 첫 호출)
 * HALF_OPEN (probe 1건만 통과)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>실패 수를 추적하며, 임계값에 도달하면 OPEN 상태로 전이합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>nextAttemptTime 이전의 모든 요청은 호출 없이 거부됩니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (단일 probe 요청만 통과).
     *
     * <p>probe가 성공하면 CLOSED, 실패하면 다시 OPEN으로 전이합니다.
     * probe가 진행 중인 동안 다른 요청은 거부됩니다.</p>
     */
    HALF_OPEN
}
