package com.ryuqq.resilience.application.stats;

import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;

import java.util.Map;

/**
 * 최근 호출 기준 상태 통계.
 *
 * @param totalRequests 집계 대상 호출 수 (최대 100)
 * @param successRate 성공률 (0.0 ~ 100.0)
 * @param averageLatencyMs 평균 소요 시간 (밀리초)
 * @param circuitBreakerStatus 엔드포인트별 Breaker 상태
 * @param poolUtilization Connection Pool 사용률 (0.0 ~ 100.0)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record HealthStats(
    int totalRequests,
    double successRate,
    double averageLatencyMs,
    Map<EndpointKey, CircuitBreakerState> circuitBreakerStatus,
    double poolUtilization
) {

    /**
     * 집계 대상 호출 수.
     */
    public static final int WINDOW = 100;

    public HealthStats {
        if (totalRequests < 0) {
            throw new IllegalArgumentException("totalRequests cannot be negative (current: " + totalRequests + ")");
        }
        circuitBreakerStatus = circuitBreakerStatus == null ? Map.of() : Map.copyOf(circuitBreakerStatus);
    }

    /**
     * OPEN 상태인 Breaker가 하나라도 있는지 확인.
     *
     * @return OPEN Breaker가 있으면 true
     */
    public boolean hasOpenCircuit() {
        return circuitBreakerStatus.containsValue(CircuitBreakerState.OPEN);
    }
}
