package com.ryuqq.resilience.core.model;

import java.util.Map;

/**
 * Connection Pool 통계 스냅샷.
 *
 * @param maxConnections 엔드포인트당 최대 동시 연결 수
 * @param activeConnections 엔드포인트별 사용 중인 슬롯 수
 * @param waitingQueues 엔드포인트별 대기자 수
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record PoolStats(
    int maxConnections,
    Map<EndpointKey, Integer> activeConnections,
    Map<EndpointKey, Integer> waitingQueues
) {

    public PoolStats {
        activeConnections = activeConnections == null ? Map.of() : Map.copyOf(activeConnections);
        waitingQueues = waitingQueues == null ? Map.of() : Map.copyOf(waitingQueues);
    }

    /**
     * 엔드포인트 평균 사용률 (백분율).
     *
     * <p>추적 중인 엔드포인트가 없으면 0을 반환합니다.</p>
     *
     * @return 0.0 ~ 100.0
     */
    public double utilization() {
        if (activeConnections.isEmpty() || maxConnections <= 0) {
            return 0.0;
        }
        long total = 0;
        for (int active : activeConnections.values()) {
            total += active;
        }
        return (double) total / ((long) activeConnections.size() * maxConnections) * 100.0;
    }
}
