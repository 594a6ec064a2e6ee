package com.ryuqq.resilience.application.stats;

import com.ryuqq.resilience.core.model.CallMetric;
import com.ryuqq.resilience.core.model.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.model.PoolStats;

import java.util.List;
import java.util.Map;

/**
 * 연결 확인 결과.
 *
 * @param connected probe 요청 성공 여부
 * @param latencyMs probe 소요 시간 (밀리초)
 * @param error probe 실패 메시지 (성공 시 null)
 * @param breakers 엔드포인트별 Breaker 스냅샷
 * @param poolStats Connection Pool 통계
 * @param recentMetrics 최근 호출 메트릭 (최대 10건)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record ConnectivityReport(
    boolean connected,
    long latencyMs,
    String error,
    Map<EndpointKey, CircuitBreakerSnapshot> breakers,
    PoolStats poolStats,
    List<CallMetric> recentMetrics
) {

    public ConnectivityReport {
        breakers = breakers == null ? Map.of() : Map.copyOf(breakers);
        recentMetrics = recentMetrics == null ? List.of() : List.copyOf(recentMetrics);
    }
}
