package com.ryuqq.resilience.application.stats;

import com.ryuqq.resilience.core.model.CacheStats;

import java.util.Map;

/**
 * 복구 체인 통계.
 *
 * <p>primary 성공, fallback 성공, 전체 실패가 모두 한 건씩 집계됩니다. 캐시 적중은 포함되지 않습니다.</p>
 *
 * @param totalOperations 기록된 복구 실행 수
 * @param successRate 성공률 (0.0 ~ 100.0)
 * @param fallbackUsageRate fallback 사용률 (0.0 ~ 100.0)
 * @param averageRecoveryTimeMs 평균 소요 시간 (밀리초)
 * @param operationStats operation별 통계
 * @param cacheStats 오프라인 캐시 통계
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record RecoveryStats(
    int totalOperations,
    double successRate,
    double fallbackUsageRate,
    double averageRecoveryTimeMs,
    Map<String, OperationStats> operationStats,
    CacheStats cacheStats
) {

    public RecoveryStats {
        operationStats = operationStats == null ? Map.of() : Map.copyOf(operationStats);
    }

    /**
     * operation 단위 통계.
     *
     * @param count 실행 수
     * @param successRate 성공률 (0.0 ~ 100.0)
     * @param averageRecoveryTimeMs 평균 소요 시간 (밀리초)
     */
    public record OperationStats(int count, double successRate, double averageRecoveryTimeMs) {
    }
}
