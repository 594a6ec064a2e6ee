package com.ryuqq.resilience.core.model;

import java.util.List;

/**
 * 오프라인 캐시 통계.
 *
 * @param size 저장된 항목 수 (아직 조회되지 않은 만료 항목 포함)
 * @param keys 저장된 키 목록
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record CacheStats(int size, List<String> keys) {

    public CacheStats {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }
}
