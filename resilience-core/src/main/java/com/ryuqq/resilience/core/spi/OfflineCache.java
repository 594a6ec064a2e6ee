package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.CacheStats;

import java.util.Optional;

/**
 * 오프라인 캐시 SPI.
 *
 * <p>TTL 기반 Map입니다. 반복 조회를 빠르게 처리하는 동시에,
 * 외부 API 장애 시 마지막으로 성공한 데이터를 제공하는 fallback 저장소로도 쓰입니다.</p>
 *
 * <p>만료 항목은 조회 시점에 제거됩니다 (lazy eviction).</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface OfflineCache {

    /**
     * 기본 TTL로 저장.
     *
     * @param key 캐시 키
     * @param data 저장할 데이터 (null 불가)
     */
    void put(String key, Object data);

    /**
     * TTL을 지정하여 저장.
     *
     * @param key 캐시 키
     * @param data 저장할 데이터 (null 불가)
     * @param ttlMs TTL (밀리초, 양수)
     */
    void put(String key, Object data, long ttlMs);

    /**
     * 조회.
     *
     * <p>{@code now - createdAt > ttl}이면 항목을 제거하고 빈 값을 반환합니다.</p>
     *
     * @param key 캐시 키
     * @return 살아있는 항목의 데이터
     */
    Optional<Object> get(String key);

    default boolean contains(String key) {
        return get(key).isPresent();
    }

    void invalidate(String key);

    void clear();

    CacheStats stats();

    long getDefaultTtlMs();
}
