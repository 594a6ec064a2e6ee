package com.ryuqq.resilience.core.contract;

/**
 * 복구 체인 실행 옵션 (불변 record).
 *
 * <ul>
 *   <li>maxAttempts: FallbackContext로 전달되는 시도 한도 정보 (기본 3)</li>
 *   <li>cacheResult: 성공 결과를 오프라인 캐시에 저장 (기본 false)</li>
 *   <li>cacheTtlMs: 캐시 TTL 재정의 (null이면 캐시 기본 TTL)</li>
 *   <li>skipCache: 캐시 조회 생략 (기본 false)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param maxAttempts 시도 한도 (양수)
 * @param cacheResult 결과 캐싱 여부
 * @param cacheTtlMs 캐시 TTL (밀리초, null 가능)
 * @param skipCache 캐시 조회 생략 여부
 */
public record RecoveryOptions(
    int maxAttempts,
    boolean cacheResult,
    Long cacheTtlMs,
    boolean skipCache
) {

    private static final RecoveryOptions DEFAULTS = new RecoveryOptions(3, false, null, false);

    public RecoveryOptions {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (cacheTtlMs != null && cacheTtlMs <= 0) {
            throw new IllegalArgumentException("cacheTtlMs must be positive (current: " + cacheTtlMs + ")");
        }
    }

    public static RecoveryOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 결과를 캐싱하는 옵션.
     *
     * @param cacheTtlMs 캐시 TTL (밀리초)
     * @return cacheResult=true 옵션
     */
    public static RecoveryOptions cached(long cacheTtlMs) {
        return new RecoveryOptions(3, true, cacheTtlMs, false);
    }

    public RecoveryOptions withMaxAttempts(int maxAttempts) {
        return new RecoveryOptions(maxAttempts, cacheResult, cacheTtlMs, skipCache);
    }

    public RecoveryOptions withCacheResult(boolean cacheResult) {
        return new RecoveryOptions(maxAttempts, cacheResult, cacheTtlMs, skipCache);
    }

    public RecoveryOptions withCacheTtlMs(Long cacheTtlMs) {
        return new RecoveryOptions(maxAttempts, cacheResult, cacheTtlMs, skipCache);
    }

    public RecoveryOptions withSkipCache(boolean skipCache) {
        return new RecoveryOptions(maxAttempts, cacheResult, cacheTtlMs, skipCache);
    }
}
