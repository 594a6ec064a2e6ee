package com.ryuqq.resilience.adapter.runner.recovery;

import com.ryuqq.resilience.core.recovery.FallbackContext;
import com.ryuqq.resilience.core.recovery.FallbackStrategy;
import com.ryuqq.resilience.core.spi.OfflineCache;

import java.util.NoSuchElementException;

/**
 * 마지막으로 캐시된 결과를 돌려주는 fallback 전략.
 *
 * <p>컨텍스트의 캐시 키로 오프라인 캐시를 조회합니다. {@code skipCache}로 primary를 강제 호출하면서도
 * 장애 시에는 캐시된 데이터로 물러서고 싶을 때 사용합니다. 항목이 없으면 다음 전략으로 넘어갑니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CachedResultFallbackStrategy implements FallbackStrategy {

    public static final String NAME = "cached-result";

    private final OfflineCache cache;
    private final int priority;

    public CachedResultFallbackStrategy(OfflineCache cache, int priority) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        this.cache = cache;
        this.priority = priority;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public Object execute(FallbackContext context) {
        return cache.get(context.cacheKey())
            .orElseThrow(() -> new NoSuchElementException("No cached result for " + context.cacheKey()));
    }
}
