package com.ryuqq.resilience.adapter.runner.recovery;

import com.ryuqq.resilience.core.recovery.FallbackContext;
import com.ryuqq.resilience.core.recovery.FallbackStrategy;

import java.util.function.Supplier;

/**
 * 고정된 축소 응답을 돌려주는 fallback 전략.
 *
 * <p>보통 가장 낮은 우선순위(가장 큰 priority)로 등록되어 최후의 수단으로 쓰입니다.
 * 값 공급자는 호출마다 실행되므로 시각 같은 동적인 값도 담을 수 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class StaticFallbackStrategy implements FallbackStrategy {

    private final String name;
    private final int priority;
    private final Supplier<?> value;

    public StaticFallbackStrategy(String name, int priority, Supplier<?> value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        this.name = name;
        this.priority = priority;
        this.value = value;
    }

    public static StaticFallbackStrategy of(String name, int priority, Object constant) {
        return new StaticFallbackStrategy(name, priority, () -> constant);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public Object execute(FallbackContext context) {
        return value.get();
    }
}
