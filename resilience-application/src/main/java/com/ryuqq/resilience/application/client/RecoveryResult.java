package com.ryuqq.resilience.application.client;

import com.ryuqq.resilience.core.model.RecoveryMetric;

/**
 * 복구 체인 실행 결과.
 *
 * <p><strong>세 가지 경로:</strong></p>
 * <ul>
 *   <li><strong>primary:</strong> primary 작업이 성공 (fallbackUsed=null, fromCache=false)</li>
 *   <li><strong>cached:</strong> 캐시 적중으로 primary를 호출하지 않음 (fromCache=true)</li>
 *   <li><strong>fallback:</strong> primary 실패 후 fallback 전략이 결과를 만듦 (fallbackUsed=전략 이름)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RecoveryResult<T> {

    private final T value;
    private final String fallbackUsed;
    private final boolean fromCache;
    private final RecoveryMetric metric;

    private RecoveryResult(T value, String fallbackUsed, boolean fromCache, RecoveryMetric metric) {
        this.value = value;
        this.fallbackUsed = fallbackUsed;
        this.fromCache = fromCache;
        this.metric = metric;
    }

    /**
     * primary 성공 결과.
     *
     * @param value 결과 값
     * @param metric 복구 메트릭
     * @param <T> 결과 타입
     * @return RecoveryResult
     * @throws IllegalArgumentException metric이 null인 경우
     */
    public static <T> RecoveryResult<T> primary(T value, RecoveryMetric metric) {
        return new RecoveryResult<>(value, null, false, requireMetric(metric));
    }

    /**
     * 캐시 적중 결과.
     *
     * <p>캐시 적중은 메트릭을 남기지 않으므로 metric은 null입니다.</p>
     *
     * @param value 캐시된 값
     * @param <T> 결과 타입
     * @return RecoveryResult
     */
    public static <T> RecoveryResult<T> cached(T value) {
        return new RecoveryResult<>(value, null, true, null);
    }

    /**
     * fallback 성공 결과.
     *
     * @param value 전략이 만든 값
     * @param strategyName 사용된 전략 이름
     * @param metric 복구 메트릭
     * @param <T> 결과 타입
     * @return RecoveryResult
     */
    public static <T> RecoveryResult<T> fallback(T value, String strategyName, RecoveryMetric metric) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("strategyName cannot be null or blank");
        }
        return new RecoveryResult<>(value, strategyName, false, requireMetric(metric));
    }

    private static RecoveryMetric requireMetric(RecoveryMetric metric) {
        if (metric == null) {
            throw new IllegalArgumentException("metric cannot be null");
        }
        return metric;
    }

    public T getValue() {
        return value;
    }

    /**
     * 사용된 fallback 전략 이름.
     *
     * @return 전략 이름 (primary 또는 캐시 경로면 null)
     */
    public String getFallbackUsed() {
        return fallbackUsed;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed != null;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    /**
     * 이번 실행의 복구 메트릭.
     *
     * @return RecoveryMetric (캐시 적중이면 null)
     */
    public RecoveryMetric getMetric() {
        return metric;
    }

    @Override
    public String toString() {
        return "RecoveryResult{" +
            "fallbackUsed=" + fallbackUsed +
            ", fromCache=" + fromCache +
            ", value=" + value +
            '}';
    }
}
