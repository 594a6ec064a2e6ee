package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.CallMetric;

import java.util.List;

/**
 * 호출 메트릭 기록 SPI.
 *
 * <p>용량이 제한된 append-only 로그입니다. 용량을 넘으면 가장 오래된 항목부터 제거됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface MetricsRecorder {

    /**
     * 메트릭 추가.
     *
     * @param metric 호출 결과
     */
    void record(CallMetric metric);

    /**
     * 최근 메트릭 조회 (오래된 것부터).
     *
     * @param limit 최대 개수
     * @return 최근 limit개 메트릭
     */
    List<CallMetric> recent(int limit);

    /**
     * 최근 K건의 성공률.
     *
     * @param lastK 집계 대상 건수
     * @return 0.0 ~ 100.0 (기록이 없으면 0)
     */
    double successRate(int lastK);

    /**
     * 최근 K건의 평균 소요 시간.
     *
     * @param lastK 집계 대상 건수
     * @return 밀리초 (기록이 없으면 0)
     */
    double averageLatencyMs(int lastK);

    int size();

    int capacity();

    void clear();
}
