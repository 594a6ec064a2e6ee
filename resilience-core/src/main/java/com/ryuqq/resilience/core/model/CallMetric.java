package com.ryuqq.resilience.core.model;

/**
 * 단일 {@code execute} 호출의 결과 기록.
 *
 * <p>재시도를 포함한 호출 하나당 하나의 CallMetric이 기록되며,
 * {@code retryCount}는 마지막으로 수행된 attempt 인덱스입니다.</p>
 *
 * @param endpoint 엔드포인트 키
 * @param method HTTP 메서드
 * @param startTime 시작 시각 (epoch millis)
 * @param endTime 종료 시각 (epoch millis)
 * @param statusCode HTTP 상태 코드 (응답이 없었으면 null)
 * @param success 성공 여부
 * @param retryCount 재시도 횟수 (첫 시도는 0)
 * @param error 오류 메시지 (성공 시 null)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record CallMetric(
    EndpointKey endpoint,
    String method,
    long startTime,
    long endTime,
    Integer statusCode,
    boolean success,
    int retryCount,
    String error
) {

    public CallMetric {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (endTime < startTime) {
            throw new IllegalArgumentException("endTime cannot be before startTime (start: " + startTime + ", end: " + endTime + ")");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount cannot be negative (current: " + retryCount + ")");
        }
        if (method == null) {
            method = endpoint.getMethod();
        }
    }

    /**
     * 호출 소요 시간.
     *
     * @return 밀리초
     */
    public long durationMs() {
        return endTime - startTime;
    }
}
