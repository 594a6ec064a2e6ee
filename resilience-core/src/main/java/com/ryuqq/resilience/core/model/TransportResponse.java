package com.ryuqq.resilience.core.model;

import java.util.Map;

/**
 * Transport 호출 응답.
 *
 * <p>응답 본문은 해석하지 않고 그대로 전달합니다 (opaque payload).</p>
 *
 * @param statusCode HTTP 상태 코드
 * @param data 응답 데이터 (null 가능)
 * @param headers 응답 헤더 (null이면 빈 Map)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record TransportResponse(
    int statusCode,
    Object data,
    Map<String, String> headers
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException statusCode가 100~599 범위를 벗어난 경우
     */
    public TransportResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be between 100 and 599 (current: " + statusCode + ")");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportResponse of(int statusCode, Object data) {
        return new TransportResponse(statusCode, data, Map.of());
    }

    /**
     * 2xx 응답 여부.
     *
     * @return 성공 응답이면 true
     */
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
