package com.ryuqq.resilience.core.contract;

import com.ryuqq.resilience.core.model.EndpointKey;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Transport 호출 명세.
 *
 * <p>Resilience 계층은 요청을 {@code (method, url, body, timeout)} 조합으로만 다루며
 * 본문 내용은 해석하지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>method:</strong> HTTP 메서드 (대문자 정규화)</li>
 *   <li><strong>url:</strong> 호출 대상 (절대 URL 또는 base URL 기준 상대 경로)</li>
 *   <li><strong>pathTemplate:</strong> 엔드포인트 키 산출용 템플릿 (예: /workflows/{id}, null 가능)</li>
 *   <li><strong>headers:</strong> 요청 헤더 (null이면 빈 Map)</li>
 *   <li><strong>body:</strong> 요청 본문 (null 가능)</li>
 *   <li><strong>timeoutMs:</strong> 호출 타임아웃 (0이면 기본값 적용)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RequestDescriptor descriptor = RequestDescriptor.of("GET", "/workflows/42")
 *     .withPathTemplate("/workflows/{id}")
 *     .withTimeoutMs(5000);
 * </pre>
 *
 * @param method HTTP 메서드
 * @param url 호출 대상 URL 또는 경로
 * @param pathTemplate 경로 템플릿 (null 가능)
 * @param headers 요청 헤더
 * @param body 요청 본문 (null 가능)
 * @param timeoutMs 호출 타임아웃 (밀리초, 0이면 미지정)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record RequestDescriptor(
    String method,
    String url,
    String pathTemplate,
    Map<String, String> headers,
    Object body,
    long timeoutMs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException url이 비어 있거나 timeoutMs가 음수인 경우
     */
    public RequestDescriptor {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        method = (method == null || method.isBlank()) ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        // pathTemplate, body는 null 허용
    }

    public static RequestDescriptor of(String method, String url) {
        return new RequestDescriptor(method, url, null, Map.of(), null, 0);
    }

    public static RequestDescriptor get(String url) {
        return of("GET", url);
    }

    public static RequestDescriptor post(String url, Object body) {
        return new RequestDescriptor("POST", url, null, Map.of(), body, 0);
    }

    /**
     * 이 요청의 엔드포인트 키.
     *
     * <p>pathTemplate이 있으면 템플릿 기준, 없으면 URL 경로 기준으로 산출합니다.</p>
     *
     * @return EndpointKey
     */
    public EndpointKey endpointKey() {
        return EndpointKey.of(method, pathTemplate != null ? pathTemplate : url);
    }

    /**
     * 캐시 키 산출용 요청 식별 정보.
     *
     * <p>method, url, body만 포함합니다. 헤더(API 키, 요청 ID 등)와 timeout은 제외되므로
     * 헤더만 다른 두 요청은 같은 캐시 항목을 공유합니다.</p>
     *
     * @return method, url, body를 담은 Map (body는 null 가능)
     */
    public Map<String, Object> cacheIdentity() {
        Map<String, Object> identity = new LinkedHashMap<>();
        identity.put("method", method);
        identity.put("url", url);
        identity.put("body", body);
        return identity;
    }

    public boolean hasTimeout() {
        return timeoutMs > 0;
    }

    public RequestDescriptor withPathTemplate(String pathTemplate) {
        return new RequestDescriptor(method, url, pathTemplate, headers, body, timeoutMs);
    }

    public RequestDescriptor withHeaders(Map<String, String> headers) {
        return new RequestDescriptor(method, url, pathTemplate, headers, body, timeoutMs);
    }

    public RequestDescriptor withBody(Object body) {
        return new RequestDescriptor(method, url, pathTemplate, headers, body, timeoutMs);
    }

    public RequestDescriptor withTimeoutMs(long timeoutMs) {
        return new RequestDescriptor(method, url, pathTemplate, headers, body, timeoutMs);
    }
}
