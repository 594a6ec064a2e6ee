package com.ryuqq.resilience.core.model;

import java.util.Locale;

/**
 * 엔드포인트 파티션 키.
 *
 * <p>{@code (method, path-template)} 조합으로 만들어지며, Circuit Breaker 상태,
 * Connection Pool 슬롯, 호출 메트릭을 엔드포인트 단위로 분리하는 데 사용됩니다.</p>
 *
 * <p><strong>형식:</strong> {@code "<METHOD> <path>"} (예: {@code "GET /workflows/{id}"})</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>method는 대문자로 정규화 (빈 값이면 GET)</li>
 *   <li>path에서 query string과 fragment는 제거</li>
 *   <li>서로 다른 엔드포인트는 절대 병합되지 않음</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class EndpointKey {

    private static final String DEFAULT_METHOD = "GET";

    private final String method;
    private final String path;

    private EndpointKey(String method, String path) {
        this.method = method;
        this.path = path;
    }

    /**
     * EndpointKey 생성.
     *
     * @param method HTTP 메서드 (null 또는 빈 값이면 GET)
     * @param pathOrUrl path template 또는 URL
     * @return EndpointKey 인스턴스
     * @throws IllegalArgumentException pathOrUrl이 null인 경우
     */
    public static EndpointKey of(String method, String pathOrUrl) {
        if (pathOrUrl == null) {
            throw new IllegalArgumentException("pathOrUrl cannot be null");
        }
        String normalizedMethod = (method == null || method.isBlank())
            ? DEFAULT_METHOD
            : method.trim().toUpperCase(Locale.ROOT);
        return new EndpointKey(normalizedMethod, normalizePath(pathOrUrl.trim()));
    }

    /**
     * 문자열 표현에서 EndpointKey 복원.
     *
     * @param value {@code "<METHOD> <path>"} 형식의 문자열
     * @return EndpointKey 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static EndpointKey parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value cannot be null or blank");
        }
        int separator = value.indexOf(' ');
        if (separator <= 0) {
            throw new IllegalArgumentException("EndpointKey must be '<METHOD> <path>' (current: " + value + ")");
        }
        return of(value.substring(0, separator), value.substring(separator + 1));
    }

    private static String normalizePath(String pathOrUrl) {
        String path = pathOrUrl;
        if (path.startsWith("http://") || path.startsWith("https://")) {
            // scheme://host 부분 제거 ({id} 같은 placeholder가 있어 URI 파싱 불가)
            int pathStart = path.indexOf('/', path.indexOf("://") + 3);
            path = pathStart < 0 ? "/" : path.substring(pathStart);
        }
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        if (path.isEmpty()) {
            return "/";
        }
        return path;
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) return b;
        if (b < 0) return a;
        return Math.min(a, b);
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    /**
     * 키 값 조회.
     *
     * @return {@code "<METHOD> <path>"}
     */
    public String getValue() {
        return method + " " + path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EndpointKey that = (EndpointKey) o;
        return method.equals(that.method) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return 31 * method.hashCode() + path.hashCode();
    }

    @Override
    public String toString() {
        return getValue();
    }
}
