package com.ryuqq.resilience.core.exception;

/**
 * 2xx가 아닌 HTTP 응답.
 *
 * <p>상태 코드가 {@code RetryConfig.retryableStatusCodes}에 포함된 경우에만 재시도됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class HttpStatusException extends ResilienceException {

    private final int statusCode;
    private final Object responseBody;

    public HttpStatusException(int statusCode, Object responseBody, String message) {
        super("HTTP-" + statusCode, message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public HttpStatusException(int statusCode, Object responseBody) {
        this(statusCode, responseBody, "Request failed with status code " + statusCode);
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * 오류 응답 본문.
     *
     * @return 응답 본문 (없으면 null)
     */
    public Object getResponseBody() {
        return responseBody;
    }
}
