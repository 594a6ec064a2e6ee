package com.ryuqq.resilience.core.exception;

/**
 * Resilience 계층 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 unchecked이며, 로그와 메트릭에서 분류할 수 있도록
 * 오류 코드(예: {@code CB-OPEN}, {@code HTTP-503})를 함께 가집니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ResilienceException extends RuntimeException {

    private final String errorCode;

    public ResilienceException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public ResilienceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
