package com.ryuqq.resilience.core.exception;

/**
 * 네트워크 수준 장애 (재시도 가능).
 *
 * <p>연결 리셋, 타임아웃, DNS 실패처럼 HTTP 응답을 받지 못한 경우에 발생합니다.
 * RequestExecutor는 이 예외를 항상 재시도 대상으로 분류합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class TransportException extends ResilienceException {

    private final NetworkFault fault;

    public TransportException(NetworkFault fault, String message) {
        this(fault, message, null);
    }

    public TransportException(NetworkFault fault, String message, Throwable cause) {
        super("TRANSPORT-" + requireFault(fault).name(), message, cause);
        this.fault = fault;
    }

    private static NetworkFault requireFault(NetworkFault fault) {
        if (fault == null) {
            throw new IllegalArgumentException("fault cannot be null");
        }
        return fault;
    }

    public NetworkFault getFault() {
        return fault;
    }
}
