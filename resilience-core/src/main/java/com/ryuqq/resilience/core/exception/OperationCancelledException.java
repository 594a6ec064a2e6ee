package com.ryuqq.resilience.core.exception;

/**
 * 호출자가 대기 중인 작업(Pool 대기, backoff sleep)을 취소한 경우.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class OperationCancelledException extends ResilienceException {

    public OperationCancelledException(String message) {
        super("CANCELLED", message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super("CANCELLED", message, cause);
    }
}
