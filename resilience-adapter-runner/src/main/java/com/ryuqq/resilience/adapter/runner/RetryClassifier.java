package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.HttpStatusException;
import com.ryuqq.resilience.core.exception.OperationCancelledException;
import com.ryuqq.resilience.core.exception.TransportException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * 재시도 대상 오류 판별.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>{@link OperationCancelledException}, {@link CircuitOpenException}: 재시도 안 함</li>
 *   <li>{@link TransportException} (PoolTimeoutException 포함): 항상 재시도</li>
 *   <li>{@link IOException}, {@link UncheckedIOException}: 항상 재시도</li>
 *   <li>{@link HttpStatusException}: 상태 코드가 retryableStatusCodes에 포함될 때만 재시도</li>
 *   <li>그 외: 재시도 안 함</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RetryClassifier {

    // Utility class - prevent instantiation
    private RetryClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 재시도 대상 여부.
     *
     * @param error 발생한 오류
     * @param retryConfig 적용 중인 재시도 설정
     * @return 재시도 대상이면 true
     */
    public static boolean isRetryable(Throwable error, RetryConfig retryConfig) {
        if (error == null || retryConfig == null) {
            return false;
        }
        if (error instanceof OperationCancelledException || error instanceof CircuitOpenException) {
            return false;
        }
        if (error instanceof TransportException) {
            return true;
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return true;
        }
        if (error instanceof HttpStatusException) {
            return retryConfig.isRetryableStatus(((HttpStatusException) error).getStatusCode());
        }
        return false;
    }
}
