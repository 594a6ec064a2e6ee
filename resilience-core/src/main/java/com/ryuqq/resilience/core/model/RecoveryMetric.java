package com.ryuqq.resilience.core.model;

import java.time.Instant;

/**
 * 복구 체인 실행 결과 기록.
 *
 * <p>primary 직접 성공, fallback 성공, 전체 실패 중 어떤 경로였는지와 소요 시간을 남깁니다.</p>
 *
 * @param operation 논리 operation 이름
 * @param fallbackUsed 사용된 fallback 전략 이름 (primary 성공 또는 전체 실패 시 null)
 * @param recoveryTimeMs 소요 시간 (밀리초)
 * @param success 성공 여부
 * @param error 마지막 오류 메시지 (성공 시 null)
 * @param timestamp 기록 시각
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record RecoveryMetric(
    String operation,
    String fallbackUsed,
    long recoveryTimeMs,
    boolean success,
    String error,
    Instant timestamp
) {

    public RecoveryMetric {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        if (recoveryTimeMs < 0) {
            throw new IllegalArgumentException("recoveryTimeMs cannot be negative (current: " + recoveryTimeMs + ")");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    public static RecoveryMetric primary(String operation, long recoveryTimeMs, Instant timestamp) {
        return new RecoveryMetric(operation, null, recoveryTimeMs, true, null, timestamp);
    }

    public static RecoveryMetric fallback(String operation, String strategyName, long recoveryTimeMs, Instant timestamp) {
        return new RecoveryMetric(operation, strategyName, recoveryTimeMs, true, null, timestamp);
    }

    public static RecoveryMetric failed(String operation, String error, long recoveryTimeMs, Instant timestamp) {
        return new RecoveryMetric(operation, null, recoveryTimeMs, false, error, timestamp);
    }

    public boolean usedFallback() {
        return fallbackUsed != null;
    }
}
