package com.ryuqq.resilience.core.config;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <ul>
 *   <li>failureThreshold: OPEN 전이 실패 임계값 (기본 5)</li>
 *   <li>resetTimeoutMs: OPEN 유지 시간, 경과 후 HALF_OPEN probe 허용 (기본 30000ms)</li>
 *   <li>monitoringPeriodMs: 모니터링 주기 설정값, 실패 집계에는 사용하지 않음 (기본 60000ms)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param failureThreshold 실패 임계값 (양수)
 * @param resetTimeoutMs OPEN 유지 시간 (밀리초, 양수)
 * @param monitoringPeriodMs 모니터링 주기 (밀리초, 양수, 정보용)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    long resetTimeoutMs,
    long monitoringPeriodMs
) {

    public CircuitBreakerConfig() {
        this(5, 30000, 60000);
    }

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (resetTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "resetTimeoutMs must be positive (current: " + resetTimeoutMs + ")"
            );
        }
        if (monitoringPeriodMs <= 0) {
            throw new IllegalArgumentException(
                "monitoringPeriodMs must be positive (current: " + monitoringPeriodMs + ")"
            );
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, resetTimeoutMs, monitoringPeriodMs);
    }

    public CircuitBreakerConfig withResetTimeoutMs(long resetTimeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, resetTimeoutMs, monitoringPeriodMs);
    }

    public CircuitBreakerConfig withMonitoringPeriodMs(long monitoringPeriodMs) {
        return new CircuitBreakerConfig(failureThreshold, resetTimeoutMs, monitoringPeriodMs);
    }
}
