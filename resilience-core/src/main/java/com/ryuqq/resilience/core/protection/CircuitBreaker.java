package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.model.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.model.EndpointKey;

import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>엔드포인트 하나의 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 불안정한 외부 API로 호출이 계속 몰리는 것을 막습니다. 인스턴스는 엔드포인트당 하나입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.circuitBreaker(EndpointKey.of("GET", "/workflows"));
 *
 * TransportResponse response = cb.execute(() -> transport.call(descriptor));
 *
 * // 또는 직접 제어
 * if (!cb.tryAcquire()) {
 *     throw new CircuitOpenException(cb.getEndpoint(), cb.getState());
 * }
 * try {
 *     TransportResponse response = transport.call(descriptor);
 *     cb.recordSuccess();
 *     return response;
 * } catch (RuntimeException e) {
 *     cb.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 이 Breaker가 보호하는 엔드포인트.
     *
     * @return EndpointKey
     */
    EndpointKey getEndpoint();

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: nextAttemptTime 이전이면 false, 이후면 HALF_OPEN으로 전이하고 true (probe)</li>
     *   <li>HALF_OPEN: probe가 진행 중이면 false</li>
     * </ul>
     *
     * <p>true를 받은 호출자는 반드시 {@link #recordSuccess()} 또는
     * {@link #recordFailure(Throwable)} 중 하나를 호출해야 합니다.</p>
     *
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <p>failureCount를 0으로 초기화하고 CLOSED로 전이합니다.</p>
     */
    void recordSuccess();

    /**
     * 실행 실패 기록.
     *
     * <p>failureCount를 증가시키고, 임계값에 도달하면 OPEN으로 전이합니다.</p>
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 상태 스냅샷 조회.
     *
     * @return 상태, 실패 수, 마지막 실패 시각, 다음 시도 가능 시각
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>운영자 수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * Breaker를 거쳐 작업 실행.
     *
     * <p>원래 예외는 상태 전이 여부와 관계없이 그대로 전파됩니다.</p>
     *
     * @param operation 보호할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws CircuitOpenException 통과가 허용되지 않은 경우 (작업은 호출되지 않음)
     */
    default <T> T execute(Supplier<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (!tryAcquire()) {
            throw new CircuitOpenException(getEndpoint(), getState());
        }
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }
}
