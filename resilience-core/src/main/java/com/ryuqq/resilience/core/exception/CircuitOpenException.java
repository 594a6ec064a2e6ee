package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker가 호출을 시도하지 않고 즉시 거부한 경우.
 *
 * <p>Breaker 자체가 차단 게이트이므로 RequestExecutor는 이 예외를 재시도하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ResilienceException {

    private final EndpointKey endpoint;
    private final CircuitBreakerState state;

    public CircuitOpenException(EndpointKey endpoint, CircuitBreakerState state) {
        super("CB-OPEN", "Circuit breaker is " + state + " - requests blocked: " + endpoint);
        this.endpoint = endpoint;
        this.state = state;
    }

    public EndpointKey getEndpoint() {
        return endpoint;
    }

    /**
     * 거부 시점의 상태.
     *
     * @return OPEN 또는 HALF_OPEN (probe 진행 중)
     */
    public CircuitBreakerState getState() {
        return state;
    }
}
