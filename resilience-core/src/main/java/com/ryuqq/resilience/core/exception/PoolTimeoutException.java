package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.model.EndpointKey;

/**
 * Connection Pool 슬롯을 제한 시간 내에 얻지 못한 경우.
 *
 * <p>다른 네트워크 장애와 동일하게 재시도 대상으로 취급됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class PoolTimeoutException extends TransportException {

    private final EndpointKey endpoint;
    private final long timeoutMs;

    public PoolTimeoutException(EndpointKey endpoint, long timeoutMs) {
        super(NetworkFault.POOL_TIMEOUT,
            "Timed out after " + timeoutMs + "ms waiting for a connection slot: " + endpoint);
        this.endpoint = endpoint;
        this.timeoutMs = timeoutMs;
    }

    public EndpointKey getEndpoint() {
        return endpoint;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
