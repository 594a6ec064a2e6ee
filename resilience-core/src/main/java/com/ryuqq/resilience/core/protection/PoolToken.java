package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.EndpointKey;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connection Pool 슬롯 점유 토큰.
 *
 * <p>{@link ConnectionPool#acquire}가 발급하며, 정확히 한 번 {@link ConnectionPool#release}로 반납해야 합니다.
 * 두 번째 반납은 무시됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class PoolToken {

    private final String connectionId;
    private final EndpointKey endpoint;
    private final long acquiredAt;
    private final AtomicBoolean released = new AtomicBoolean(false);

    protected PoolToken(String connectionId, EndpointKey endpoint, long acquiredAt) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId cannot be null or blank");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        this.connectionId = connectionId;
        this.endpoint = endpoint;
        this.acquiredAt = acquiredAt;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public EndpointKey getEndpoint() {
        return endpoint;
    }

    /**
     * 슬롯을 얻은 시각.
     *
     * @return epoch millis
     */
    public long getAcquiredAt() {
        return acquiredAt;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * 반납 표시 (최초 1회만 성공).
     *
     * @return 이번 호출로 반납 상태가 되었으면 true
     */
    public boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "PoolToken{" + connectionId + ", " + endpoint + '}';
    }
}
