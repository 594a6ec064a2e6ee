package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.cancel.CancellationToken;
import com.ryuqq.resilience.core.config.ConnectionPoolConfig;
import com.ryuqq.resilience.core.exception.OperationCancelledException;
import com.ryuqq.resilience.core.exception.PoolTimeoutException;
import com.ryuqq.resilience.core.model.EndpointKey;
import com.ryuqq.resilience.core.model.PoolStats;

/**
 * Connection Pool SPI.
 *
 * <p>엔드포인트별 동시 호출 수를 {@code maxConnections} 이하로 제한합니다.
 * 슬롯이 없으면 호출자는 FIFO 대기열에서 기다리며, 반납된 슬롯은 가장 오래 기다린 호출자에게
 * 원자적으로 넘겨집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * PoolToken token = pool.acquire(endpoint, cancellationToken, 5000);
 * try {
 *     return transport.call(descriptor);
 * } finally {
 *     pool.release(token);
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ConnectionPool {

    /**
     * 슬롯 획득 (필요 시 대기).
     *
     * @param endpoint 엔드포인트 키
     * @param cancellation 취소 토큰 (취소 시 대기열에서 즉시 제거)
     * @param acquireTimeoutMs 최대 대기 시간 (밀리초, 0이면 무제한)
     * @return 슬롯 토큰
     * @throws PoolTimeoutException 대기 시간 내에 슬롯을 얻지 못한 경우
     * @throws OperationCancelledException 대기 중 취소된 경우
     */
    PoolToken acquire(EndpointKey endpoint, CancellationToken cancellation, long acquireTimeoutMs);

    /**
     * 설정된 기본 타임아웃으로 슬롯 획득.
     *
     * @param endpoint 엔드포인트 키
     * @return 슬롯 토큰
     */
    default PoolToken acquire(EndpointKey endpoint) {
        return acquire(endpoint, CancellationToken.none(), getConfig().acquireTimeoutMs());
    }

    /**
     * 슬롯 반납.
     *
     * <p>대기자가 있으면 슬롯을 그대로 넘겨주고, 없으면 activeCount를 감소시킵니다.
     * 반드시 try-finally 블록에서 호출되어야 합니다.</p>
     *
     * @param token acquire로 받은 토큰
     */
    void release(PoolToken token);

    /**
     * 사용 중인 슬롯 수.
     *
     * @param endpoint 엔드포인트 키
     * @return activeCount
     */
    int getActiveCount(EndpointKey endpoint);

    /**
     * 대기 중인 호출자 수.
     *
     * @param endpoint 엔드포인트 키
     * @return 대기열 길이
     */
    int getWaitingCount(EndpointKey endpoint);

    /**
     * 전체 통계 스냅샷.
     *
     * @return PoolStats
     */
    PoolStats getStats();

    ConnectionPoolConfig getConfig();

    /**
     * 카운터 초기화.
     *
     * <p>이미 발급된 토큰의 반납과 기존 대기자의 슬롯 인계는 이전 세대 안에서 마무리됩니다.</p>
     */
    void reset();
}
