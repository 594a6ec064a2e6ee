package com.ryuqq.resilience.core.config;

/**
 * Connection Pool 설정 (불변 record).
 *
 * <p>{@code connectionTimeoutMs}는 {@code JdkHttpTransport}의 기본 연결 타임아웃으로 쓰이며,
 * 슬롯 획득 대기와는 무관합니다. 슬롯 획득 대기 상한은 {@code acquireTimeoutMs}로 제어합니다.</p>
 *
 * <p>{@code idleTimeoutMs}는 검증만 거치는 정보용 값입니다. 슬롯은 호출이 끝나면 즉시 반납되어
 * 유휴 상태로 남지 않고, {@code java.net.http.HttpClient}는 클라이언트 단위 유휴 타임아웃을 제공하지
 * 않으므로 Pool과 Transport 어느 쪽도 이 값을 읽지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param maxConnections 엔드포인트당 최대 동시 호출 수 (양수, 기본 10)
 * @param connectionTimeoutMs 연결 타임아웃 (밀리초, 양수, 기본 30000)
 * @param idleTimeoutMs 유휴 연결 타임아웃 (밀리초, 양수, 기본 60000, 정보용)
 * @param acquireTimeoutMs 슬롯 획득 최대 대기 시간 (밀리초, 0이면 무제한, 기본 0)
 */
public record ConnectionPoolConfig(
    int maxConnections,
    long connectionTimeoutMs,
    long idleTimeoutMs,
    long acquireTimeoutMs
) {

    public ConnectionPoolConfig() {
        this(10, 30000, 60000, 0);
    }

    public ConnectionPoolConfig {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException(
                "maxConnections must be positive (current: " + maxConnections + ")"
            );
        }
        if (connectionTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "connectionTimeoutMs must be positive (current: " + connectionTimeoutMs + ")"
            );
        }
        if (idleTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "idleTimeoutMs must be positive (current: " + idleTimeoutMs + ")"
            );
        }
        if (acquireTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "acquireTimeoutMs cannot be negative (current: " + acquireTimeoutMs + ")"
            );
        }
    }

    public ConnectionPoolConfig withMaxConnections(int maxConnections) {
        return new ConnectionPoolConfig(maxConnections, connectionTimeoutMs, idleTimeoutMs, acquireTimeoutMs);
    }

    public ConnectionPoolConfig withConnectionTimeoutMs(long connectionTimeoutMs) {
        return new ConnectionPoolConfig(maxConnections, connectionTimeoutMs, idleTimeoutMs, acquireTimeoutMs);
    }

    public ConnectionPoolConfig withIdleTimeoutMs(long idleTimeoutMs) {
        return new ConnectionPoolConfig(maxConnections, connectionTimeoutMs, idleTimeoutMs, acquireTimeoutMs);
    }

    public ConnectionPoolConfig withAcquireTimeoutMs(long acquireTimeoutMs) {
        return new ConnectionPoolConfig(maxConnections, connectionTimeoutMs, idleTimeoutMs, acquireTimeoutMs);
    }
}
