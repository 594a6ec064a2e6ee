package com.ryuqq.resilience.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CircuitBreakerConfig, ConnectionPoolConfig 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("Protection 설정 테스트")
class CircuitBreakerConfigTest {

    @Test
    @DisplayName("CircuitBreakerConfig 기본값")
    void circuitBreaker_기본값() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.resetTimeoutMs()).isEqualTo(30000);
        assertThat(config.monitoringPeriodMs()).isEqualTo(60000);
    }

    @Test
    @DisplayName("failureThreshold가 0이면 예외를 던진다")
    void failureThreshold_검증() {
        assertThatThrownBy(() -> new CircuitBreakerConfig().withFailureThreshold(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("failureThreshold must be positive (current: 0)");
    }

    @Test
    @DisplayName("ConnectionPoolConfig 기본값")
    void pool_기본값() {
        ConnectionPoolConfig config = new ConnectionPoolConfig();

        assertThat(config.maxConnections()).isEqualTo(10);
        assertThat(config.connectionTimeoutMs()).isEqualTo(30000);
        assertThat(config.idleTimeoutMs()).isEqualTo(60000);
        assertThat(config.acquireTimeoutMs()).isZero();
    }

    @Test
    @DisplayName("maxConnections가 0이면 예외를 던진다")
    void maxConnections_검증() {
        assertThatThrownBy(() -> new ConnectionPoolConfig().withMaxConnections(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("idleTimeoutMs는 검증 후 그대로 보관되며 0이면 예외를 던진다")
    void idleTimeoutMs_보관과_검증() {
        ConnectionPoolConfig config = new ConnectionPoolConfig().withIdleTimeoutMs(5_000);

        assertThat(config.idleTimeoutMs()).isEqualTo(5_000);
        assertThat(config.maxConnections()).isEqualTo(10);
        assertThatThrownBy(() -> config.withIdleTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("idleTimeoutMs must be positive (current: 0)");
    }
}
