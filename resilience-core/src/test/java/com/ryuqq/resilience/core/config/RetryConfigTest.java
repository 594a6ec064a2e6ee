package com.ryuqq.resilience.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryConfig 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("RetryConfig 테스트")
class RetryConfigTest {

    @Test
    @DisplayName("기본 생성자는 기본값을 사용한다")
    void 기본값() {
        // when
        RetryConfig config = new RetryConfig();

        // then
        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.baseDelayMs()).isEqualTo(1000);
        assertThat(config.maxDelayMs()).isEqualTo(10000);
        assertThat(config.backoffMultiplier()).isEqualTo(2.0);
        assertThat(config.retryableStatusCodes()).containsExactlyInAnyOrder(408, 429, 500, 502, 503, 504);
    }

    @Test
    @DisplayName("재시도 대상 상태 코드를 판별한다")
    void 상태_코드_판별() {
        RetryConfig config = new RetryConfig();

        assertThat(config.isRetryableStatus(503)).isTrue();
        assertThat(config.isRetryableStatus(429)).isTrue();
        assertThat(config.isRetryableStatus(404)).isFalse();
        assertThat(config.isRetryableStatus(400)).isFalse();
    }

    @Test
    @DisplayName("withXxx는 해당 값만 바꾼 새 인스턴스를 만든다")
    void wither_새_인스턴스() {
        // given
        RetryConfig original = new RetryConfig();

        // when
        RetryConfig changed = original.withMaxRetries(5).withRetryableStatusCodes(Set.of(503));

        // then
        assertThat(original.maxRetries()).isEqualTo(3);
        assertThat(changed.maxRetries()).isEqualTo(5);
        assertThat(changed.baseDelayMs()).isEqualTo(1000);
        assertThat(changed.retryableStatusCodes()).containsExactly(503);
    }

    @Test
    @DisplayName("noRetry()는 maxRetries=0이다")
    void noRetry() {
        assertThat(RetryConfig.noRetry().maxRetries()).isZero();
    }

    @Test
    @DisplayName("maxDelayMs가 baseDelayMs보다 작으면 예외를 던진다")
    void maxDelay_검증() {
        assertThatThrownBy(() -> new RetryConfig(3, 1000, 500, 2.0, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs must be >= baseDelayMs");
    }

    @Test
    @DisplayName("음수 maxRetries와 1 미만 multiplier는 거부된다")
    void 음수_검증() {
        assertThatThrownBy(() -> new RetryConfig().withMaxRetries(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryConfig().withBackoffMultiplier(0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
