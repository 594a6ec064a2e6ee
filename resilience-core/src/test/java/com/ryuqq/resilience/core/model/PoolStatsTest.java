package com.ryuqq.resilience.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * PoolStats 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("PoolStats 테스트")
class PoolStatsTest {

    @Test
    @DisplayName("사용률은 엔드포인트 평균 백분율이다")
    void 사용률_평균_백분율() {
        // given
        PoolStats stats = new PoolStats(
            10,
            Map.of(EndpointKey.of("GET", "/a"), 5, EndpointKey.of("GET", "/b"), 10),
            Map.of()
        );

        // when & then
        assertThat(stats.utilization()).isCloseTo(75.0, within(0.001));
    }

    @Test
    @DisplayName("추적 중인 엔드포인트가 없으면 사용률은 0이다")
    void 엔드포인트_없으면_0() {
        assertThat(new PoolStats(10, null, null).utilization()).isZero();
    }
}
