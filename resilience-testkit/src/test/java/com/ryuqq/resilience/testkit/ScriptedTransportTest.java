package com.ryuqq.resilience.testkit;

import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.NetworkFault;
import com.ryuqq.resilience.core.exception.TransportException;
import com.ryuqq.resilience.core.model.TransportResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Testkit 테스트 더블 검증.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("ScriptedTransport, MutableClock 테스트")
class ScriptedTransportTest {

    private final RequestDescriptor descriptor = RequestDescriptor.get("/workflows");

    @Test
    @DisplayName("스크립트 순서대로 응답하고 비면 기본 단계를 반복한다")
    void 스크립트_순서() {
        // given
        ScriptedTransport transport = new ScriptedTransport()
            .thenRespond(503, "down")
            .thenFail(new TransportException(NetworkFault.CONNECTION_RESET, "reset"))
            .otherwiseRespond(200, "ok");

        // when
        TransportResponse first = transport.call(descriptor);

        // then
        assertThat(first.statusCode()).isEqualTo(503);
        assertThatThrownBy(() -> transport.call(descriptor))
            .isInstanceOf(TransportException.class);
        assertThat(transport.call(descriptor).data()).isEqualTo("ok");
        assertThat(transport.call(descriptor).data()).isEqualTo("ok");
        assertThat(transport.getCallCount()).isEqualTo(4);
        assertThat(transport.getRemainingSteps()).isZero();
    }

    @Test
    @DisplayName("호출 명세를 기록한다")
    void 호출_기록() {
        // given
        ScriptedTransport transport = ScriptedTransport.alwaysOk("ok");

        // when
        transport.call(descriptor);
        transport.call(RequestDescriptor.post("/workflows", "{}"));

        // then
        assertThat(transport.getCalls()).extracting(RequestDescriptor::method)
            .containsExactly("GET", "POST");
        assertThat(transport.getMaxInFlight()).isEqualTo(1);
        assertThat(transport.getInFlight()).isZero();
    }

    @Test
    @DisplayName("MutableClock은 advance한 만큼만 진행한다")
    void 시계_진행() {
        // given
        MutableClock clock = MutableClock.fixed();
        Instant start = clock.instant();

        // when
        clock.advanceMillis(1500);
        clock.advance(Duration.ofSeconds(1));

        // then
        assertThat(clock.millis() - start.toEpochMilli()).isEqualTo(2500);
        assertThatThrownBy(() -> clock.advance(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
