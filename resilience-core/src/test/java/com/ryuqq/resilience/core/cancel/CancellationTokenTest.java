package com.ryuqq.resilience.core.cancel;

import com.ryuqq.resilience.core.exception.OperationCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CancellationToken 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("CancellationToken 테스트")
class CancellationTokenTest {

    @Test
    @DisplayName("cancel()은 최초 1회만 true를 반환하고 리스너를 한 번 실행한다")
    void cancel_최초_1회() {
        // given
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        // when
        boolean first = token.cancel("stop");
        boolean second = token.cancel("again");

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(token.getReason()).isEqualTo("stop");
    }

    @Test
    @DisplayName("이미 취소된 토큰에 등록한 리스너는 즉시 실행된다")
    void 취소_후_등록_즉시_실행() {
        // given
        CancellationToken token = CancellationToken.create();
        token.cancel("done");
        AtomicInteger calls = new AtomicInteger();

        // when
        token.onCancel(calls::incrementAndGet);

        // then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("등록 해제된 리스너는 실행되지 않는다")
    void 등록_해제() {
        // given
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);

        // when
        registration.close();
        token.cancel("stop");

        // then
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("리스너 예외는 다른 리스너 실행을 막지 않는다")
    void 리스너_예외_격리() {
        // given
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        // when
        token.cancel("stop");

        // then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("none() 토큰은 취소할 수 없다")
    void none_취소_불가() {
        assertThat(CancellationToken.none().isCancelled()).isFalse();
        assertThatThrownBy(() -> CancellationToken.none().cancel("x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("sleep()은 취소 즉시 OperationCancelledException으로 깨어난다")
    void sleep_취소_즉시_중단() {
        // given
        CancellationToken token = CancellationToken.create();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(() -> token.cancel("user aborted"), 50, TimeUnit.MILLISECONDS);

        try {
            // when
            long start = System.nanoTime();
            assertThatThrownBy(() -> token.sleep(10_000))
                .isInstanceOf(OperationCancelledException.class)
                .hasMessageContaining("user aborted");
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            // then
            assertThat(elapsedMs).isLessThan(5_000);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("취소되지 않으면 sleep()은 지정 시간 후 정상 반환한다")
    void sleep_정상_반환() {
        // given
        CancellationToken token = CancellationToken.create();

        // when
        long start = System.nanoTime();
        token.sleep(20);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // then
        assertThat(elapsedMs).isGreaterThanOrEqualTo(15);
        assertThat(token.isCancelled()).isFalse();
    }
}
