package com.ryuqq.resilience.testkit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트용 수동 시계.
 *
 * <p>Circuit Breaker resetTimeout, 캐시 TTL처럼 시간에 의존하는 동작을
 * 실제 대기 없이 검증할 수 있게 합니다. 여러 스레드에서 읽고 써도 안전합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MutableClock clock = MutableClock.startingAt(Instant.parse("2026-01-01T00:00:00Z"));
 * InMemoryCircuitBreaker cb = new InMemoryCircuitBreaker(endpoint, config, clock);
 *
 * clock.advanceMillis(30_000); // resetTimeout 경과
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant now;

    public MutableClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    public static MutableClock startingAt(Instant start) {
        return new MutableClock(start);
    }

    /**
     * 고정된 기준 시각(2026-01-01T00:00:00Z)에서 시작하는 시계.
     *
     * @return MutableClock
     */
    public static MutableClock fixed() {
        return new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    }

    public synchronized void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative (current: " + duration + ")");
        }
        now = now.plus(duration);
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void setTime(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        this.now = instant;
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
