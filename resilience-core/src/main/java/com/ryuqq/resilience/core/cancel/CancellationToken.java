package com.ryuqq.resilience.core.cancel;

import com.ryuqq.resilience.core.exception.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호출 취소 신호.
 *
 * <p>Thread interrupt 대신 명시적으로 전달되는 취소 토큰입니다.
 * 두 개의 대기 지점에서 사용됩니다.</p>
 * <ul>
 *   <li>Connection Pool 슬롯 대기: 취소 즉시 대기열에서 제거</li>
 *   <li>재시도 backoff sleep: 취소 즉시 sleep 중단</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * ExecuteOptions options = ExecuteOptions.defaults().withCancellationToken(token);
 *
 * // 다른 스레드에서
 * token.cancel("user aborted");
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch signal = new CountDownLatch(1);
    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * 새 취소 토큰 생성.
     *
     * @return 취소 가능한 토큰
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * 절대 취소되지 않는 공유 토큰.
     *
     * @return 취소 불가능한 토큰
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * 취소 요청.
     *
     * <p>최초 호출에서만 리스너가 실행됩니다. 리스너 예외는 로그만 남기고 나머지 리스너를 계속 실행합니다.</p>
     *
     * @param reason 취소 사유
     * @return 이번 호출로 취소 상태가 되었으면 true, 이미 취소된 경우 false
     * @throws UnsupportedOperationException {@link #none()} 토큰을 취소하려는 경우
     */
    public boolean cancel(String reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        this.reason = reason == null ? "cancelled" : reason;
        signal.countDown();
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed: {}", e.getMessage(), e);
            }
        }
        listeners.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * 취소된 경우 예외 발생.
     *
     * @throws OperationCancelledException 이미 취소된 경우
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException("Operation cancelled: " + reason);
        }
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 토큰이면 호출 스레드에서 즉시 실행됩니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     */
    public Registration onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (!cancellable) {
            return () -> { };
        }
        AtomicBoolean fired = new AtomicBoolean(false);
        Runnable once = () -> {
            if (fired.compareAndSet(false, true)) {
                listener.run();
            }
        };
        listeners.add(once);
        if (isCancelled()) {
            // cancel()이 리스너 목록을 이미 순회한 뒤 등록된 경우
            listeners.remove(once);
            once.run();
        }
        return () -> listeners.remove(once);
    }

    /**
     * 취소 가능한 sleep.
     *
     * @param millis 대기 시간 (밀리초, 0 이하면 취소 여부만 확인)
     * @throws OperationCancelledException 대기 중 취소되거나 스레드가 인터럽트된 경우
     */
    public void sleep(long millis) {
        throwIfCancelled();
        if (millis <= 0) {
            return;
        }
        try {
            if (signal.await(millis, TimeUnit.MILLISECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Sleep interrupted", e);
        }
    }

    /**
     * 리스너 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
