package com.ryuqq.resilience.testkit;

import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.model.TransportResponse;
import com.ryuqq.resilience.core.spi.Transport;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 미리 정한 순서대로 응답하는 테스트용 Transport.
 *
 * <p>스크립트에 등록된 단계를 호출마다 하나씩 소비하며, 스크립트가 비면 기본 단계
 * ({@link #otherwise}로 지정, 초기값은 200 응답)를 반복합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedTransport transport = new ScriptedTransport()
 *     .thenRespond(503, "unavailable")
 *     .thenFail(new TransportException(NetworkFault.CONNECTION_RESET, "reset"))
 *     .thenRespond(200, "ok");
 *
 * assertThat(transport.getCallCount()).isEqualTo(3);
 * </pre>
 *
 * <p>호출 명세와 동시 실행 수(최대값 포함)를 기록하므로 Pool 상한 검증에도 사용됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ScriptedTransport implements Transport {

    private final ConcurrentLinkedQueue<Function<RequestDescriptor, TransportResponse>> script =
        new ConcurrentLinkedQueue<>();
    private final List<RequestDescriptor> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile Function<RequestDescriptor, TransportResponse> otherwise =
        descriptor -> TransportResponse.of(200, null);

    /**
     * 항상 같은 성공 응답을 돌려주는 Transport.
     *
     * @param data 응답 데이터
     * @return ScriptedTransport
     */
    public static ScriptedTransport alwaysOk(Object data) {
        return new ScriptedTransport().otherwiseRespond(200, data);
    }

    public ScriptedTransport thenRespond(int statusCode, Object data) {
        TransportResponse response = TransportResponse.of(statusCode, data);
        return thenAnswer(descriptor -> response);
    }

    public ScriptedTransport thenFail(RuntimeException error) {
        return thenAnswer(failing(error));
    }

    /**
     * 임의 동작 단계 추가.
     *
     * <p>응답을 늦추거나 latch로 붙잡아 두는 등 동시성 테스트에 사용합니다.</p>
     *
     * @param step 요청을 받아 응답을 만드는 함수 (예외를 던져도 됨)
     * @return this
     */
    public ScriptedTransport thenAnswer(Function<RequestDescriptor, TransportResponse> step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        script.add(step);
        return this;
    }

    /**
     * 같은 단계를 여러 번 추가.
     *
     * @param times 반복 횟수
     * @param statusCode 응답 상태 코드
     * @param data 응답 데이터
     * @return this
     */
    public ScriptedTransport thenRespondTimes(int times, int statusCode, Object data) {
        for (int i = 0; i < times; i++) {
            thenRespond(statusCode, data);
        }
        return this;
    }

    public ScriptedTransport otherwise(Function<RequestDescriptor, TransportResponse> step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        this.otherwise = step;
        return this;
    }

    public ScriptedTransport otherwiseRespond(int statusCode, Object data) {
        TransportResponse response = TransportResponse.of(statusCode, data);
        return otherwise(descriptor -> response);
    }

    public ScriptedTransport otherwiseFail(RuntimeException error) {
        return otherwise(failing(error));
    }

    private static Function<RequestDescriptor, TransportResponse> failing(RuntimeException error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return descriptor -> {
            throw error;
        };
    }

    @Override
    public TransportResponse call(RequestDescriptor descriptor) {
        calls.add(descriptor);
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            Function<RequestDescriptor, TransportResponse> step = script.poll();
            return (step != null ? step : otherwise).apply(descriptor);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public int getCallCount() {
        return calls.size();
    }

    public List<RequestDescriptor> getCalls() {
        return List.copyOf(calls);
    }

    /**
     * 지금 실행 중인 호출 수.
     *
     * @return inFlight
     */
    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * 관측된 최대 동시 호출 수.
     *
     * @return maxInFlight
     */
    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    public int getRemainingSteps() {
        return script.size();
    }
}
