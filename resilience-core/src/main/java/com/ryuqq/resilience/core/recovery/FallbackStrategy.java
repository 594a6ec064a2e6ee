package com.ryuqq.resilience.core.recovery;

/**
 * Fallback 전략.
 *
 * <p>primary 실행이 실패했을 때 대신 결과를 만들어내는 대체 경로입니다.
 * operation 이름별로 등록되며, priority 오름차순으로 실행됩니다.
 * 예외를 던지지 않고 반환한 첫 전략의 결과가 채택됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * recoveryManager.addFallbackStrategy("getWorkflows",
 *     FallbackStrategy.of("empty-list", 2, context -> List.of()));
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface FallbackStrategy {

    /**
     * 전략 이름 (operation 안에서 고유).
     *
     * @return 이름
     */
    String name();

    /**
     * 실행 우선순위 (작을수록 먼저).
     *
     * @return priority
     */
    int priority();

    /**
     * 대체 결과 생성.
     *
     * @param context 실행 컨텍스트
     * @return 대체 결과 (null 허용)
     * @throws Exception 이 전략으로도 복구할 수 없는 경우 (다음 전략으로 진행)
     */
    Object execute(FallbackContext context) throws Exception;

    /**
     * 람다 기반 전략 생성.
     *
     * @param name 전략 이름
     * @param priority 우선순위
     * @param body 실행 본문
     * @return FallbackStrategy
     */
    static FallbackStrategy of(String name, int priority, Body body) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return new FallbackStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int priority() {
                return priority;
            }

            @Override
            public Object execute(FallbackContext context) throws Exception {
                return body.execute(context);
            }

            @Override
            public String toString() {
                return "FallbackStrategy{" + name + ", priority=" + priority + '}';
            }
        };
    }

    /**
     * 전략 실행 본문.
     */
    @FunctionalInterface
    interface Body {

        Object execute(FallbackContext context) throws Exception;
    }
}
