package com.ryuqq.resilience.core.exception;

/**
 * primary 실행과 모든 fallback 전략이 실패한 경우.
 *
 * <p>마지막 오류 메시지와 시도한 전략 수를 담고 있으며,
 * 마지막 오류 자체는 {@link #getCause()}로 조회할 수 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RecoveryExhaustedException extends ResilienceException {

    private final String operation;
    private final String lastErrorMessage;
    private final int strategiesAttempted;

    public RecoveryExhaustedException(String operation, String lastErrorMessage,
                                      int strategiesAttempted, Throwable lastError) {
        super("RECOVERY-EXHAUSTED",
            "All recovery strategies failed for operation: " + operation + ". Last error: " + lastErrorMessage,
            lastError);
        this.operation = operation;
        this.lastErrorMessage = lastErrorMessage;
        this.strategiesAttempted = strategiesAttempted;
    }

    public String getOperation() {
        return operation;
    }

    public String getLastErrorMessage() {
        return lastErrorMessage;
    }

    /**
     * 실행을 시도한 fallback 전략 수 (비활성 전략 제외).
     *
     * @return 시도한 전략 수
     */
    public int getStrategiesAttempted() {
        return strategiesAttempted;
    }
}
