/**
 * 예외 분류 패키지.
 *
 * <pre>
 * ResilienceException
 *   ├─ TransportException (네트워크 장애, 항상 재시도)
 *   │    └─ PoolTimeoutException (슬롯 획득 타임아웃)
 *   ├─ HttpStatusException (non-2xx, retryableStatusCodes에 포함될 때만 재시도)
 *   ├─ CircuitOpenException (즉시 거부, 재시도 안 함)
 *   ├─ OperationCancelledException (호출자 취소)
 *   └─ RecoveryExhaustedException (모든 fallback 실패)
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.exception;
