/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>외부 API 호출 시 장애를 격리하기 위한 Circuit Breaker와 Connection Pool 확장점을 정의합니다.
 * 두 보호 장치 모두 {@link com.ryuqq.resilience.core.model.EndpointKey} 단위로 상태를 분리합니다.</p>
 *
 * <h2>호출 체인 순서</h2>
 *
 * <p>RequestExecutor는 attempt마다 다음 순서로 보호 장치를 적용합니다:</p>
 * <pre>
 * 1. ConnectionPool  → 엔드포인트 슬롯 확보 (FIFO 대기)
 * 2. CircuitBreaker  → OPEN 상태 시 즉시 실패
 * 3. Transport       → 실제 호출
 * 4. release         → 슬롯 반납 (대기자에게 인계)
 * </pre>
 *
 * <p>backoff sleep은 슬롯을 반납한 뒤에 수행되므로, 재시도 대기 중인 호출이
 * 다른 호출자의 슬롯을 점유하지 않습니다.</p>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker}는
 * 모든 요청을 허용하며, {@code ExecuteOptions.skipCircuitBreaker}가 설정된 호출에 사용됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.ConnectionPool
 */
package com.ryuqq.resilience.core.protection;
