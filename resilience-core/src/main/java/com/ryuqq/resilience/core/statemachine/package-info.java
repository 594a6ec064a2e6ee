/**
 * Circuit Breaker 상태 머신 패키지.
 *
 * <p>{@link com.ryuqq.resilience.core.statemachine.CircuitBreakerTransition}은 구현체가 상태를 바꿀 때
 * 허용된 전이만 일어나도록 검증합니다.</p>
 *
 * <pre>
 * CLOSED ──(failures &gt;= threshold)──&gt; OPEN
 *    ^                                  │
 *    │                          (resetTimeout 경과)
 * (success)                             │
 *    └──────── HALF_OPEN &lt;──────────────┘
 *                 │
 *             (failure) ──&gt; OPEN
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.statemachine;
