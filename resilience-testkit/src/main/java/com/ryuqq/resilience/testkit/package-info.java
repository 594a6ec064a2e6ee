/**
 * Resilience 테스트 지원 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.testkit.MutableClock} - 수동으로 진행시키는 시계</li>
 *   <li>{@link com.ryuqq.resilience.testkit.ScriptedTransport} - 순서가 정해진 응답/장애를 내는 Transport</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit;
