/**
 * Resilient Client API 패키지.
 *
 * <p>호출자가 사용하는 진입점 인터페이스 {@link com.ryuqq.resilience.application.client.ResilientClient}와
 * 복구 결과 타입을 정의합니다. 기본 구현은 {@code resilience-adapter-runner} 모듈의
 * {@code DefaultResilientClient}입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.client;
