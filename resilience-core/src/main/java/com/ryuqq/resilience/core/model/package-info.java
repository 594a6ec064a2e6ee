/**
 * 값 객체 패키지.
 *
 * <p>엔드포인트 파티션 키({@link com.ryuqq.resilience.core.model.EndpointKey}),
 * Transport 응답, 호출/복구 메트릭, 상태 스냅샷 등 불변 값 객체를 정의합니다.</p>
 *
 * <p>모든 값 객체는 생성 시점에 유효성을 검증하며, 생성 후 변경되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
