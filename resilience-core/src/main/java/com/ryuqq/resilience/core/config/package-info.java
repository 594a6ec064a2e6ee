/**
 * 설정 record 패키지.
 *
 * <p>모든 설정은 불변 record이며, 기본값 생성자와 {@code withXxx()} 복사 메서드를 제공합니다.
 * 생성 시점(생성자 주입)과 호출 시점({@code ExecuteOptions}) 모두에서 재정의할 수 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.config;
