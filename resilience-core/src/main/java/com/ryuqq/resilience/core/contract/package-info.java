/**
 * 호출 계약 패키지.
 *
 * <p>{@link com.ryuqq.resilience.core.contract.RequestDescriptor}는 Transport로 전달되는 요청 명세이고,
 * {@link com.ryuqq.resilience.core.contract.ExecuteOptions}와
 * {@link com.ryuqq.resilience.core.contract.RecoveryOptions}는 호출 단위로 기본 설정을 재정의합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.contract;
