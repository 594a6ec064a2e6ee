/**
 * 취소 신호 패키지.
 *
 * <p>{@link com.ryuqq.resilience.core.cancel.CancellationToken}은 Pool 슬롯 대기와
 * backoff sleep 두 대기 지점을 호출자가 즉시 중단할 수 있게 합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.cancel;
