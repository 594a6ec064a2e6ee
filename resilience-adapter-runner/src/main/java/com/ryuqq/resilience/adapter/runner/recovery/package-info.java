/**
 * 오프라인 캐시와 fallback 전략 체인.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner.recovery;
