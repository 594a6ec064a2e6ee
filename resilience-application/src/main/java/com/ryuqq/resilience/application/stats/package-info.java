/**
 * 통계 및 상태 보고 타입.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.stats;
