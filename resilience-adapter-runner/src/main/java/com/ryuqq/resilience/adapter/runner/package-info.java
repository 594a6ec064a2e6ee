/**
 * Resilient Client 실행 어댑터.
 *
 * <p>{@link com.ryuqq.resilience.adapter.runner.DefaultResilientClient}가 진입점이며,
 * attempt 단위 실행은 {@link com.ryuqq.resilience.adapter.runner.RequestExecutor}가 담당합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner;
