/**
 * SPI (Service Provider Interface) 패키지.
 *
 * <p>Resilience 계층의 외부 확장점을 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.spi.Transport} - 실제 요청 전송</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.MetricsRecorder} - 호출 메트릭 기록</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.OfflineCache} - TTL 캐시</li>
 * </ul>
 *
 * <p>In-memory 구현은 {@code resilience-adapter-inmemory} 모듈,
 * HTTP Transport 구현은 {@code resilience-adapter-http} 모듈에 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.spi;
