package com.ryuqq.resilience.application.client;

import com.ryuqq.resilience.application.stats.ConnectivityReport;
import com.ryuqq.resilience.application.stats.HealthStats;
import com.ryuqq.resilience.application.stats.RecoveryStats;
import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.contract.ExecuteOptions;
import com.ryuqq.resilience.core.contract.RecoveryOptions;
import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.HttpStatusException;
import com.ryuqq.resilience.core.exception.OperationCancelledException;
import com.ryuqq.resilience.core.exception.RecoveryExhaustedException;
import com.ryuqq.resilience.core.exception.TransportException;
import com.ryuqq.resilience.core.model.CallMetric;
import com.ryuqq.resilience.core.model.TransportResponse;
import com.ryuqq.resilience.core.recovery.FallbackStrategy;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * 불안정한 외부 API를 위한 Resilient Client.
 *
 * <p>모든 호출은 엔드포인트별 Connection Pool 슬롯, Circuit Breaker, 재시도를 거쳐 Transport로 전달됩니다.
 * {@code executeWithFallback}은 여기에 오프라인 캐시와 fallback 전략 체인을 더합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResilientClient client = DefaultResilientClient.inMemory(transport);
 *
 * // 재시도 + Circuit Breaker
 * TransportResponse response = client.execute(RequestDescriptor.get("/workflows"));
 *
 * // fallback 체인
 * client.addFallbackStrategy("listWorkflows", FallbackStrategy.of("empty", 10, ctx -> List.of()));
 * RecoveryResult&lt;TransportResponse&gt; result = client.executeWithFallback(
 *     "listWorkflows", RequestDescriptor.get("/workflows"), RecoveryOptions.cached(60_000));
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ResilientClient {

    /**
     * 기본 옵션으로 요청 실행.
     *
     * @param descriptor 요청 명세
     * @return 2xx 응답
     * @see #execute(RequestDescriptor, ExecuteOptions)
     */
    default TransportResponse execute(RequestDescriptor descriptor) {
        return execute(descriptor, ExecuteOptions.defaults());
    }

    /**
     * 요청 실행.
     *
     * <p><strong>동작 방식 (attempt마다):</strong></p>
     * <ol>
     *   <li>엔드포인트 슬롯 획득 (필요 시 FIFO 대기)</li>
     *   <li>Circuit Breaker 통과 확인</li>
     *   <li>Transport 호출, non-2xx 응답은 HttpStatusException으로 변환</li>
     *   <li>슬롯 반납</li>
     *   <li>재시도 대상 오류면 backoff 후 다음 attempt</li>
     * </ol>
     *
     * @param descriptor 요청 명세
     * @param options 호출 옵션
     * @return 2xx 응답
     * @throws CircuitOpenException Breaker가 호출을 거부한 경우
     * @throws HttpStatusException 재시도 대상이 아니거나 재시도를 모두 소진한 non-2xx 응답
     * @throws TransportException 재시도를 모두 소진한 네트워크 장애
     * @throws OperationCancelledException 호출자가 취소한 경우
     */
    TransportResponse execute(RequestDescriptor descriptor, ExecuteOptions options);

    /**
     * 요청을 primary로 하는 복구 체인 실행.
     *
     * <p>캐시 키와 fallback 인자로는 {@link RequestDescriptor#cacheIdentity()}(method, url, body)가
     * 사용되며 헤더는 포함되지 않습니다.</p>
     *
     * @param operationName 논리 operation 이름 (fallback 전략 등록 단위)
     * @param descriptor 요청 명세
     * @param options 복구 옵션
     * @return 복구 결과
     * @throws RecoveryExhaustedException primary와 모든 fallback이 실패한 경우
     */
    RecoveryResult<TransportResponse> executeWithFallback(String operationName,
                                                          RequestDescriptor descriptor,
                                                          RecoveryOptions options);

    /**
     * 임의 작업을 primary로 하는 복구 체인 실행.
     *
     * @param operationName 논리 operation 이름
     * @param primary primary 작업
     * @param args 캐시 키 산출용 인자 (null 가능)
     * @param options 복구 옵션
     * @param <T> 결과 타입
     * @return 복구 결과
     * @throws RecoveryExhaustedException primary와 모든 fallback이 실패한 경우
     */
    <T> RecoveryResult<T> executeWithFallback(String operationName, Callable<T> primary,
                                              Object args, RecoveryOptions options);

    /**
     * operation에 fallback 전략 추가 (priority 오름차순 정렬 유지).
     *
     * @param operationName 논리 operation 이름
     * @param strategy 전략
     */
    void addFallbackStrategy(String operationName, FallbackStrategy strategy);

    /**
     * fallback 전략 활성/비활성.
     *
     * @param operationName 논리 operation 이름
     * @param strategyName 전략 이름
     * @param enabled 활성 여부
     * @return 전략을 찾았으면 true
     */
    boolean toggleFallbackStrategy(String operationName, String strategyName, boolean enabled);

    /**
     * 최근 100건 기준 상태 통계.
     *
     * @return HealthStats
     */
    HealthStats getHealthStats();

    /**
     * 복구 체인 통계.
     *
     * @return RecoveryStats
     */
    RecoveryStats getRecoveryStats();

    /**
     * 최근 호출 메트릭.
     *
     * @param limit 최대 개수
     * @return 오래된 것부터 정렬된 메트릭
     */
    List<CallMetric> getRecentMetrics(int limit);

    /**
     * probe 요청으로 연결 상태 확인.
     *
     * <p>probe 실패는 예외 대신 {@code connected=false}로 보고됩니다.</p>
     *
     * @param probe 확인용 요청
     * @return ConnectivityReport
     */
    ConnectivityReport checkConnectivity(RequestDescriptor probe);

    /**
     * 모든 Circuit Breaker를 CLOSED로 리셋.
     */
    void resetCircuitBreakers();

    /**
     * Breaker, Pool 카운터, 호출 메트릭, 복구 상태 전체 초기화.
     */
    void reset();

    /**
     * 기본 재시도 설정 변경 (이후 호출부터 적용).
     *
     * @param retryConfig 재시도 설정
     */
    void setRetryConfig(RetryConfig retryConfig);

    /**
     * Circuit Breaker 설정 변경 (이후 생성되는 Breaker부터 적용).
     *
     * @param circuitBreakerConfig Breaker 설정
     */
    void setCircuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig);
}
