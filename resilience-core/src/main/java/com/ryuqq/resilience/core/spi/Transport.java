package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.HttpStatusException;
import com.ryuqq.resilience.core.exception.TransportException;
import com.ryuqq.resilience.core.model.TransportResponse;

/**
 * Transport SPI.
 *
 * <p>외부 API에 실제 요청을 보내는 계층입니다. Resilience 계층은 이 인터페이스만 알고 있으며,
 * 구현체는 HTTP 클라이언트, 테스트용 스크립트 등 무엇이든 될 수 있습니다.</p>
 *
 * <p><strong>오류 계약:</strong></p>
 * <ul>
 *   <li>응답을 받지 못한 경우: {@link TransportException} (NetworkFault 포함)</li>
 *   <li>non-2xx 응답: {@link HttpStatusException} 또는 해당 상태 코드의 {@link TransportResponse} 반환
 *       (RequestExecutor가 non-2xx 응답을 HttpStatusException으로 변환)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Transport {

    /**
     * 요청 실행.
     *
     * @param descriptor 요청 명세 (timeoutMs는 항상 양수로 채워져 전달됨)
     * @return 응답
     * @throws TransportException 네트워크 장애
     * @throws HttpStatusException non-2xx 응답
     */
    TransportResponse call(RequestDescriptor descriptor);
}
