package com.ryuqq.resilience.core.exception;

/**
 * 네트워크 수준 장애 유형.
 *
 * <p>응답 자체를 받지 못한 경우를 나타내며, 모든 유형이 재시도 대상입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum NetworkFault {

    /** 연결 리셋 (ECONNRESET) */
    CONNECTION_RESET,

    /** 연결 거부 */
    CONNECTION_REFUSED,

    /** 연결 또는 응답 타임아웃 (ETIMEDOUT) */
    TIMEOUT,

    /** 호스트 이름 해석 실패 (ENOTFOUND) */
    DNS_FAILURE,

    /** Connection Pool 슬롯 획득 타임아웃 */
    POOL_TIMEOUT,

    /** 기타 I/O 오류 */
    IO_ERROR
}
