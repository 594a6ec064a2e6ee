package com.ryuqq.resilience.adapter.runner.recovery;

import java.util.concurrent.Callable;

/**
 * 캐시 예열 작업.
 *
 * @param operation 논리 operation 이름
 * @param args 캐시 키 산출용 인자 (null 가능)
 * @param loader 데이터를 가져오는 작업
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record PreloadTask(String operation, Object args, Callable<?> loader) {

    public PreloadTask {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
    }

    public static PreloadTask of(String operation, Callable<?> loader) {
        return new PreloadTask(operation, null, loader);
    }
}
