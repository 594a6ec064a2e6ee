package com.ryuqq.resilience.adapter.runner.recovery;

import com.ryuqq.resilience.adapter.inmemory.metrics.BoundedLog;
import com.ryuqq.resilience.application.client.RecoveryResult;
import com.ryuqq.resilience.application.stats.RecoveryStats;
import com.ryuqq.resilience.core.contract.RecoveryOptions;
import com.ryuqq.resilience.core.exception.OperationCancelledException;
import com.ryuqq.resilience.core.exception.RecoveryExhaustedException;
import com.ryuqq.resilience.core.model.RecoveryMetric;
import com.ryuqq.resilience.core.recovery.FallbackContext;
import com.ryuqq.resilience.core.recovery.FallbackStrategy;
import com.ryuqq.resilience.core.spi.OfflineCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fallback 복구 관리자.
 *
 * <p><strong>executeWithFallback 처리 흐름:</strong></p>
 * <ol>
 *   <li>skipCache가 아니면 오프라인 캐시 조회, 적중 시 primary 호출 없이 반환</li>
 *   <li>primary 실행, 성공 시 (cacheResult면 캐싱 후) 반환</li>
 *   <li>실패 시 활성화된 전략을 priority 오름차순으로 실행, 첫 성공 결과 반환</li>
 *   <li>모두 실패하면 {@link RecoveryExhaustedException}</li>
 * </ol>
 *
 * <p>primary가 {@link OperationCancelledException}으로 끝나면 fallback을 시도하지 않고 그대로 전파합니다.</p>
 *
 * <p><strong>전략 목록:</strong> operation별로 priority 오름차순, 같은 priority는 등록 순서를 유지합니다.
 * 목록은 복사 후 교체(copy-on-write)되므로 실행 중인 체인은 등록/변경의 영향을 받지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    /**
     * 캐시 예열 항목의 TTL (15분).
     */
    public static final long PRELOAD_TTL_MS = 15 * 60 * 1000L;

    /**
     * 복구 메트릭 보관 한도.
     */
    public static final int METRICS_CAPACITY = 1000;

    private final OfflineCache cache;
    private final CacheKeys cacheKeys;
    private final Clock clock;
    private final BoundedLog<RecoveryMetric> metrics = new BoundedLog<>(METRICS_CAPACITY);
    private final ConcurrentHashMap<String, List<RegisteredStrategy>> strategies = new ConcurrentHashMap<>();

    public RecoveryManager(OfflineCache cache, Clock clock) {
        this(cache, new CacheKeys(), clock);
    }

    public RecoveryManager(OfflineCache cache, CacheKeys cacheKeys, Clock clock) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (cacheKeys == null) {
            throw new IllegalArgumentException("cacheKeys cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.cache = cache;
        this.cacheKeys = cacheKeys;
        this.clock = clock;
    }

    /**
     * 복구 체인 실행.
     *
     * @param operationName 논리 operation 이름
     * @param primary primary 작업
     * @param args 캐시 키 산출용 인자 (null 가능)
     * @param options 복구 옵션 (null이면 기본값)
     * @param <T> 결과 타입
     * @return 복구 결과
     * @throws RecoveryExhaustedException primary와 모든 전략이 실패한 경우
     * @throws OperationCancelledException primary가 취소된 경우
     */
    public <T> RecoveryResult<T> executeWithFallback(String operationName, Callable<T> primary,
                                                     Object args, RecoveryOptions options) {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        RecoveryOptions effective = options == null ? RecoveryOptions.defaults() : options;
        String cacheKey = cacheKeys.of(operationName, args);
        long startTime = clock.millis();

        if (!effective.skipCache()) {
            Optional<Object> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                log.debug("Cache hit: operation={}", operationName);
                return RecoveryResult.cached(RecoveryManager.<T>asResult(cached.get()));
            }
        }

        Throwable lastError;
        try {
            T value = primary.call();
            store(cacheKey, value, effective);
            RecoveryMetric metric = RecoveryMetric.primary(operationName, elapsedSince(startTime), clock.instant());
            metrics.append(metric);
            return RecoveryResult.primary(value, metric);
        } catch (OperationCancelledException e) {
            metrics.append(RecoveryMetric.failed(operationName, messageOf(e), elapsedSince(startTime), clock.instant()));
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            lastError = e;
            log.warn("Primary operation failed: operation={}, error={}", operationName, messageOf(e));
        }

        int attempted = 0;
        for (RegisteredStrategy registered : strategies.getOrDefault(operationName, List.of())) {
            if (!registered.enabled) {
                continue;
            }
            attempted++;
            FallbackStrategy strategy = registered.strategy;
            FallbackContext context = new FallbackContext(
                operationName, args, lastError, attempted, effective.maxAttempts(), startTime, cacheKey);
            try {
                log.debug("Attempting fallback strategy: operation={}, strategy={}", operationName, strategy.name());
                T value = asResult(strategy.execute(context));
                store(cacheKey, value, effective);
                RecoveryMetric metric = RecoveryMetric.fallback(
                    operationName, strategy.name(), elapsedSince(startTime), clock.instant());
                metrics.append(metric);
                log.info("Fallback strategy succeeded: operation={}, strategy={}", operationName, strategy.name());
                return RecoveryResult.fallback(value, strategy.name(), metric);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                lastError = e;
                log.warn("Fallback strategy failed: operation={}, strategy={}, error={}",
                    operationName, strategy.name(), messageOf(e));
            }
        }

        String lastMessage = messageOf(lastError);
        metrics.append(RecoveryMetric.failed(operationName, lastMessage, elapsedSince(startTime), clock.instant()));
        log.error("All recovery strategies failed: operation={}, attempted={}, lastError={}",
            operationName, attempted, lastMessage);
        throw new RecoveryExhaustedException(operationName, lastMessage, attempted, lastError);
    }

    private void store(String cacheKey, Object value, RecoveryOptions options) {
        if (!options.cacheResult() || value == null) {
            return;
        }
        long ttlMs = options.cacheTtlMs() != null ? options.cacheTtlMs() : cache.getDefaultTtlMs();
        cache.put(cacheKey, value, ttlMs);
    }

    /**
     * 캐시 값과 fallback 결과를 operation의 결과 타입으로 변환하는 유일한 지점.
     *
     * <p>캐시 항목은 같은 operation 이름의 primary 또는 전략 결과로만 채워지고, 전략은
     * operation 이름 단위로 등록되므로 값은 해당 operation의 결과 타입을 따릅니다.
     * 이를 어긴 전략의 결과는 호출자가 값을 사용할 때 {@link ClassCastException}으로 드러납니다.</p>
     *
     * @param value 캐시 값 또는 전략 결과
     * @param <T> operation 결과 타입
     * @return 같은 값
     */
    @SuppressWarnings("unchecked")
    private static <T> T asResult(Object value) {
        return (T) value;
    }

    private long elapsedSince(long startTime) {
        return Math.max(0L, clock.millis() - startTime);
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * 전략 추가.
     *
     * <p>priority 오름차순 위치에 삽입하며, 같은 priority 사이에서는 뒤에 붙습니다.
     * 새 전략은 활성 상태로 등록됩니다.</p>
     *
     * @param operationName 논리 operation 이름
     * @param strategy 전략
     * @throws IllegalArgumentException 같은 operation에 같은 이름의 전략이 이미 있는 경우
     */
    public void addFallbackStrategy(String operationName, FallbackStrategy strategy) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        strategies.compute(operationName, (key, current) -> {
            List<RegisteredStrategy> next = current == null ? new ArrayList<>() : new ArrayList<>(current);
            for (RegisteredStrategy registered : next) {
                if (registered.strategy.name().equals(strategy.name())) {
                    throw new IllegalArgumentException(
                        "Fallback strategy already registered: operation=" + key + ", strategy=" + strategy.name());
                }
            }
            int index = 0;
            while (index < next.size() && next.get(index).strategy.priority() <= strategy.priority()) {
                index++;
            }
            next.add(index, new RegisteredStrategy(strategy));
            return Collections.unmodifiableList(next);
        });
        log.debug("Fallback strategy added: operation={}, strategy={}, priority={}",
            operationName, strategy.name(), strategy.priority());
    }

    /**
     * 전략 활성/비활성.
     *
     * @param operationName 논리 operation 이름
     * @param strategyName 전략 이름
     * @param enabled 활성 여부
     * @return 전략을 찾았으면 true
     */
    public boolean toggleFallbackStrategy(String operationName, String strategyName, boolean enabled) {
        for (RegisteredStrategy registered : strategies.getOrDefault(operationName, List.of())) {
            if (registered.strategy.name().equals(strategyName)) {
                registered.enabled = enabled;
                log.info("Fallback strategy {}: operation={}, strategy={}",
                    enabled ? "enabled" : "disabled", operationName, strategyName);
                return true;
            }
        }
        return false;
    }

    /**
     * 등록된 전략 (실행 순서).
     *
     * @param operationName 논리 operation 이름
     * @return 전략 목록 (비활성 포함)
     */
    public List<FallbackStrategy> getFallbackStrategies(String operationName) {
        List<FallbackStrategy> result = new ArrayList<>();
        for (RegisteredStrategy registered : strategies.getOrDefault(operationName, List.of())) {
            result.add(registered.strategy);
        }
        return result;
    }

    public boolean isEnabled(String operationName, String strategyName) {
        for (RegisteredStrategy registered : strategies.getOrDefault(operationName, List.of())) {
            if (registered.strategy.name().equals(strategyName)) {
                return registered.enabled;
            }
        }
        return false;
    }

    /**
     * 캐시 예열.
     *
     * <p>각 작업 결과를 {@value #PRELOAD_TTL_MS}ms TTL로 저장합니다. 실패한 작업은 로그만 남기고 건너뜁니다.</p>
     *
     * @param tasks 예열 작업
     * @return 저장에 성공한 작업 수
     */
    public int preloadCache(List<PreloadTask> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        int loaded = 0;
        for (PreloadTask task : tasks) {
            try {
                Object value = task.loader().call();
                if (value == null) {
                    log.warn("Preload returned no data, skipping: operation={}", task.operation());
                    continue;
                }
                cache.put(cacheKeys.of(task.operation(), task.args()), value, PRELOAD_TTL_MS);
                loaded++;
                log.info("Preloaded cache: operation={}", task.operation());
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                log.warn("Failed to preload cache: operation={}, error={}", task.operation(), messageOf(e));
            }
        }
        return loaded;
    }

    /**
     * 복구 통계.
     *
     * @return RecoveryStats (operation 이름순)
     */
    public RecoveryStats getRecoveryStats() {
        List<RecoveryMetric> all = metrics.snapshot();
        int total = all.size();
        long successes = all.stream().filter(RecoveryMetric::success).count();
        long fallbacks = all.stream().filter(RecoveryMetric::usedFallback).count();
        double averageTime = all.stream().mapToLong(RecoveryMetric::recoveryTimeMs).average().orElse(0.0);

        Map<String, List<RecoveryMetric>> byOperation = new TreeMap<>();
        for (RecoveryMetric metric : all) {
            byOperation.computeIfAbsent(metric.operation(), key -> new ArrayList<>()).add(metric);
        }
        Map<String, RecoveryStats.OperationStats> operationStats = new LinkedHashMap<>();
        byOperation.forEach((operation, list) -> {
            long ok = list.stream().filter(RecoveryMetric::success).count();
            double avg = list.stream().mapToLong(RecoveryMetric::recoveryTimeMs).average().orElse(0.0);
            operationStats.put(operation, new RecoveryStats.OperationStats(list.size(), percent(ok, list.size()), avg));
        });

        return new RecoveryStats(
            total,
            percent(successes, total),
            percent(fallbacks, total),
            averageTime,
            operationStats,
            cache.stats()
        );
    }

    private static double percent(long part, int total) {
        return total == 0 ? 0.0 : (double) part / total * 100.0;
    }

    /**
     * 최근 복구 메트릭.
     *
     * @param limit 최대 개수
     * @return 오래된 것부터 정렬된 메트릭
     */
    public List<RecoveryMetric> getRecentRecoveryMetrics(int limit) {
        return metrics.recent(limit);
    }

    public OfflineCache getCache() {
        return cache;
    }

    /**
     * 캐시와 복구 메트릭 초기화 (등록된 전략은 유지).
     */
    public void reset() {
        cache.clear();
        metrics.clear();
        log.info("Recovery manager reset - cache and metrics cleared");
    }

    private static final class RegisteredStrategy {

        private final FallbackStrategy strategy;
        private volatile boolean enabled = true;

        private RegisteredStrategy(FallbackStrategy strategy) {
            this.strategy = strategy;
        }
    }
}
