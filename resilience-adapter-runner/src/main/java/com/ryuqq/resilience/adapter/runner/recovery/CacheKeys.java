package com.ryuqq.resilience.adapter.runner.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 오프라인 캐시 키 생성기.
 *
 * <p><strong>형식:</strong> {@code operation + ":" + serialize(args)}</p>
 * <ul>
 *   <li>문자열, 숫자, boolean 인자: {@code String.valueOf}</li>
 *   <li>null 인자: {@code "null"}</li>
 *   <li>그 외: Jackson JSON (Map 키, 프로퍼티 모두 정렬하여 같은 인자는 항상 같은 키)</li>
 *   <li>직렬화 실패: {@code String.valueOf}로 대체</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CacheKeys {

    private static final Logger log = LoggerFactory.getLogger(CacheKeys.class);

    private final ObjectMapper objectMapper;

    public CacheKeys() {
        this(JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build());
    }

    public CacheKeys(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 캐시 키 생성.
     *
     * @param operation 논리 operation 이름
     * @param args 인자 (null 가능)
     * @return 캐시 키
     */
    public String of(String operation, Object args) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        return operation + ":" + serialize(args);
    }

    private String serialize(Object args) {
        if (args == null || args instanceof CharSequence || args instanceof Number || args instanceof Boolean) {
            return String.valueOf(args);
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.debug("Cache key arguments not serializable, using toString(): type={}, error={}",
                args.getClass().getName(), e.getOriginalMessage());
            return String.valueOf(args);
        }
    }
}
