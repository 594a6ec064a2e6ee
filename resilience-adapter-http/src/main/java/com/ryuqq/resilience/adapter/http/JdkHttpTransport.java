package com.ryuqq.resilience.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.resilience.core.config.ConnectionPoolConfig;
import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.NetworkFault;
import com.ryuqq.resilience.core.exception.OperationCancelledException;
import com.ryuqq.resilience.core.exception.TransportException;
import com.ryuqq.resilience.core.model.TransportResponse;
import com.ryuqq.resilience.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code java.net.http.HttpClient} 기반 Transport.
 *
 * <p><strong>요청 변환:</strong></p>
 * <ul>
 *   <li>절대 URL은 그대로, 상대 경로는 baseUrl 뒤에 붙입니다.</li>
 *   <li>body: String은 그대로, byte[]는 바이트로, 그 외 객체는 Jackson JSON으로 전송합니다.</li>
 *   <li>descriptor의 timeoutMs를 요청 타임아웃으로 사용합니다.</li>
 * </ul>
 *
 * <p><strong>응답 변환:</strong> 상태 코드와 관계없이 {@link TransportResponse}를 반환합니다.
 * Content-Type이 JSON이면 Map/List로 파싱하고, 그 외에는 문자열 그대로 담습니다.</p>
 *
 * <p><strong>네트워크 장애 매핑:</strong></p>
 * <ul>
 *   <li>{@link HttpTimeoutException} → {@link NetworkFault#TIMEOUT}</li>
 *   <li>{@link ConnectException} → {@link NetworkFault#CONNECTION_REFUSED}</li>
 *   <li>{@link UnknownHostException} → {@link NetworkFault#DNS_FAILURE}</li>
 *   <li>"reset" 메시지의 IOException → {@link NetworkFault#CONNECTION_RESET}</li>
 *   <li>그 외 IOException → {@link NetworkFault#IO_ERROR}</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class JdkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * 기본 연결 타임아웃({@link ConnectionPoolConfig#connectionTimeoutMs()})으로 생성.
     *
     * @param baseUrl 상대 경로의 기준 URL
     */
    public JdkHttpTransport(String baseUrl) {
        this(baseUrl, Duration.ofMillis(new ConnectionPoolConfig().connectionTimeoutMs()), new ObjectMapper());
    }

    public JdkHttpTransport(String baseUrl, Duration connectTimeout, ObjectMapper objectMapper) {
        this(baseUrl,
            HttpClient.newBuilder()
                .connectTimeout(requireConnectTimeout(connectTimeout))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            objectMapper);
    }

    public JdkHttpTransport(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    private static Duration requireConnectTimeout(Duration connectTimeout) {
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be positive (current: " + connectTimeout + ")");
        }
        return connectTimeout;
    }

    @Override
    public TransportResponse call(RequestDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        HttpRequest request = toRequest(descriptor);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("HTTP {} {} -> {}", descriptor.method(), request.uri(), response.statusCode());
            return toTransportResponse(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("HTTP call interrupted: " + descriptor.method() + " " + request.uri(), e);
        } catch (IOException e) {
            NetworkFault fault = classify(e);
            log.debug("HTTP {} {} failed: fault={}, error={}", descriptor.method(), request.uri(), fault, e.toString());
            throw new TransportException(fault,
                fault + " on " + descriptor.method() + " " + request.uri() + ": " + messageOf(e), e);
        }
    }

    HttpRequest toRequest(RequestDescriptor descriptor) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(descriptor.url()))
            .header("Accept", APPLICATION_JSON);

        boolean hasContentType = false;
        for (Map.Entry<String, String> header : descriptor.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
            hasContentType |= CONTENT_TYPE.equalsIgnoreCase(header.getKey());
        }

        Object body = descriptor.body();
        HttpRequest.BodyPublisher publisher;
        if (body == null) {
            publisher = HttpRequest.BodyPublishers.noBody();
        } else if (body instanceof byte[]) {
            publisher = HttpRequest.BodyPublishers.ofByteArray((byte[]) body);
        } else if (body instanceof CharSequence) {
            publisher = HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8);
        } else {
            publisher = HttpRequest.BodyPublishers.ofString(toJson(body), StandardCharsets.UTF_8);
            if (!hasContentType) {
                builder.header(CONTENT_TYPE, APPLICATION_JSON);
            }
        }
        builder.method(descriptor.method(), publisher);

        if (descriptor.hasTimeout()) {
            builder.timeout(Duration.ofMillis(descriptor.timeoutMs()));
        }
        return builder.build();
    }

    URI resolve(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return URI.create(url);
        }
        return URI.create(baseUrl + (url.startsWith("/") ? url : "/" + url));
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Request body is not JSON serializable: " + body.getClass().getName(), e);
        }
    }

    private TransportResponse toTransportResponse(HttpResponse<String> response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> header : response.headers().map().entrySet()) {
            if (!header.getValue().isEmpty()) {
                headers.put(header.getKey().toLowerCase(Locale.ROOT), header.getValue().get(0));
            }
        }
        String contentType = headers.getOrDefault("content-type", "");
        return new TransportResponse(response.statusCode(), parseBody(response.body(), contentType), headers);
    }

    private Object parseBody(String body, String contentType) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        if (!contentType.toLowerCase(Locale.ROOT).contains("json")) {
            return body;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Response declared JSON but failed to parse, returning raw body: {}", e.getOriginalMessage());
            return body;
        }
    }

    /**
     * IOException을 NetworkFault로 분류 (cause 체인 포함).
     *
     * @param error I/O 오류
     * @return NetworkFault
     */
    static NetworkFault classify(IOException error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof HttpTimeoutException) {
                return NetworkFault.TIMEOUT;
            }
            if (current instanceof ConnectException) {
                return NetworkFault.CONNECTION_REFUSED;
            }
            if (current instanceof UnknownHostException) {
                return NetworkFault.DNS_FAILURE;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("reset")) {
                return NetworkFault.CONNECTION_RESET;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return NetworkFault.IO_ERROR;
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
