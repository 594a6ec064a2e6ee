package com.ryuqq.resilience.adapter.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.resilience.core.contract.RequestDescriptor;
import com.ryuqq.resilience.core.exception.NetworkFault;
import com.ryuqq.resilience.core.exception.TransportException;
import com.ryuqq.resilience.core.model.TransportResponse;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JdkHttpTransport 테스트.
 *
 * <p>로컬 {@link HttpServer}를 띄워 실제 HTTP 왕복을 검증합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("JdkHttpTransport 테스트")
class JdkHttpTransportTest {

    private HttpServer server;
    private JdkHttpTransport transport;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastMethod = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/workflows", exchange ->
            respond(exchange, 200, "application/json", "[{\"id\":\"wf-1\",\"active\":true}]"));
        server.createContext("/text", exchange -> respond(exchange, 200, "text/plain", "pong"));
        server.createContext("/broken", exchange -> respond(exchange, 503, "application/json", "{\"message\":\"unavailable\"}"));
        server.createContext("/empty", exchange -> respond(exchange, 204, null, ""));
        server.createContext("/echo", exchange -> {
            lastMethod.set(exchange.getRequestMethod());
            lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 201, "application/json", "{\"created\":true}");
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "text/plain", "late");
        });
        server.start();
        transport = new JdkHttpTransport("http://127.0.0.1:" + server.getAddress().getPort(),
            Duration.ofSeconds(2), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        if (contentType != null) {
            exchange.getResponseHeaders().add("Content-Type", contentType);
        }
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Nested
    @DisplayName("응답 변환")
    class Responses {

        @Test
        @DisplayName("JSON 응답은 List/Map으로 파싱된다")
        void JSON_파싱() {
            TransportResponse response = transport.call(RequestDescriptor.get("/workflows"));

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.data()).isEqualTo(List.of(Map.of("id", "wf-1", "active", true)));
            assertThat(response.headers()).containsEntry("content-type", "application/json");
        }

        @Test
        @DisplayName("JSON이 아닌 응답은 문자열 그대로 담긴다")
        void 텍스트_응답() {
            assertThat(transport.call(RequestDescriptor.get("text")).data()).isEqualTo("pong");
        }

        @Test
        @DisplayName("non-2xx 응답도 예외 없이 상태 코드와 본문을 반환한다")
        void non_2xx() {
            TransportResponse response = transport.call(RequestDescriptor.get("/broken"));

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.isSuccessful()).isFalse();
            assertThat(response.data()).isEqualTo(Map.of("message", "unavailable"));
        }

        @Test
        @DisplayName("본문이 없으면 data는 null이다")
        void 빈_본문() {
            TransportResponse response = transport.call(RequestDescriptor.get("/empty"));

            assertThat(response.statusCode()).isEqualTo(204);
            assertThat(response.data()).isNull();
        }
    }

    @Nested
    @DisplayName("요청 변환")
    class Requests {

        @Test
        @DisplayName("객체 body는 JSON으로 직렬화되고 Content-Type이 붙는다")
        void JSON_직렬화() {
            TransportResponse response = transport.call(
                RequestDescriptor.post("/echo", Map.of("name", "nightly-sync")));

            assertThat(response.statusCode()).isEqualTo(201);
            assertThat(lastMethod.get()).isEqualTo("POST");
            assertThat(lastContentType.get()).isEqualTo("application/json");
            assertThat(lastBody.get()).isEqualTo("{\"name\":\"nightly-sync\"}");
        }

        @Test
        @DisplayName("문자열 body는 그대로 전송된다")
        void 문자열_body() {
            transport.call(RequestDescriptor.of("PUT", "/echo").withBody("raw-payload"));

            assertThat(lastMethod.get()).isEqualTo("PUT");
            assertThat(lastBody.get()).isEqualTo("raw-payload");
        }

        @Test
        @DisplayName("절대 URL은 baseUrl을 무시한다")
        void 절대_URL() {
            assertThat(transport.resolve("https://api.example.com/v1/workflows").toString())
                .isEqualTo("https://api.example.com/v1/workflows");
            assertThat(transport.resolve("workflows?active=true").toString())
                .isEqualTo(transport.getBaseUrl() + "/workflows?active=true");
        }
    }

    @Nested
    @DisplayName("네트워크 장애")
    class Faults {

        @Test
        @DisplayName("요청 타임아웃은 TIMEOUT으로 매핑된다")
        void 타임아웃() {
            assertThatThrownBy(() -> transport.call(RequestDescriptor.get("/slow").withTimeoutMs(100)))
                .isInstanceOf(TransportException.class)
                .satisfies(e -> assertThat(((TransportException) e).getFault()).isEqualTo(NetworkFault.TIMEOUT));
        }

        @Test
        @DisplayName("닫힌 포트로의 연결은 CONNECTION_REFUSED로 매핑된다")
        void 연결_거부() throws IOException {
            // given
            int port;
            try (ServerSocket socket = new ServerSocket(0, 0, InetAddress.getLoopbackAddress())) {
                port = socket.getLocalPort();
            }
            JdkHttpTransport closed = new JdkHttpTransport("http://127.0.0.1:" + port);

            // when & then
            assertThatThrownBy(() -> closed.call(RequestDescriptor.get("/workflows")))
                .isInstanceOf(TransportException.class)
                .satisfies(e -> assertThat(((TransportException) e).getFault())
                    .isEqualTo(NetworkFault.CONNECTION_REFUSED));
        }

        @Test
        @DisplayName("IOException 종류별로 NetworkFault가 결정된다")
        void 분류() {
            assertThat(JdkHttpTransport.classify(new HttpTimeoutException("request timed out")))
                .isEqualTo(NetworkFault.TIMEOUT);
            assertThat(JdkHttpTransport.classify(new HttpConnectTimeoutException("connect timed out")))
                .isEqualTo(NetworkFault.TIMEOUT);
            assertThat(JdkHttpTransport.classify(new ConnectException("Connection refused")))
                .isEqualTo(NetworkFault.CONNECTION_REFUSED);
            assertThat(JdkHttpTransport.classify(new IOException("wrapped", new UnknownHostException("api.invalid"))))
                .isEqualTo(NetworkFault.DNS_FAILURE);
            assertThat(JdkHttpTransport.classify(new SocketException("Connection reset")))
                .isEqualTo(NetworkFault.CONNECTION_RESET);
            assertThat(JdkHttpTransport.classify(new IOException("stream closed")))
                .isEqualTo(NetworkFault.IO_ERROR);
        }
    }
}
