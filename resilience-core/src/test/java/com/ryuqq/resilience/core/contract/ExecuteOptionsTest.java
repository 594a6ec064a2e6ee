package com.ryuqq.resilience.core.contract;

import com.ryuqq.resilience.core.cancel.CancellationToken;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.model.EndpointKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 호출 계약 타입 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("RequestDescriptor, ExecuteOptions 테스트")
class ExecuteOptionsTest {

    @Test
    @DisplayName("pathTemplate이 있으면 엔드포인트 키는 템플릿 기준이다")
    void 템플릿_기준_엔드포인트() {
        // given
        RequestDescriptor descriptor = RequestDescriptor.get("/workflows/42?active=true")
            .withPathTemplate("/workflows/{id}");

        // when & then
        assertThat(descriptor.endpointKey()).isEqualTo(EndpointKey.of("GET", "/workflows/{id}"));
        assertThat(RequestDescriptor.get("/workflows/42?active=true").endpointKey().getPath())
            .isEqualTo("/workflows/42");
    }

    @Test
    @DisplayName("RequestDescriptor는 method를 대문자로, 빈 값은 GET으로 정규화한다")
    void descriptor_method_정규화() {
        assertThat(RequestDescriptor.of("patch", "/x").method()).isEqualTo("PATCH");
        assertThat(RequestDescriptor.of(null, "/x").method()).isEqualTo("GET");
        assertThat(RequestDescriptor.get("/x").hasTimeout()).isFalse();
        assertThatThrownBy(() -> RequestDescriptor.get(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("skipRetry면 실제 재시도 설정은 maxRetries=0이다")
    void skipRetry_적용() {
        // given
        RetryConfig base = new RetryConfig();

        // when
        RetryConfig effective = ExecuteOptions.defaults().withSkipRetry(true).effectiveRetryConfig(base);

        // then
        assertThat(effective.maxRetries()).isZero();
        assertThat(effective.baseDelayMs()).isEqualTo(base.baseDelayMs());
    }

    @Test
    @DisplayName("호출 단위 재시도 설정이 기본 설정보다 우선한다")
    void 재시도_설정_재정의() {
        // given
        RetryConfig override = new RetryConfig().withMaxRetries(7);

        // when
        RetryConfig effective = ExecuteOptions.defaults().withRetryConfig(override)
            .effectiveRetryConfig(new RetryConfig());

        // then
        assertThat(effective.maxRetries()).isEqualTo(7);
    }

    @Test
    @DisplayName("취소 토큰이 null이면 none()으로 대체된다")
    void null_취소_토큰() {
        assertThat(ExecuteOptions.defaults().cancellationToken()).isSameAs(CancellationToken.none());
        assertThat(ExecuteOptions.defaults().withCancellationToken(null).cancellationToken())
            .isSameAs(CancellationToken.none());
    }
}
