package fr.lapetina.llm.orchestrator.infrastructure.provider;

import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ProviderError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(100), Duration.ofMillis(300), 2.0);

    @Test
    @DisplayName("should retry retryable kinds up to the limit")
    void shouldRetryRetryable() {
        ProviderError error = ProviderError.of(ErrorKind.RATE_LIMIT, "dashscope", "429");

        assertThat(policy.shouldRetry(error, 0)).isTrue();
        assertThat(policy.shouldRetry(error, 1)).isTrue();
        assertThat(policy.shouldRetry(error, 2)).isFalse();
    }

    @Test
    @DisplayName("should never retry content filter or quota errors")
    void shouldNotRetryTerminalKinds() {
        assertThat(policy.shouldRetry(ProviderError.of(ErrorKind.CONTENT_FILTER, "dashscope", "x"), 0)).isFalse();
        assertThat(policy.shouldRetry(ProviderError.of(ErrorKind.QUOTA_EXHAUSTED, "dashscope", "x"), 0)).isFalse();
        assertThat(policy.shouldRetry(ProviderError.of(ErrorKind.UNKNOWN, "dashscope", "x"), 0)).isFalse();
    }

    @Test
    @DisplayName("should grow backoff exponentially up to the ceiling")
    void shouldCapBackoff() {
        assertThat(policy.backoff(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofMillis(300));
    }

    @Test
    @DisplayName("should not retry with the none policy")
    void shouldNotRetryWithNone() {
        assertThat(RetryPolicy.none().shouldRetry(ProviderError.of(ErrorKind.TIMEOUT, "hunyuan", "t"), 0)).isFalse();
    }

    @Test
    @DisplayName("should reject invalid settings")
    void shouldValidate() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
