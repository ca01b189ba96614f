package fr.lapetina.llm.orchestrator.infrastructure.provider.error;

import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ProviderError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    @Nested
    @DisplayName("Dashscope")
    class DashscopeTests {

        private final ErrorClassifier classifier = new DashscopeErrorClassifier();

        @ParameterizedTest
        @CsvSource({
                "Throttling.RateQuota, RATE_LIMIT",
                "limit_requests, RATE_LIMIT",
                "DataInspectionFailed, CONTENT_FILTER",
                "Arrearage, QUOTA_EXHAUSTED",
                "RequestTimeOut, TIMEOUT",
                "InternalError.Algo, SERVER_ERROR",
                "InvalidApiKey, UNKNOWN"
        })
        @DisplayName("should classify native codes")
        void shouldClassifyCodes(String code, ErrorKind expected) {
            ProviderError error = classifier.classify("dashscope", 400,
                    "{\"code\":\"" + code + "\",\"message\":\"secret details\"}");

            assertThat(error.kind()).isEqualTo(expected);
            assertThat(error.code()).isEqualTo(code);
            assertThat(error.retryable()).isEqualTo(expected.isRetryable());
        }

        @Test
        @DisplayName("should read the compatible-mode error envelope")
        void shouldReadCompatibleEnvelope() {
            ProviderError error = classifier.classify("dashscope", 400,
                    "{\"error\":{\"code\":\"data_inspection_failed\",\"message\":\"Input data may contain inappropriate content.\"}}");

            assertThat(error.kind()).isEqualTo(ErrorKind.CONTENT_FILTER);
            assertThat(error.messageKey()).isEqualTo("error.content_filter");
        }
    }

    @Nested
    @DisplayName("Volcengine")
    class VolcengineTests {

        private final ErrorClassifier classifier = new VolcengineErrorClassifier();

        @ParameterizedTest
        @CsvSource({
                "RateLimitExceeded.EndpointRPMExceeded, RATE_LIMIT",
                "InputTextSensitiveContentDetected, CONTENT_FILTER",
                "AccountOverdueError, QUOTA_EXHAUSTED",
                "ServerOverloaded, SERVER_ERROR",
                "InvalidEndpointOrModel.NotFound, UNKNOWN"
        })
        @DisplayName("should classify ARK codes")
        void shouldClassifyCodes(String code, ErrorKind expected) {
            ProviderError error = classifier.classify("volcengine", 400,
                    "{\"error\":{\"code\":\"" + code + "\",\"message\":\"m\"}}");

            assertThat(error.kind()).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Hunyuan")
    class HunyuanTests {

        private final ErrorClassifier classifier = new HunyuanErrorClassifier();

        @Test
        @DisplayName("should read the Tencent Cloud envelope")
        void shouldReadTencentEnvelope() {
            ProviderError error = classifier.classify("hunyuan", 200,
                    "{\"Response\":{\"Error\":{\"Code\":\"RequestLimitExceeded\",\"Message\":\"m\"}}}");

            assertThat(error.kind()).isEqualTo(ErrorKind.RATE_LIMIT);
            assertThat(error.code()).isEqualTo("RequestLimitExceeded");
        }

        @Test
        @DisplayName("should classify exhausted resource packs as quota")
        void shouldClassifyQuota() {
            ProviderError error = classifier.classify("hunyuan", 400,
                    "{\"Response\":{\"Error\":{\"Code\":\"FailedOperation.ResourcePackExhausted\"}}}");

            assertThat(error.kind()).isEqualTo(ErrorKind.QUOTA_EXHAUSTED);
            assertThat(error.retryable()).isFalse();
        }
    }

    @Nested
    @DisplayName("Status fallback")
    class StatusFallbackTests {

        private final ErrorClassifier classifier = new DashscopeErrorClassifier();

        @ParameterizedTest
        @CsvSource({
                "429, RATE_LIMIT",
                "504, TIMEOUT",
                "402, QUOTA_EXHAUSTED",
                "503, SERVER_ERROR",
                "400, UNKNOWN"
        })
        @DisplayName("should use HTTP status when the body is not JSON")
        void shouldFallBackToStatus(int status, ErrorKind expected) {
            assertThat(classifier.classify("dashscope", status, "<html>bad gateway</html>").kind())
                    .isEqualTo(expected);
        }

        @Test
        @DisplayName("should use HTTP status for unrecognized codes")
        void shouldFallBackForUnknownCode() {
            assertThat(classifier.classify("dashscope", 429, "{\"code\":\"Brand.New\"}").kind())
                    .isEqualTo(ErrorKind.RATE_LIMIT);
        }

        @Test
        @DisplayName("should keep only a digest of the raw body")
        void shouldDigestBody() {
            ProviderError error = classifier.classify("dashscope", 500, "internal stack trace");

            assertThat(error.digest()).hasSize(16).doesNotContain("stack");
            assertThat(error.toString()).doesNotContain("internal stack trace");
        }
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportTests {

        @Test
        @DisplayName("should classify timeouts")
        void shouldClassifyTimeouts() {
            ProviderError error = ErrorClassifier.classifyFailure("dashscope",
                    new CompletionException(new HttpTimeoutException("request timed out")));

            assertThat(error.kind()).isEqualTo(ErrorKind.TIMEOUT);
        }

        @Test
        @DisplayName("should classify I/O failures as server errors")
        void shouldClassifyIoFailures() {
            assertThat(ErrorClassifier.classifyFailure("dashscope", new IOException("reset")).kind())
                    .isEqualTo(ErrorKind.SERVER_ERROR);
        }

        @Test
        @DisplayName("should pass through provider exceptions")
        void shouldUnwrapProviderException() {
            ProviderError original = ProviderError.of(ErrorKind.CONTENT_FILTER, "volcengine", "x", "raw");

            ProviderError error = ErrorClassifier.classifyFailure("volcengine",
                    new CompletionException(new ProviderException(original)));

            assertThat(error).isSameAs(original);
        }
    }
}
