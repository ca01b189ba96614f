package fr.lapetina.llm.orchestrator.infrastructure.provider.error;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;

/**
 * Volcengine ARK error codes.
 */
public final class VolcengineErrorClassifier extends CodeTableErrorClassifier {

    @Override
    protected void registerRules() {
        rule("RateLimitExceeded(\\..*)?", ErrorKind.RATE_LIMIT);
        rule(".*SensitiveContentDetected.*", ErrorKind.CONTENT_FILTER);
        rule("QuotaExceeded|AccountOverdueError|.*Overdue.*", ErrorKind.QUOTA_EXHAUSTED);
        rule("RequestTimeout", ErrorKind.TIMEOUT);
        rule("ServerOverloaded|InternalServiceError", ErrorKind.SERVER_ERROR);
        rule("AuthenticationError|AccessDenied|InvalidEndpointOrModel.*|MissingParameter|InvalidParameter",
                ErrorKind.UNKNOWN);
    }

    @Override
    protected String extractCode(JsonNode body) {
        return openAiStyleCode(body);
    }
}
