package fr.lapetina.llm.orchestrator.infrastructure.provider.error;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;

/**
 * Tencent Hunyuan error codes. Reads the Tencent Cloud
 * {@code Response.Error.Code} envelope and the OpenAI-compatible one.
 */
public final class HunyuanErrorClassifier extends CodeTableErrorClassifier {

    @Override
    protected void registerRules() {
        rule("RequestLimitExceeded(\\..*)?|LimitExceeded(\\..*)?", ErrorKind.RATE_LIMIT);
        rule("OperationDenied\\..*IllegalDetected", ErrorKind.CONTENT_FILTER);
        rule("FailedOperation\\.ResourcePackExhausted|ResourceInsufficient\\..*|FailedOperation\\.ServiceStop.*",
                ErrorKind.QUOTA_EXHAUSTED);
        rule("FailedOperation\\.EngineRequestTimeout", ErrorKind.TIMEOUT);
        rule("InternalError(\\..*)?|FailedOperation\\.EngineServerError", ErrorKind.SERVER_ERROR);
        rule("AuthFailure(\\..*)?|InvalidParameter(Value)?(\\..*)?", ErrorKind.UNKNOWN);
    }

    @Override
    protected String extractCode(JsonNode body) {
        JsonNode tencent = body.path("Response").path("Error").path("Code");
        if (tencent.isTextual()) {
            return tencent.asText();
        }
        return openAiStyleCode(body);
    }
}
