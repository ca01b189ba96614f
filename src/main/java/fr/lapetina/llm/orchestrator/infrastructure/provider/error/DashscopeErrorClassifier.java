package fr.lapetina.llm.orchestrator.infrastructure.provider.error;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;

/**
 * Alibaba Dashscope (Qwen) error codes, native and compatible-mode shapes.
 */
public final class DashscopeErrorClassifier extends CodeTableErrorClassifier {

    @Override
    protected void registerRules() {
        rule("Throttling(\\..*)?", ErrorKind.RATE_LIMIT);
        rule("limit_requests", ErrorKind.RATE_LIMIT);
        rule("DataInspectionFailed|data_inspection_failed", ErrorKind.CONTENT_FILTER);
        rule("Arrearage|AccessDenied\\.Quota|insufficient_quota", ErrorKind.QUOTA_EXHAUSTED);
        rule("RequestTimeOut", ErrorKind.TIMEOUT);
        rule("InternalError(\\..*)?|ServiceUnavailable|SystemError", ErrorKind.SERVER_ERROR);
        rule("InvalidParameter|InvalidApiKey|ModelNotFound|AccessDenied(\\..*)?|invalid_request_error",
                ErrorKind.UNKNOWN);
    }

    @Override
    protected String extractCode(JsonNode body) {
        return openAiStyleCode(body);
    }
}
