package fr.lapetina.llm.orchestrator.infrastructure.provider.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ProviderError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifier driven by an ordered table of error-code patterns.
 *
 * Subclasses locate the code in the JSON body and declare their table;
 * the first matching pattern wins. Bodies without a known code fall back to
 * the HTTP status.
 */
public abstract class CodeTableErrorClassifier implements ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(CodeTableErrorClassifier.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Rule> rules = new ArrayList<>();

    protected CodeTableErrorClassifier() {
        registerRules();
    }

    /**
     * Declares the code table through {@link #rule(String, ErrorKind)}.
     */
    protected abstract void registerRules();

    /**
     * Extracts the provider error code from a parsed body, or {@code null}.
     */
    protected abstract String extractCode(JsonNode body);

    protected final void rule(String regex, ErrorKind kind) {
        rules.add(new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), kind));
    }

    @Override
    public ProviderError classify(String provider, int statusCode, String body) {
        String code = parseCode(body);
        ErrorKind kind = code != null ? lookup(code) : null;
        if (kind == null) {
            kind = ErrorClassifier.kindForStatus(statusCode);
        }
        ProviderError error = ProviderError.of(kind, provider, code, body);

        log.debug("Provider error classified: provider={}, status={}, code={}, kind={}, digest={}",
                provider, statusCode, code, kind, error.digest());
        return error;
    }

    private String parseCode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = MAPPER.readTree(body);
            String code = extractCode(root);
            return code == null || code.isBlank() ? null : code;
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: length={}", body.length());
            return null;
        }
    }

    private ErrorKind lookup(String code) {
        for (Rule rule : rules) {
            if (rule.pattern().matcher(code).matches()) {
                return rule.kind();
            }
        }
        return null;
    }

    /**
     * Reads {@code error.code}, then a top-level {@code code}.
     * This is the OpenAI-compatible shape most providers use.
     */
    protected static String openAiStyleCode(JsonNode body) {
        JsonNode error = body.path("error");
        if (error.isObject()) {
            String code = textOrNull(error.get("code"));
            return code != null ? code : textOrNull(error.get("type"));
        }
        return textOrNull(body.get("code"));
    }

    protected static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

    private record Rule(Pattern pattern, ErrorKind kind) {
    }
}
