package fr.lapetina.llm.orchestrator.aggregation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts top-level JSON objects from the token stream and reads their
 * {@code text} (or {@code name}) field. Text outside objects, such as a
 * wrapping array or markdown fences, is ignored.
 */
public final class JsonObjectSegmenter implements CandidateSegmenter {

    private static final Logger log = LoggerFactory.getLogger(JsonObjectSegmenter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final StringBuilder current = new StringBuilder();
    private int depth;
    private boolean inString;
    private boolean escaped;

    @Override
    public List<String> accept(String delta) {
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < delta.length(); i++) {
            char c = delta.charAt(i);
            if (depth == 0) {
                if (c == '{') {
                    depth = 1;
                    current.setLength(0);
                    current.append(c);
                }
                continue;
            }
            current.append(c);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    readText(current.toString(), texts);
                }
            }
        }
        return texts;
    }

    @Override
    public List<String> flush() {
        if (depth > 0) {
            log.debug("Dropping unterminated JSON object: length={}", current.length());
        }
        depth = 0;
        inString = false;
        escaped = false;
        current.setLength(0);
        return List.of();
    }

    private static void readText(String json, List<String> out) {
        try {
            JsonNode node = MAPPER.readTree(json);
            JsonNode text = node.hasNonNull("text") ? node.get("text") : node.get("name");
            if (text != null && text.isTextual() && !text.asText().isBlank()) {
                out.add(text.asText().strip());
            }
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed JSON candidate: length={}", json.length());
        }
    }
}
