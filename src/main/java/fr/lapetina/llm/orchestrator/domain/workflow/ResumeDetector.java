package fr.lapetina.llm.orchestrator.domain.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads already-persisted diagram content to find the stages whose selection
 * exists, so a session resumes at the first stage lacking one.
 *
 * <p>A single-selection stage is confirmed by a non-blank text field. A
 * multi-selection stage is confirmed by a non-empty array of real items;
 * items may be strings or objects with a {@code text}, {@code label} or
 * {@code name} field. Default node labels such as "Branch 1" do not count.
 * A per-item stage is read inside each item object of the previous stage.
 */
public final class ResumeDetector {

    private static final Logger log = LoggerFactory.getLogger(ResumeDetector.class);

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "^(?:branch|part|step|sub-?step|category|child|item|sub-?part|attribute|context|similarity|"
                    + "node|new node|topic|分支|部分|步骤|子步骤|类别|子项|属性|新节点)\\s*\\d*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final String[] TEXT_FIELDS = {"text", "label", "name"};

    /**
     * Confirmed content of an existing diagram.
     *
     * @param topic     topic text, possibly empty
     * @param confirmed confirmed texts per stage key, in workflow order
     */
    public record Resume(String topic, Map<StageKey, List<String>> confirmed) {

        public boolean isConfirmed(StageKey key) {
            return confirmed.containsKey(key);
        }
    }

    private ResumeDetector() {
        // Utility class
    }

    public static Resume detect(DiagramWorkflow workflow, JsonNode diagram) {
        Map<StageKey, List<String>> confirmed = new LinkedHashMap<>();
        if (diagram == null || !diagram.isObject()) {
            return new Resume("", confirmed);
        }
        String topic = topicOf(workflow, diagram);

        JsonNode previousItems = null;
        for (StageDefinition stage : workflow.stages()) {
            if (stage.perItem()) {
                readPerItem(stage, previousItems, confirmed);
                break;
            }
            JsonNode field = diagram.get(stage.diagramField());
            List<String> texts = stage.mode() == SelectionMode.SINGLE
                    ? singleText(field)
                    : realItems(field);
            if (texts.isEmpty()) {
                break;
            }
            confirmed.put(StageKey.of(stage.name()), texts);
            previousItems = field;
        }

        log.debug("Resume detected: diagramType={}, confirmedStages={}", workflow.diagramType(), confirmed.keySet());
        return new Resume(topic, confirmed);
    }

    static boolean isPlaceholder(String text) {
        return text == null || text.isBlank() || PLACEHOLDER.matcher(text.trim()).matches();
    }

    private static void readPerItem(StageDefinition stage, JsonNode parentItems, Map<StageKey, List<String>> confirmed) {
        if (parentItems == null || !parentItems.isArray()) {
            return;
        }
        for (JsonNode parent : parentItems) {
            String parentText = textOf(parent);
            if (isPlaceholder(parentText) || !parent.isObject()) {
                continue;
            }
            List<String> children = realItems(parent.get(stage.diagramField()));
            if (!children.isEmpty()) {
                confirmed.put(StageKey.of(stage.name(), parentText.trim()), children);
            }
        }
    }

    private static String topicOf(DiagramWorkflow workflow, JsonNode diagram) {
        List<String> parts = new ArrayList<>();
        for (String field : workflow.topicFields()) {
            String text = textOf(diagram.get(field));
            if (text != null && !text.isBlank()) {
                parts.add(text.trim());
            }
        }
        return String.join(" and ", parts);
    }

    private static List<String> singleText(JsonNode node) {
        String text = textOf(node);
        return isPlaceholder(text) ? List.of() : List.of(text.trim());
    }

    private static List<String> realItems(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> texts = new ArrayList<>();
        for (JsonNode item : node) {
            String text = textOf(item);
            if (!isPlaceholder(text)) {
                texts.add(text.trim());
            }
        }
        return texts;
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isObject()) {
            for (String field : TEXT_FIELDS) {
                JsonNode value = node.get(field);
                if (value != null && value.isTextual()) {
                    return value.asText();
                }
            }
        }
        return null;
    }
}
