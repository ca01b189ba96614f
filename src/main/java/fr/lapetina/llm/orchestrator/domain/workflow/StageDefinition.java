package fr.lapetina.llm.orchestrator.domain.workflow;

import java.util.Objects;

/**
 * Static description of one workflow stage.
 *
 * @param name           stage name used in {@link fr.lapetina.llm.orchestrator.domain.model.StageKey}
 * @param mode           selection exclusivity
 * @param perItem        one independent tab per selected item of the previous stage
 * @param diagramField   diagram JSON field holding this stage's confirmed content,
 *                       read on resume; for per-item stages, the field inside each item
 * @param promptTemplate generation prompt with {@code {count}}, {@code {topic}},
 *                       {@code {dimension}} and {@code {item}} placeholders
 */
public record StageDefinition(
        String name,
        SelectionMode mode,
        boolean perItem,
        String diagramField,
        String promptTemplate
) {
    public StageDefinition {
        Objects.requireNonNull(name, "Stage name is required");
        Objects.requireNonNull(mode, "Selection mode is required");
        Objects.requireNonNull(diagramField, "Diagram field is required");
        Objects.requireNonNull(promptTemplate, "Prompt template is required");
    }

    public static StageDefinition single(String name, String diagramField, String promptTemplate) {
        return new StageDefinition(name, SelectionMode.SINGLE, false, diagramField, promptTemplate);
    }

    public static StageDefinition multiple(String name, String diagramField, String promptTemplate) {
        return new StageDefinition(name, SelectionMode.MULTIPLE, false, diagramField, promptTemplate);
    }

    public static StageDefinition perItem(String name, String diagramField, String promptTemplate) {
        return new StageDefinition(name, SelectionMode.MULTIPLE, true, diagramField, promptTemplate);
    }
}
