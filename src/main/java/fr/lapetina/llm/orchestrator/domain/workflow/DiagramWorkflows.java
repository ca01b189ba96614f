package fr.lapetina.llm.orchestrator.domain.workflow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in diagram workflows.
 *
 * Multi-stage types pick a decomposition dimension first where the diagram
 * has one, then the main items, then children per selected item.
 */
public final class DiagramWorkflows {

    private static final String LIST_RULES = "\n\nRequirements:\n"
            + "1. Each entry concise and specific\n"
            + "2. Entries distinct and non-overlapping\n"
            + "3. Output only the entries, one per line, no numbering";

    private static final Map<String, DiagramWorkflow> WORKFLOWS = new LinkedHashMap<>();

    static {
        register(new DiagramWorkflow("brace_map", List.of("whole"), List.of(
                StageDefinition.single("dimensions", "dimension",
                        "Generate {count} possible decomposition dimensions for: {topic}\n\n"
                                + "A brace map can break a whole down along different dimensions, such as "
                                + "physical components, functional modules or time stages."
                                + LIST_RULES + "\n\nGenerate {count} dimensions:"),
                StageDefinition.multiple("parts", "parts",
                        "Generate {count} main parts of: {topic}\n"
                                + "Decomposition dimension: {dimension}\n\n"
                                + "Every part MUST follow the \"{dimension}\" dimension."
                                + LIST_RULES + "\n\nGenerate {count} parts:"),
                StageDefinition.perItem("subparts", "subparts",
                        "Generate {count} sub-components for part \"{item}\" of whole: {topic}\n\n"
                                + "All sub-components MUST belong to the part \"{item}\"."
                                + LIST_RULES + "\n\nGenerate {count} sub-components for \"{item}\":")
        )));

        register(new DiagramWorkflow("flow_map", List.of("title"), List.of(
                StageDefinition.single("dimensions", "dimension",
                        "Generate {count} possible ways to sequence the process: {topic}\n\n"
                                + "Each way names a perspective for ordering the steps, such as "
                                + "chronological, causal or procedural."
                                + LIST_RULES + "\n\nGenerate {count} perspectives:"),
                StageDefinition.multiple("steps", "steps",
                        "Generate {count} main steps of the process: {topic}\n"
                                + "Perspective: {dimension}\n\n"
                                + "Steps should follow each other in order."
                                + LIST_RULES + "\n\nGenerate {count} steps:"),
                StageDefinition.perItem("substeps", "substeps",
                        "Generate {count} sub-steps for the step \"{item}\" of the process: {topic}\n\n"
                                + "All sub-steps MUST detail the step \"{item}\"."
                                + LIST_RULES + "\n\nGenerate {count} sub-steps for \"{item}\":")
        )));

        register(new DiagramWorkflow("tree_map", List.of("topic"), List.of(
                StageDefinition.single("dimensions", "dimension",
                        "Generate {count} possible classification dimensions for: {topic}\n\n"
                                + "A tree map classifies a topic along one dimension, such as "
                                + "type, function or habitat."
                                + LIST_RULES + "\n\nGenerate {count} dimensions:"),
                StageDefinition.multiple("categories", "children",
                        "Generate {count} categories of: {topic}\n"
                                + "Classification dimension: {dimension}\n\n"
                                + "Every category MUST follow the \"{dimension}\" dimension."
                                + LIST_RULES + "\n\nGenerate {count} categories:"),
                StageDefinition.perItem("children", "children",
                        "Generate {count} examples for the category \"{item}\" of: {topic}\n\n"
                                + "All examples MUST belong to the category \"{item}\"."
                                + LIST_RULES + "\n\nGenerate {count} examples for \"{item}\":")
        )));

        register(new DiagramWorkflow("mind_map", List.of("topic"), List.of(
                StageDefinition.multiple("branches", "children",
                        "Generate {count} main branches for a mind map about: {topic}"
                                + LIST_RULES + "\n\nGenerate {count} branches:"),
                StageDefinition.perItem("children", "children",
                        "Generate {count} sub-ideas for the branch \"{item}\" of a mind map about: {topic}\n\n"
                                + "All sub-ideas MUST extend the branch \"{item}\"."
                                + LIST_RULES + "\n\nGenerate {count} sub-ideas for \"{item}\":")
        )));

        register(new DiagramWorkflow("circle_map", List.of("topic"), List.of(
                StageDefinition.multiple("context", "context",
                        "Generate {count} context items that define or describe: {topic}"
                                + LIST_RULES + "\n\nGenerate {count} context items:")
        )));

        register(new DiagramWorkflow("bubble_map", List.of("topic"), List.of(
                StageDefinition.multiple("attributes", "attributes",
                        "Generate {count} descriptive attributes of: {topic}\n\n"
                                + "Use adjectives or short adjective phrases."
                                + LIST_RULES + "\n\nGenerate {count} attributes:")
        )));

        register(new DiagramWorkflow("double_bubble_map", List.of("left", "right"), List.of(
                StageDefinition.multiple("similarities", "similarities",
                        "Generate {count} similarities shared by: {topic}"
                                + LIST_RULES + "\n\nGenerate {count} similarities:")
        )));
    }

    private DiagramWorkflows() {
        // Utility class
    }

    /**
     * Registers or replaces a workflow.
     */
    public static synchronized void register(DiagramWorkflow workflow) {
        WORKFLOWS.put(workflow.diagramType(), workflow);
    }

    public static synchronized Optional<DiagramWorkflow> find(String diagramType) {
        if (diagramType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(WORKFLOWS.get(diagramType.trim().toLowerCase()));
    }

    /**
     * @throws IllegalArgumentException for unknown diagram types
     */
    public static DiagramWorkflow get(String diagramType) {
        return find(diagramType).orElseThrow(() ->
                new IllegalArgumentException("Unknown diagram type: " + diagramType));
    }

    public static synchronized Set<String> getRegisteredTypes() {
        return Set.copyOf(WORKFLOWS.keySet());
    }
}
