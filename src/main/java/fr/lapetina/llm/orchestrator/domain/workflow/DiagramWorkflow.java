package fr.lapetina.llm.orchestrator.domain.workflow;

import java.util.List;
import java.util.Optional;

/**
 * Ordered stages of one diagram type.
 *
 * @param diagramType diagram type name, e.g. {@code brace_map}
 * @param topicFields diagram JSON fields naming the topic, joined when several
 * @param stages      stages in workflow order, at most three
 */
public record DiagramWorkflow(String diagramType, List<String> topicFields, List<StageDefinition> stages) {

    public DiagramWorkflow {
        topicFields = List.copyOf(topicFields);
        stages = List.copyOf(stages);
        if (stages.isEmpty() || stages.size() > 3) {
            throw new IllegalArgumentException("A workflow has one to three stages: " + diagramType);
        }
        if (stages.get(0).perItem()) {
            throw new IllegalArgumentException("First stage cannot be per item: " + diagramType);
        }
        for (int i = 1; i < stages.size(); i++) {
            if (stages.get(i).perItem() && stages.get(i - 1).perItem()) {
                throw new IllegalArgumentException("Per-item stages cannot follow each other: " + diagramType);
            }
        }
    }

    public Optional<StageDefinition> stage(String name) {
        return stages.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /**
     * @return index of the stage, or -1
     */
    public int indexOf(String name) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<StageDefinition> previous(String name) {
        int index = indexOf(name);
        return index > 0 ? Optional.of(stages.get(index - 1)) : Optional.empty();
    }

    public Optional<StageDefinition> next(String name) {
        int index = indexOf(name);
        return index >= 0 && index + 1 < stages.size() ? Optional.of(stages.get(index + 1)) : Optional.empty();
    }

    public StageDefinition first() {
        return stages.get(0);
    }
}
