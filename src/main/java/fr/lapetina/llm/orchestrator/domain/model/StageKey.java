package fr.lapetina.llm.orchestrator.domain.model;

import java.util.Objects;

/**
 * Identifies a stage within a session, optionally narrowed to one item
 * for stages that are generated per selected item of the previous stage.
 */
public record StageKey(String stage, String item) {

    public StageKey {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("Stage name is required");
        }
        if (item != null && item.isBlank()) {
            item = null;
        }
    }

    public static StageKey of(String stage) {
        return new StageKey(stage, null);
    }

    public static StageKey of(String stage, String item) {
        return new StageKey(stage, item);
    }

    public boolean isItemScoped() {
        return item != null;
    }

    /**
     * Key used to guard one in-flight batch per session and stage.
     */
    public String scopeKey(String sessionId) {
        return Objects.requireNonNull(sessionId) + "|" + this;
    }

    @Override
    public String toString() {
        return item == null ? stage : stage + "/" + item;
    }
}
