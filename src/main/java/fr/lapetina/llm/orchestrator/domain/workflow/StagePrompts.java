package fr.lapetina.llm.orchestrator.domain.workflow;

/**
 * Renders stage prompt templates.
 */
public final class StagePrompts {

    public static final String SYSTEM_MESSAGE = "You are a helpful K12 education assistant.";

    private StagePrompts() {
        // Utility class
    }

    /**
     * @param dimension selected dimension, or {@code null} when the workflow has none
     * @param item      tab item for per-item stages, otherwise {@code null}
     */
    public static String render(StageDefinition stage, String topic, String dimension, String item,
                                int count, int batchNumber) {
        String prompt = stage.promptTemplate()
                .replace("{count}", Integer.toString(count))
                .replace("{topic}", nullToEmpty(topic))
                .replace("{dimension}", nullToEmpty(dimension))
                .replace("{item}", nullToEmpty(item));
        if (batchNumber > 1) {
            prompt += "\n\nNote: Batch " + batchNumber
                    + ". Provide different perspectives and avoid repeating earlier batches.";
        }
        return prompt;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
