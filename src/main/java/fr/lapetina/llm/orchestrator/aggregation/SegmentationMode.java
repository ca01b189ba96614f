package fr.lapetina.llm.orchestrator.aggregation;

/**
 * How a provider's token stream is cut into candidates.
 */
public enum SegmentationMode {
    /** Tokens accumulate into lines; one candidate per line */
    LINE,

    /** One candidate per JSON object carrying a {@code text} field */
    JSON;

    public static SegmentationMode fromName(String name) {
        if (name == null) {
            return LINE;
        }
        return switch (name.trim().toLowerCase()) {
            case "line" -> LINE;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unknown segmentation mode: " + name);
        };
    }
}
