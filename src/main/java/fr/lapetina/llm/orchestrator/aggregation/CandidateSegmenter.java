package fr.lapetina.llm.orchestrator.aggregation;

import java.util.List;

/**
 * Turns a provider's deltas into candidate texts.
 *
 * One instance per call attempt; not thread-safe.
 */
public interface CandidateSegmenter {

    /**
     * Feeds one delta and returns the candidates it completed.
     */
    List<String> accept(String delta);

    /**
     * Returns whatever the end of the stream completes.
     */
    List<String> flush();

    static CandidateSegmenter create(SegmentationMode mode) {
        return switch (mode) {
            case LINE -> new LineSegmenter();
            case JSON -> new JsonObjectSegmenter();
        };
    }
}
