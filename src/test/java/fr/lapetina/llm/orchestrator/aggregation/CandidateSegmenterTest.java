package fr.lapetina.llm.orchestrator.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateSegmenterTest {

    private static List<String> feed(CandidateSegmenter segmenter, String... deltas) {
        List<String> out = new ArrayList<>();
        for (String delta : deltas) {
            out.addAll(segmenter.accept(delta));
        }
        out.addAll(segmenter.flush());
        return out;
    }

    @Nested
    @DisplayName("LineSegmenter")
    class LineTests {

        @Test
        @DisplayName("should emit one candidate per completed line")
        void shouldSplitLines() {
            CandidateSegmenter segmenter = new LineSegmenter();

            assertThat(segmenter.accept("Photo")).isEmpty();
            assertThat(segmenter.accept("synthesis\nRespi")).containsExactly("Photosynthesis");
            assertThat(segmenter.accept("ration\n")).containsExactly("Respiration");
        }

        @Test
        @DisplayName("should emit the trailing line on flush")
        void shouldFlushRemainder() {
            assertThat(feed(new LineSegmenter(), "Roots\nLeaves")).containsExactly("Roots", "Leaves");
        }

        @Test
        @DisplayName("should strip list markers and wrapping quotes")
        void shouldCleanMarkers() {
            List<String> out = feed(new LineSegmenter(),
                    "1. Stem\n", "2) \"Flower\"\n", "- Seed\n", "• Fruit\n", "3、叶子\n", "(4) Bark\n");

            assertThat(out).containsExactly("Stem", "Flower", "Seed", "Fruit", "叶子", "Bark");
        }

        @Test
        @DisplayName("should drop blank and single-character lines")
        void shouldDropShortLines() {
            assertThat(feed(new LineSegmenter(), "\n\nA\n  \n-\nOK\n")).containsExactly("OK");
        }
    }

    @Nested
    @DisplayName("JsonObjectSegmenter")
    class JsonTests {

        @Test
        @DisplayName("should read text from objects split across deltas")
        void shouldReadSplitObjects() {
            List<String> out = feed(new JsonObjectSegmenter(),
                    "[{\"te", "xt\": \"Causes\"}, {\"text\"", ": \"Effects\"}]");

            assertThat(out).containsExactly("Causes", "Effects");
        }

        @Test
        @DisplayName("should fall back to the name field")
        void shouldReadNameField() {
            assertThat(feed(new JsonObjectSegmenter(), "{\"name\": \"Structure\"}")).containsExactly("Structure");
        }

        @Test
        @DisplayName("should ignore braces inside strings")
        void shouldHandleBracesInStrings() {
            assertThat(feed(new JsonObjectSegmenter(), "{\"text\": \"set {a, b} \\\"q\\\"\"}"))
                    .containsExactly("set {a, b} \"q\"");
        }

        @Test
        @DisplayName("should skip malformed objects and unterminated tails")
        void shouldSkipMalformed() {
            assertThat(feed(new JsonObjectSegmenter(), "```json\n{text: bad}\n{\"text\": \"Good\"}\n{\"text\": \"cut"))
                    .containsExactly("Good");
        }
    }

    @Test
    @DisplayName("should create segmenter by mode")
    void shouldCreateByMode() {
        assertThat(CandidateSegmenter.create(SegmentationMode.LINE)).isInstanceOf(LineSegmenter.class);
        assertThat(CandidateSegmenter.create(SegmentationMode.fromName("JSON"))).isInstanceOf(JsonObjectSegmenter.class);
        assertThatThrownBy(() -> SegmentationMode.fromName("xml")).isInstanceOf(IllegalArgumentException.class);
    }
}
