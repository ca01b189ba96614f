package fr.lapetina.llm.orchestrator.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DedupKeysTest {

    @Test
    @DisplayName("should fold case, punctuation and whitespace")
    void shouldFoldVariants() {
        assertThat(DedupKeys.normalize("  Water   Cycle! "))
                .isEqualTo(DedupKeys.normalize("water cycle"))
                .isEqualTo("water cycle");
    }

    @Test
    @DisplayName("should fold full-width forms")
    void shouldFoldFullWidth() {
        assertThat(DedupKeys.normalize("ＡＢＣ１２")).isEqualTo("abc12");
    }

    @Test
    @DisplayName("should treat CJK punctuation as separators")
    void shouldHandleCjk() {
        assertThat(DedupKeys.normalize("光合作用。")).isEqualTo(DedupKeys.normalize("光合作用"));
        assertThat(DedupKeys.normalize("光合作用")).isNotEqualTo(DedupKeys.normalize("呼吸作用"));
    }

    @Test
    @DisplayName("should return empty key for punctuation-only text")
    void shouldReturnEmptyKey() {
        assertThat(DedupKeys.normalize("...!!")).isEmpty();
        assertThat(DedupKeys.normalize(null)).isEmpty();
    }
}
