package fr.lapetina.llm.orchestrator.aggregation;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes candidate text into the key used for duplicate suppression.
 *
 * Applies NFKC (full-width forms fold to ASCII), case folding, punctuation
 * removal and whitespace collapsing. CJK text is compared as is, without
 * segmentation.
 */
public final class DedupKeys {

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DedupKeys() {
        // Utility class
    }

    /**
     * @return the normalized key; empty when the text has no letters or digits
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        normalized = PUNCTUATION.matcher(normalized).replaceAll(" ");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }
}
