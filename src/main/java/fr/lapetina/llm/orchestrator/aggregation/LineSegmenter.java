package fr.lapetina.llm.orchestrator.aggregation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Accumulates tokens into lines; each cleaned line of at least two
 * characters is a candidate. List markers ({@code 1.}, {@code 2)}, {@code -},
 * {@code 、}, bullets) and wrapping quotes are stripped.
 */
public final class LineSegmenter implements CandidateSegmenter {

    private static final int MIN_LENGTH = 2;

    private static final Pattern LIST_MARKER = Pattern.compile(
            "^\\s*(?:[-*•·]+|\\d{1,3}\\s*[.、)）:：]|[(（]\\d{1,3}[)）])\\s*");
    private static final Pattern WRAPPING_QUOTES = Pattern.compile("^[\"'“”‘’「」]+|[\"'“”‘’「」]+$");

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public List<String> accept(String delta) {
        buffer.append(delta);
        List<String> lines = new ArrayList<>();
        int newline;
        while ((newline = buffer.indexOf("\n")) >= 0) {
            String line = buffer.substring(0, newline);
            buffer.delete(0, newline + 1);
            addIfCandidate(line, lines);
        }
        return lines;
    }

    @Override
    public List<String> flush() {
        List<String> lines = new ArrayList<>(1);
        addIfCandidate(buffer.toString(), lines);
        buffer.setLength(0);
        return lines;
    }

    static String clean(String line) {
        String cleaned = LIST_MARKER.matcher(line).replaceFirst("");
        cleaned = WRAPPING_QUOTES.matcher(cleaned.strip()).replaceAll("");
        return cleaned.strip();
    }

    private static void addIfCandidate(String line, List<String> out) {
        String cleaned = clean(line);
        if (cleaned.codePointCount(0, cleaned.length()) >= MIN_LENGTH) {
            out.add(cleaned);
        }
    }
}
