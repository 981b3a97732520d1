package eu.virtualparadox.patentsearch.ingest.cleaner;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class LineTextCleaner {

    /**
     * Cleans the text of a single reconstructed line: removes control and zero-width characters,
     * normalizes whitespace, and closes the spacing artifacts extraction leaves around punctuation.
     * Line geometry is not touched, so the result is meant for search and reporting only.
     *
     * @param input raw line text
     * @return cleaned text, never {@code null}
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        return input
                // zero-width and similar -> remove
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", "")
                // non-breaking space -> SPACE
                .replace('\u00A0', ' ')
                // soft hyphen -> remove
                .replace("\u00AD", "")
                // tabs and line breaks -> SPACE, before control chars are dropped
                .replaceAll("[\\t\\r\\n]", " ")
                // control chars -> remove
                .replaceAll("\\p{Cc}", "")
                // collapse multiple whitespace -> single space
                .replaceAll("\\s+", " ")
                .trim()
                // extraction puts a space in front of some punctuation
                .replace(" ,", ",")
                .replace(" /", "/")
                .replace(" ' ", "'")
                .replace(" -", "-")
                .replace(" . ", ".");
    }

    /**
     * Cleans the text of every line while keeping order, geometry, columns and line numbers.
     *
     * @param lines reconstructed lines
     * @return new list with cleaned text
     */
    public List<AnchoredLine> cleanLines(final List<AnchoredLine> lines) {
        final List<AnchoredLine> cleaned = new ArrayList<>(lines.size());
        for (final AnchoredLine line : lines) {
            cleaned.add(line.withText(cleanText(line.text())));
        }
        return cleaned;
    }
}
