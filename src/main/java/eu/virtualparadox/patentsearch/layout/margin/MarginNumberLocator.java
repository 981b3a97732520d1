package eu.virtualparadox.patentsearch.layout.margin;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import eu.virtualparadox.patentsearch.ingest.model.Line;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds typographic margin line numbers (5, 10, ..., 65) that extraction merged into a line.
 *
 * <p>A numeral only counts as a margin number when it stands alone between whitespace (or the
 * line boundaries) and its estimated x position lies right of {@code minX}. The position is
 * estimated with a uniform character width of {@code line.width / line.text.length}, so a numeral
 * inside prose on the left half of the page is not mistaken for a gutter number.</p>
 */
public final class MarginNumberLocator {

    private final Pattern pattern;
    private final float minX;

    /**
     * @param marginNumbers the numerals printed in the gutter, non-empty
     * @param minX          estimated x a numeral must exceed to count as a margin number
     */
    public MarginNumberLocator(final List<Integer> marginNumbers, final float minX) {
        if (marginNumbers == null || marginNumbers.isEmpty()) {
            throw new IllegalArgumentException("marginNumbers must not be empty");
        }
        final String alternatives = marginNumbers.stream()
                .map(String::valueOf)
                .collect(Collectors.joining("|"));
        this.pattern = Pattern.compile("(?:^|\\s)(" + alternatives + ")(?=\\s|$)");
        this.minX = minX;
    }

    /**
     * Locates the first qualifying margin number in {@code line}.
     *
     * @param line line to inspect
     * @return the located number, or empty when the line holds none right of {@code minX}
     */
    public Optional<MarginNumber> locate(final Line line) {
        return locate(line.x(), line.width(), line.text());
    }

    public Optional<MarginNumber> locate(final AnchoredLine line) {
        return locate(line.x(), line.width(), line.text());
    }

    private Optional<MarginNumber> locate(final float x, final float width, final String text) {
        if (StringUtils.isEmpty(text)) {
            return Optional.empty();
        }

        final float averageCharWidth = width / text.length();
        final Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            final float estimatedX = x + averageCharWidth * matcher.start();
            if (estimatedX > minX) {
                return Optional.of(new MarginNumber(
                        Integer.parseInt(matcher.group(1)),
                        matcher.start(),
                        matcher.end(),
                        estimatedX,
                        averageCharWidth));
            }
        }
        return Optional.empty();
    }

    /**
     * A margin number found inside a line.
     *
     * @param value            the numeral
     * @param start            start of the match in the line text, leading whitespace included
     * @param end              end of the match (exclusive)
     * @param estimatedX       estimated x of the match start
     * @param averageCharWidth the uniform character width used for the estimate
     */
    public record MarginNumber(int value, int start, int end, float estimatedX, float averageCharWidth) {

        public float estimatedEndX() {
            return estimatedX + averageCharWidth * (end - start);
        }
    }
}
