package eu.virtualparadox.patentsearch.ingest.combiner;

import eu.virtualparadox.patentsearch.error.EmptyInputException;
import eu.virtualparadox.patentsearch.ingest.model.Line;
import eu.virtualparadox.patentsearch.ingest.model.TextFragment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges fragments that share a page and a baseline into a single {@link Line}.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>The grouping key is {@code (page, y)} compared by exact equality; no tolerance is applied.</li>
 *   <li>Text is concatenated and widths are summed in encounter order. The extraction layer
 *       delivers runs of a line left to right, so encounter order is reading order.</li>
 *   <li>{@code x} comes from the first fragment seen for the key, since later stages assign
 *       columns by the left edge of a line.</li>
 *   <li>Lines are returned in first-seen key order. Sorting belongs to later stages.</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.</p>
 */
@Component
public class FragmentCombiner {

    /**
     * Combines fragments into lines.
     *
     * @param fragments fragments as delivered by extraction; must contain at least one element
     * @return one line per distinct {@code (page, y)} key
     * @throws EmptyInputException  if {@code fragments} is {@code null} or empty
     * @throws NullPointerException if a fragment is {@code null}
     */
    public List<Line> combineFragments(final List<TextFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new EmptyInputException("At least one text fragment is required");
        }

        final Map<LineKey, LineAccumulator> linesByKey = new LinkedHashMap<>();
        for (final TextFragment fragment : fragments) {
            Objects.requireNonNull(fragment, "fragments must not contain null elements");
            linesByKey
                    .computeIfAbsent(new LineKey(fragment.page(), fragment.y()), k -> new LineAccumulator(fragment))
                    .append(fragment);
        }

        final List<Line> lines = new ArrayList<>(linesByKey.size());
        for (final LineAccumulator accumulator : linesByKey.values()) {
            lines.add(accumulator.toLine());
        }
        return lines;
    }

    private record LineKey(int page, float y) {
    }

    private static final class LineAccumulator {
        private final int page;
        private final float x;
        private final float y;
        private final StringBuilder text = new StringBuilder();
        private float width;

        LineAccumulator(final TextFragment first) {
            this.page = first.page();
            this.x = first.x();
            this.y = first.y();
        }

        void append(final TextFragment fragment) {
            text.append(fragment.text());
            width += fragment.width();
        }

        Line toLine() {
            return new Line(page, x, y, width, text.toString());
        }
    }
}
