package eu.virtualparadox.patentsearch.layout.margin;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import eu.virtualparadox.patentsearch.layout.margin.MarginNumberLocator.MarginNumber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits lines in which extraction glued a left-column line, a gutter number and a
 * right-column line together.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Only body lines (column != 0) that start in the left body column ({@code x < leftMaxX}) and
 *       hold a margin number right of the locator threshold are split. Right-column lines never
 *       cross the gutter, so numerals in their prose stay in place.</li>
 *   <li>The text before the number keeps the column and x of the line; the text after it moves to
 *       {@code column + 1} and starts at the estimated end of the number.</li>
 *   <li>Widths of both halves are re-estimated with the line's average character width.</li>
 *   <li>A half that is blank once trimmed is dropped. The number itself is discarded.</li>
 * </ul>
 * <p>The output is in emission order; callers must re-sort into reading order.</p>
 */
@Slf4j
@RequiredArgsConstructor
public final class MarginNumberSplitter {

    private final MarginNumberLocator locator;
    private final float leftMaxX;

    public List<AnchoredLine> splitMarginNumbers(final List<AnchoredLine> lines) {
        final List<AnchoredLine> result = new ArrayList<>(lines.size() + 16);
        for (final AnchoredLine line : lines) {
            if (!line.isBody() || line.x() >= leftMaxX) {
                result.add(line);
                continue;
            }

            final Optional<MarginNumber> found = locator.locate(line);
            if (found.isEmpty()) {
                result.add(line);
                continue;
            }

            final MarginNumber number = found.get();
            final String before = line.text().substring(0, number.start());
            final String after = line.text().substring(number.end());
            final float charWidth = number.averageCharWidth();

            if (!before.isBlank()) {
                result.add(new AnchoredLine(line.page(), line.x(), line.y(), charWidth * before.length(),
                        before, line.column(), line.lineNumber()));
            }
            if (!after.isBlank()) {
                result.add(new AnchoredLine(line.page(), number.estimatedEndX(), line.y(), charWidth * after.length(),
                        after, line.column() + 1, line.lineNumber()));
            }
            log.trace("Split margin number {} out of [{}] on page {}", number.value(), line.text(), line.page());
        }
        return result;
    }
}
