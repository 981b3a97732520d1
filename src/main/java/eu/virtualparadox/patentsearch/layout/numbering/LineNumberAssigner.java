package eu.virtualparadox.patentsearch.layout.numbering;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Numbers the lines of each body column the way the printed margin numbering counts them.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A line whose baseline lies above {@code bodyTopY} is page header: its column is forced
 *       to 0 and it gets no number.</li>
 *   <li>The counter resets on every unassigned line and on every column change; the first line
 *       of a column is line 1.</li>
 *   <li>Inside a column the counter advances by 2 when the truncated baseline gap to the
 *       previous line exceeds {@code gapThreshold}, else by 1. Blank lines produce no
 *       fragments, so a wide gap stands for a skipped line.</li>
 * </ul>
 * <p>Input must already be in reading order.</p>
 */
@RequiredArgsConstructor
public final class LineNumberAssigner {

    private final float bodyTopY;
    private final int gapThreshold;

    public List<AnchoredLine> assignLineNumbers(final List<AnchoredLine> lines) {
        final List<AnchoredLine> result = new ArrayList<>(lines.size());

        AnchoredLine previous = null;
        int lineNumber = 0;
        for (final AnchoredLine line : lines) {
            if (!line.isBody() || line.y() > bodyTopY) {
                result.add(line.withColumn(AnchoredLine.NO_COLUMN).withLineNumber(0));
                previous = null;
                lineNumber = 0;
                continue;
            }

            if (previous == null || previous.column() != line.column()) {
                lineNumber = 1;
            } else {
                final int gap = (int) previous.y() - (int) line.y();
                lineNumber += gap > gapThreshold ? 2 : 1;
            }

            final AnchoredLine numbered = line.withLineNumber(lineNumber);
            result.add(numbered);
            previous = numbered;
        }
        return result;
    }
}
