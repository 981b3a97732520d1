package eu.virtualparadox.patentsearch.pipeline.report;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders reconstructed lines as a line-per-record text report:
 * <pre>
 *   Page: 3 Col: 5 Line: 12 at (655.20, 72.00 230.41)	[text of the line]
 * </pre>
 * Coordinates are {@code (y, x width)} with two decimals.
 */
@Component
public class LineReportFormatter {

    public String formatLine(final AnchoredLine line) {
        return String.format(Locale.ROOT, "Page: %d Col: %d Line: %d at (%.2f, %.2f %.2f)\t[%s]",
                line.page(), line.column(), line.lineNumber(), line.y(), line.x(), line.width(), line.text());
    }

    public String format(final List<AnchoredLine> lines) {
        final StringBuilder sb = new StringBuilder(lines.size() * 80);
        for (final AnchoredLine line : lines) {
            sb.append(formatLine(line)).append('\n');
        }
        return sb.toString();
    }
}
