package eu.virtualparadox.patentsearch.ingest.model;

import java.util.Comparator;

/**
 * A {@link Line} placed on the page/column/line grid of the document body.
 *
 * <p>Column {@value #NO_COLUMN} marks front matter, page headers and gutter text.
 * Such lines are kept for reporting but never indexed for search.</p>
 *
 * @param page       1-based page number
 * @param x          left edge in user space
 * @param y          baseline in user space
 * @param width      estimated width
 * @param text       line text
 * @param column     document column (running count across pages), or 0
 * @param lineNumber line number inside the column, or 0 when not numbered
 */
public record AnchoredLine(int page, float x, float y, float width, String text, int column, int lineNumber) {

    public static final int NO_COLUMN = 0;

    /**
     * Canonical reading order: page ascending, column ascending, y descending.
     */
    public static final Comparator<AnchoredLine> READING_ORDER = Comparator
            .comparingInt(AnchoredLine::page)
            .thenComparingInt(AnchoredLine::column)
            .thenComparing(AnchoredLine::y, Comparator.reverseOrder());

    public boolean isBody() {
        return column != NO_COLUMN;
    }

    public AnchoredLine withColumn(final int newColumn) {
        return new AnchoredLine(page, x, y, width, text, newColumn, lineNumber);
    }

    public AnchoredLine withLineNumber(final int newLineNumber) {
        return new AnchoredLine(page, x, y, width, text, column, newLineNumber);
    }

    public AnchoredLine withText(final String newText) {
        return new AnchoredLine(page, x, y, width, newText, column, lineNumber);
    }
}
