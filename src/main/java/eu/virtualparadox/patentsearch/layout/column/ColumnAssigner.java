package eu.virtualparadox.patentsearch.layout.column;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import eu.virtualparadox.patentsearch.ingest.model.Line;

import java.util.List;

/**
 * Assigns a document column to every line at or after the anchor.
 * <p>
 * Body columns are numbered across the whole document: the two columns of the anchor page are
 * 1 and 2, those of the next page 3 and 4, and so on. Lines before the anchor and lines in the
 * gutter get {@link AnchoredLine#NO_COLUMN}. The output has the same size and order as the input.
 * </p>
 */
public interface ColumnAssigner {

    List<AnchoredLine> assignColumns(final List<Line> lines, final int anchorIndex);

    EColumnStrategy strategy();

}
