package eu.virtualparadox.patentsearch.layout.column;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import eu.virtualparadox.patentsearch.ingest.model.Line;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives columns from the order in which extraction emits lines.
 *
 * <h2>Rule</h2>
 * Extraction walks a column top to bottom, so baselines decrease. A baseline that grows on the
 * same page means a jump back to the top of the next physical column:
 * <ul>
 *   <li>page columns 1 and 3 are the two body columns,</li>
 *   <li>page columns 2 and 4 carry the gutter numbering and trailing page furniture,</li>
 *   <li>the document column advances when page column 1 or 3 is entered, and on every page change.</li>
 * </ul>
 */
public final class ExtractionOrderColumnAssigner implements ColumnAssigner {

    @Override
    public List<AnchoredLine> assignColumns(final List<Line> lines, final int anchorIndex) {
        checkAnchor(lines, anchorIndex);

        final List<AnchoredLine> result = new ArrayList<>(lines.size());
        for (int i = 0; i < anchorIndex; i++) {
            result.add(lines.get(i).unassigned());
        }

        int pageColumn = 1;
        int documentColumn = 1;
        result.add(lines.get(anchorIndex).inColumn(documentColumn));

        for (int i = anchorIndex + 1; i < lines.size(); i++) {
            final Line previous = lines.get(i - 1);
            final Line current = lines.get(i);

            if (current.page() == previous.page()) {
                if (current.y() > previous.y()) {
                    pageColumn++;
                    if (isBodyColumn(pageColumn)) {
                        documentColumn++;
                    }
                }
            } else {
                pageColumn = 1;
                documentColumn++;
            }

            result.add(isBodyColumn(pageColumn) ? current.inColumn(documentColumn) : current.unassigned());
        }
        return result;
    }

    @Override
    public EColumnStrategy strategy() {
        return EColumnStrategy.EXTRACTION_ORDER;
    }

    private static boolean isBodyColumn(final int pageColumn) {
        return pageColumn == 1 || pageColumn == 3;
    }

    static void checkAnchor(final List<Line> lines, final int anchorIndex) {
        if (anchorIndex < 0 || anchorIndex >= lines.size()) {
            throw new IllegalArgumentException("anchorIndex " + anchorIndex + " outside of [0, " + lines.size() + ")");
        }
    }
}
