package eu.virtualparadox.patentsearch.layout.column;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import eu.virtualparadox.patentsearch.ingest.model.Line;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives columns from the left edge of each line.
 * <p>
 * {@code x < leftMaxX} is the left body column, {@code x > rightMinX} the right one, anything in
 * between is the gutter. The document column is {@code 2 * (page - anchorPage) + 1} for the left
 * column and one more for the right column, which matches what
 * {@link ExtractionOrderColumnAssigner} produces for a well-formed page.
 * </p>
 */
@RequiredArgsConstructor
public final class GeometryColumnAssigner implements ColumnAssigner {

    private final float leftMaxX;
    private final float rightMinX;

    @Override
    public List<AnchoredLine> assignColumns(final List<Line> lines, final int anchorIndex) {
        ExtractionOrderColumnAssigner.checkAnchor(lines, anchorIndex);

        final int anchorPage = lines.get(anchorIndex).page();
        final List<AnchoredLine> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            final Line line = lines.get(i);
            if (i < anchorIndex || line.page() < anchorPage) {
                result.add(line.unassigned());
                continue;
            }

            final int pageOffset = 2 * (line.page() - anchorPage);
            if (line.x() < leftMaxX) {
                result.add(line.inColumn(pageOffset + 1));
            } else if (line.x() > rightMinX) {
                result.add(line.inColumn(pageOffset + 2));
            } else {
                result.add(line.unassigned());
            }
        }
        return result;
    }

    @Override
    public EColumnStrategy strategy() {
        return EColumnStrategy.GEOMETRY;
    }
}
