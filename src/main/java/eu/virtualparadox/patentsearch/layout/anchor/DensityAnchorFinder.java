package eu.virtualparadox.patentsearch.layout.anchor;

import eu.virtualparadox.patentsearch.error.AnchorNotFoundException;
import eu.virtualparadox.patentsearch.ingest.model.Line;
import eu.virtualparadox.patentsearch.layout.margin.MarginNumberLocator;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Anchors on the first page that is dense in margin line numbers.
 * <p>
 * Only body pages carry the 5, 10, ..., 65 gutter numbering, and extraction frequently glues
 * those numerals onto body lines. The first page holding more than {@code densityThreshold}
 * lines with a gutter numeral is taken as the first body page; the anchor is its first line.
 * </p>
 */
@RequiredArgsConstructor
public final class DensityAnchorFinder implements AnchorFinder {

    private final MarginNumberLocator locator;
    private final int densityThreshold;

    @Override
    public int findAnchor(final List<Line> lines, final String documentId) {
        int pageStart = 0;
        int currentPage = Integer.MIN_VALUE;
        int count = 0;

        for (int i = 0; i < lines.size(); i++) {
            final Line line = lines.get(i);
            if (line.page() != currentPage) {
                currentPage = line.page();
                pageStart = i;
                count = 0;
            }
            if (locator.locate(line).isPresent()) {
                count++;
                if (count > densityThreshold) {
                    return pageStart;
                }
            }
        }
        throw new AnchorNotFoundException(documentId, strategy().name());
    }

    @Override
    public EAnchorStrategy strategy() {
        return EAnchorStrategy.DENSITY;
    }
}
