package eu.virtualparadox.patentsearch.layout.anchor;

import eu.virtualparadox.patentsearch.error.AnchorNotFoundException;
import eu.virtualparadox.patentsearch.ingest.model.Line;

import java.util.List;

/**
 * Locates the line where the two-column body of a patent specification begins.
 */
public interface AnchorFinder {

    /**
     * @param lines      combined lines in extraction order
     * @param documentId identifier of the document, e.g. {@code US9740988}
     * @return index into {@code lines} of the anchor line
     * @throws AnchorNotFoundException if the layout offers no anchor
     */
    int findAnchor(final List<Line> lines, final String documentId);

    EAnchorStrategy strategy();

}
