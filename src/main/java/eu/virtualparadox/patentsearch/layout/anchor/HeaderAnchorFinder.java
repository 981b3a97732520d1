package eu.virtualparadox.patentsearch.layout.anchor;

import eu.virtualparadox.patentsearch.error.AnchorNotFoundException;
import eu.virtualparadox.patentsearch.ingest.model.Line;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Anchors on the document number header of the first body page.
 * <p>
 * Body pages of a patent specification repeat the document number at the top, and the first
 * one is directly followed by the column marker {@code 1}. Drawing sheets and the front page
 * carry the number too, but never followed by the marker.
 * </p>
 */
@RequiredArgsConstructor
public final class HeaderAnchorFinder implements AnchorFinder {

    private final String columnMarker;

    @Override
    public int findAnchor(final List<Line> lines, final String documentId) {
        final String header = StringUtils.deleteWhitespace(documentId);
        if (StringUtils.isEmpty(header)) {
            throw new AnchorNotFoundException(documentId, strategy().name());
        }

        for (int i = 0; i < lines.size() - 1; i++) {
            final String candidate = StringUtils.deleteWhitespace(lines.get(i).text());
            if (header.equals(candidate) && columnMarker.equals(StringUtils.trim(lines.get(i + 1).text()))) {
                return i;
            }
        }
        throw new AnchorNotFoundException(documentId, strategy().name());
    }

    @Override
    public EAnchorStrategy strategy() {
        return EAnchorStrategy.HEADER;
    }
}
