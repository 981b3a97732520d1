package eu.virtualparadox.patentsearch.layout.anchor;

import eu.virtualparadox.patentsearch.error.AnchorNotFoundException;
import eu.virtualparadox.patentsearch.ingest.model.Line;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Anchors on the first page after the last drawing sheet.
 * <p>
 * Drawing pages are labelled {@code Sheet N of M}; the specification text starts on the page
 * following {@code Sheet M of M}. Sheet counts have at most four digits; longer digit runs are
 * extraction noise and are not read as markers.
 * </p>
 */
public final class SheetMarkerAnchorFinder implements AnchorFinder {

    private static final Pattern SHEET_MARKER = Pattern.compile(
            "\\bsheet\\s*(\\d{1,4})\\s*of\\s*(\\d{1,4})\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public int findAnchor(final List<Line> lines, final String documentId) {
        int lastSheetPage = -1;
        for (final Line line : lines) {
            final Matcher matcher = SHEET_MARKER.matcher(line.text());
            if (matcher.find() && Integer.parseInt(matcher.group(1)) == Integer.parseInt(matcher.group(2))) {
                lastSheetPage = line.page();
            }
        }

        if (lastSheetPage >= 0) {
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).page() > lastSheetPage) {
                    return i;
                }
            }
        }
        throw new AnchorNotFoundException(documentId, strategy().name());
    }

    @Override
    public EAnchorStrategy strategy() {
        return EAnchorStrategy.SHEET_MARKER;
    }
}
