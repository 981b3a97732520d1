package eu.virtualparadox.patentsearch.ingest.model;

/**
 * Fragments merged on a shared {@code (page, y)} key.
 * <p>{@code x} is the left edge of the first fragment seen for the key.</p>
 */
public record Line(int page, float x, float y, float width, String text) {

    public AnchoredLine unassigned() {
        return new AnchoredLine(page, x, y, width, text, AnchoredLine.NO_COLUMN, 0);
    }

    public AnchoredLine inColumn(final int column) {
        return new AnchoredLine(page, x, y, width, text, column, 0);
    }
}
