package eu.virtualparadox.patentsearch.ingest.model;

/**
 * A single positioned run of text as delivered by the extraction layer.
 *
 * @param page  1-based page number
 * @param x     left edge in PDF user space
 * @param y     baseline in PDF user space (grows upwards)
 * @param width run width in user space units
 * @param text  raw run text, never {@code null}
 */
public record TextFragment(int page, float x, float y, float width, String text) {

    public TextFragment {
        text = text == null ? "" : text;
    }

    public static TextFragment of(final Line line) {
        return new TextFragment(line.page(), line.x(), line.y(), line.width(), line.text());
    }
}
