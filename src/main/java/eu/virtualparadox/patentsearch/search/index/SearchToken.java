package eu.virtualparadox.patentsearch.search.index;

/**
 * One lower-cased word of a body line.
 *
 * @param column document column of the line
 * @param line   line number inside the column
 * @param text   lower-cased, trimmed word
 */
public record SearchToken(int column, int line, String text) {

    /**
     * @return {@code true} if {@code other} comes from a different physical line
     */
    public boolean isOnOtherLineThan(final SearchToken other) {
        return column != other.column || line != other.line;
    }
}
