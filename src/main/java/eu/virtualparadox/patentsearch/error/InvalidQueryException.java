package eu.virtualparadox.patentsearch.error;

/**
 * Raised for a null, empty or whitespace-only search query.
 */
public class InvalidQueryException extends PatentSearchException {

    public InvalidQueryException(final String message) {
        super(message);
    }
}
