package eu.virtualparadox.patentsearch.error;

/**
 * Raised when a stage receives no fragments at all.
 */
public class EmptyInputException extends PatentSearchException {

    public EmptyInputException(final String message) {
        super(message);
    }
}
