package eu.virtualparadox.patentsearch.error;

/**
 * Base type of the errors raised by the reconstruction and search pipeline.
 * All of them are terminal for the call that raised them.
 */
public abstract class PatentSearchException extends RuntimeException {

    protected PatentSearchException(final String message) {
        super(message);
    }
}
