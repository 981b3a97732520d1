package eu.virtualparadox.patentsearch.error;

/**
 * Raised when no line marks the start of the two-column body, which means
 * the document layout is not supported.
 */
public class AnchorNotFoundException extends PatentSearchException {

    private final String documentId;

    public AnchorNotFoundException(final String documentId, final String strategy) {
        super("No body anchor found in document " + documentId + " using strategy " + strategy);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
