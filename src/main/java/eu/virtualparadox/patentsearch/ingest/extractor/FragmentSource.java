package eu.virtualparadox.patentsearch.ingest.extractor;

import eu.virtualparadox.patentsearch.ingest.model.TextFragment;

import java.util.List;

/**
 * Supplies the raw positioned fragments of a document, in extraction order.
 */
public interface FragmentSource {

    List<TextFragment> fetchFragments(final String documentId);

}
