package eu.virtualparadox.patentsearch.pipeline;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import eu.virtualparadox.patentsearch.search.index.SearchToken;

import java.util.List;

/**
 * Outcome of a full reconstruction.
 *
 * @param documentId  reconstructed document
 * @param anchorIndex index of the body anchor in the combined line list
 * @param lines       every line in reading order, numbered; front matter has column 0
 * @param index       searchable token sequence
 */
public record ReconstructedDocument(String documentId,
                                    int anchorIndex,
                                    List<AnchoredLine> lines,
                                    List<SearchToken> index) {

    public ReconstructedDocument {
        lines = List.copyOf(lines);
        index = List.copyOf(index);
    }

    public List<AnchoredLine> bodyLines() {
        return lines.stream().filter(AnchoredLine::isBody).toList();
    }
}
