package eu.virtualparadox.patentsearch.search;

import eu.virtualparadox.patentsearch.error.InvalidQueryException;
import eu.virtualparadox.patentsearch.ingest.extractor.FragmentSource;
import eu.virtualparadox.patentsearch.pipeline.LayoutPipeline;
import eu.virtualparadox.patentsearch.pipeline.ReconstructedDocument;
import eu.virtualparadox.patentsearch.pipeline.cache.ReconstructedDocumentCache;
import eu.virtualparadox.patentsearch.search.match.FuzzyPhraseMatcher;
import eu.virtualparadox.patentsearch.search.match.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for phrase search in a patent document.
 * <p>
 * Documents are fetched from the {@link FragmentSource}, reconstructed once by the
 * {@link LayoutPipeline} and kept in the {@link ReconstructedDocumentCache}, so repeated queries
 * against the same document only pay for matching.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatentSearchService {

    private final FragmentSource fragmentSource;
    private final LayoutPipeline layoutPipeline;
    private final ReconstructedDocumentCache cache;
    private final FuzzyPhraseMatcher matcher;

    /**
     * Returns the reconstructed reading order of {@code documentId}.
     */
    public ReconstructedDocument reconstruct(final String documentId) {
        if (StringUtils.isBlank(documentId)) {
            throw new IllegalArgumentException("documentId cannot be null or blank");
        }
        return cache.getOrReconstruct(documentId,
                id -> layoutPipeline.reconstruct(id, fragmentSource.fetchFragments(id)));
    }

    /**
     * Searches {@code query} in {@code documentId}.
     *
     * @param documentId document to search
     * @param query      phrase; words may be off by up to the configured edit distance
     * @return matches in reading order
     * @throws InvalidQueryException if {@code query} is blank; checked before any document work
     */
    public List<MatchResult> search(final String documentId, final String query) {
        if (StringUtils.isBlank(query)) {
            throw new InvalidQueryException("Query must contain at least one word");
        }
        final ReconstructedDocument document = reconstruct(documentId);
        final List<MatchResult> matches = matcher.search(document.index(), query);
        log.info("Query [{}] on {}: {} matches", query, documentId, matches.size());
        return matches;
    }
}
