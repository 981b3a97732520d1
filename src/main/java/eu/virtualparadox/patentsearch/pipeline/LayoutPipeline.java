package eu.virtualparadox.patentsearch.pipeline;

import eu.virtualparadox.patentsearch.application.config.PatentSearchConfig;
import eu.virtualparadox.patentsearch.ingest.cleaner.LineTextCleaner;
import eu.virtualparadox.patentsearch.ingest.combiner.FragmentCombiner;
import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import eu.virtualparadox.patentsearch.ingest.model.Line;
import eu.virtualparadox.patentsearch.ingest.model.TextFragment;
import eu.virtualparadox.patentsearch.layout.anchor.AnchorFinder;
import eu.virtualparadox.patentsearch.layout.column.ColumnAssigner;
import eu.virtualparadox.patentsearch.layout.margin.MarginNumberSplitter;
import eu.virtualparadox.patentsearch.layout.numbering.LineNumberAssigner;
import eu.virtualparadox.patentsearch.pipeline.event.EPipelineStage;
import eu.virtualparadox.patentsearch.pipeline.event.PipelineEvent;
import eu.virtualparadox.patentsearch.pipeline.event.PipelineEventListener;
import eu.virtualparadox.patentsearch.search.index.SearchIndexBuilder;
import eu.virtualparadox.patentsearch.search.index.SearchToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the full reconstruction of one document:
 * <ol>
 *   <li>combine fragments into lines,</li>
 *   <li>find the body anchor,</li>
 *   <li>assign document columns,</li>
 *   <li>split glued margin numbers (optional),</li>
 *   <li>restore reading order and clean line text (optional),</li>
 *   <li>number lines per column,</li>
 *   <li>build the search index.</li>
 * </ol>
 * <p>Every stage publishes a {@link PipelineEvent}. The pipeline keeps no state between calls, so
 * different documents may be reconstructed concurrently.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LayoutPipeline {

    private final FragmentCombiner fragmentCombiner;
    private final AnchorFinder anchorFinder;
    private final ColumnAssigner columnAssigner;
    private final MarginNumberSplitter marginNumberSplitter;
    private final LineTextCleaner lineTextCleaner;
    private final LineNumberAssigner lineNumberAssigner;
    private final SearchIndexBuilder searchIndexBuilder;
    private final PatentSearchConfig config;
    private final List<PipelineEventListener> listeners;

    /**
     * Reconstructs the reading order of {@code documentId} from its raw fragments.
     *
     * @param documentId identifier used for anchoring and diagnostics
     * @param fragments  raw fragments in extraction order
     * @return numbered lines and their search index
     * @throws eu.virtualparadox.patentsearch.error.EmptyInputException     if there are no fragments
     * @throws eu.virtualparadox.patentsearch.error.AnchorNotFoundException if the body start cannot be found
     */
    public ReconstructedDocument reconstruct(final String documentId, final List<TextFragment> fragments) {
        final List<Line> lines = fragmentCombiner.combineFragments(fragments);
        publish(PipelineEvent.counts(documentId, EPipelineStage.COMBINED, fragments.size(), lines.size()));

        final int anchorIndex = anchorFinder.findAnchor(lines, documentId);
        publish(PipelineEvent.counts(documentId, EPipelineStage.ANCHORED, lines.size(), anchorIndex));
        log.debug("Document {} body starts at line {} on page {} ({} strategy)",
                documentId, anchorIndex, lines.get(anchorIndex).page(), anchorFinder.strategy());

        List<AnchoredLine> anchored = columnAssigner.assignColumns(lines, anchorIndex);
        publish(PipelineEvent.lines(documentId, EPipelineStage.COLUMNED, lines.size(), anchored));

        if (config.getMargin().isSplitEnabled()) {
            final int before = anchored.size();
            anchored = marginNumberSplitter.splitMarginNumbers(anchored);
            publish(PipelineEvent.lines(documentId, EPipelineStage.MARGIN_SPLIT, before, anchored));
        }

        anchored = new ArrayList<>(anchored);
        anchored.sort(AnchoredLine.READING_ORDER);

        if (config.getText().isNormalize()) {
            anchored = lineTextCleaner.cleanLines(anchored);
            publish(PipelineEvent.lines(documentId, EPipelineStage.CLEANED, anchored.size(), anchored));
        }

        // header lines lose their column here, so order is restored once more
        final List<AnchoredLine> numbered = new ArrayList<>(lineNumberAssigner.assignLineNumbers(anchored));
        numbered.sort(AnchoredLine.READING_ORDER);
        publish(PipelineEvent.lines(documentId, EPipelineStage.NUMBERED, anchored.size(), numbered));

        final List<SearchToken> index = searchIndexBuilder.buildIndex(numbered);
        publish(PipelineEvent.counts(documentId, EPipelineStage.INDEXED, numbered.size(), index.size()));

        log.info("Reconstructed document {}: {} lines, {} searchable tokens", documentId, numbered.size(), index.size());
        return new ReconstructedDocument(documentId, anchorIndex, numbered, index);
    }

    private void publish(final PipelineEvent event) {
        for (final PipelineEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Pipeline listener {} failed on {} event", listener.getClass().getSimpleName(), event.stage(), e);
            }
        }
    }
}
