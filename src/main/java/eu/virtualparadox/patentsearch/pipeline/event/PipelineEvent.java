package eu.virtualparadox.patentsearch.pipeline.event;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;

import java.util.List;

/**
 * Emitted once per stage of a reconstruction.
 *
 * @param documentId  document being reconstructed
 * @param stage       stage that just completed
 * @param inputCount  number of items the stage consumed
 * @param outputCount number of items the stage produced (for {@link EPipelineStage#ANCHORED}, the anchor index)
 * @param lines       stage output when it is a line list, otherwise empty
 */
public record PipelineEvent(String documentId,
                            EPipelineStage stage,
                            int inputCount,
                            int outputCount,
                            List<AnchoredLine> lines) {

    public static PipelineEvent counts(final String documentId, final EPipelineStage stage,
                                       final int inputCount, final int outputCount) {
        return new PipelineEvent(documentId, stage, inputCount, outputCount, List.of());
    }

    public static PipelineEvent lines(final String documentId, final EPipelineStage stage,
                                      final int inputCount, final List<AnchoredLine> lines) {
        return new PipelineEvent(documentId, stage, inputCount, lines.size(), List.copyOf(lines));
    }
}
