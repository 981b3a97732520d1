package eu.virtualparadox.patentsearch.pipeline.event;

/**
 * Receives per-stage diagnostics of a reconstruction. Implementations must not throw.
 */
@FunctionalInterface
public interface PipelineEventListener {

    void onEvent(final PipelineEvent event);

}
