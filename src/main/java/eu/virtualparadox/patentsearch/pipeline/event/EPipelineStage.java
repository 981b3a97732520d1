package eu.virtualparadox.patentsearch.pipeline.event;

public enum EPipelineStage {
    COMBINED,
    ANCHORED,
    COLUMNED,
    MARGIN_SPLIT,
    CLEANED,
    NUMBERED,
    INDEXED
}
