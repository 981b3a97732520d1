package eu.virtualparadox.patentsearch.layout.anchor;

public enum EAnchorStrategy {
    HEADER,
    DENSITY,
    SHEET_MARKER
}
