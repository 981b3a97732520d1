package eu.virtualparadox.patentsearch.layout.column;

public enum EColumnStrategy {
    EXTRACTION_ORDER,
    GEOMETRY
}
