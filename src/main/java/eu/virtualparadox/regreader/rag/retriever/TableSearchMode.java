package eu.virtualparadox.regreader.rag.retriever;

/**
 * Backends consulted by a table search.
 */
public enum TableSearchMode {
    KEYWORD,
    SEMANTIC,
    HYBRID
}
