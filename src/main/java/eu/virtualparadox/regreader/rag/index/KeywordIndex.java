package eu.virtualparadox.regreader.rag.index;

/**
 * Lexical backend, scored by term statistics.
 */
public interface KeywordIndex extends BlockIndex {
}
