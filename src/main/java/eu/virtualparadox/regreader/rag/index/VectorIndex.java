package eu.virtualparadox.regreader.rag.index;

/**
 * Semantic backend, scored by embedding similarity. Blocks too short to embed meaningfully may
 * be skipped at ingestion.
 */
public interface VectorIndex extends BlockIndex {
}
