package eu.virtualparadox.regreader.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for block texts and queries.
 * <p>
 * The dimension is fixed per configured model and must match the vector index.
 */
public interface EmbeddingService {

    /**
     * Embeds the given texts in batch.
     *
     * @param texts texts to embed
     * @return one vector per text, same order
     */
    List<float[]> embedDocuments(List<String> texts);

    /**
     * Embeds a single query string into dense vector space.
     * <p>
     * Used at query time for semantic search.
     *
     * @param text the query string (non-null, non-blank)
     * @return a dense vector representation of the query
     */
    float[] embedQuery(final String text);

    /**
     * @return length of every vector this service produces
     */
    int dimension();
}
