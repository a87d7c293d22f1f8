package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.core.exception.IndexException;
import eu.virtualparadox.regreader.rag.embed.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TopDocs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static eu.virtualparadox.regreader.util.LuceneConstants.*;

/**
 * Semantic backend on the Lucene HNSW k-NN graph.
 * <p>
 * Block texts are embedded in batch through the {@link EmbeddingService} and written as
 * {@link KnnFloatVectorField}s with cosine similarity. Metadata filters are applied inside the
 * k-NN search, so a filtered query still returns up to {@code limit} hits.
 *
 * <p><b>Short blocks:</b> texts shorter than {@code regreader.index.min-vector-content-length}
 * carry too little meaning to embed and are not indexed here; the keyword backend still covers
 * them.</p>
 *
 * <p><b>Stored text:</b> only the first {@code regreader.index.stored-content-length} characters
 * are stored, for snippets. The block id identifies the full source.</p>
 *
 * <p><b>Vector dimensions:</b> Lucene requires a constant dimension per vector field across an
 * index. Every vector is validated against the embedder's dimension; after changing the model,
 * reindex into a fresh index directory.</p>
 */
@Slf4j
public final class LuceneVectorIndex extends LuceneBlockIndex implements VectorIndex {

    static final String NAME = "lucene-hnsw";

    private final EmbeddingService embeddingService;
    private final int minContentLength;
    private final int storedContentLength;
    private final int snippetLength;

    public LuceneVectorIndex(final LuceneIndexResources resources,
                             final EmbeddingService embeddingService,
                             final ApplicationConfig.Index config) {
        super(resources);
        this.embeddingService = embeddingService;
        this.minContentLength = config.getMinVectorContentLength();
        this.storedContentLength = config.getStoredContentLength();
        this.snippetLength = config.getSnippetLength();
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Embeds all eligible blocks of the batch in one call.
     */
    @Override
    protected Map<String, Document> toDocuments(final List<IndexedBlock> blocks) {
        final List<IndexedBlock> eligible = new ArrayList<>();
        for (final IndexedBlock block : blocks) {
            if (embeddable(block)) {
                eligible.add(block);
            }
        }
        if (eligible.size() < blocks.size()) {
            log.debug("[{}] skipping {} blocks shorter than {} characters",
                    NAME, blocks.size() - eligible.size(), minContentLength);
        }
        final Map<String, Document> docs = new LinkedHashMap<>();
        if (eligible.isEmpty()) {
            return docs;
        }

        final List<float[]> vectors;
        try {
            vectors = embeddingService.embedDocuments(eligible.stream().map(b -> b.block().content().strip()).toList());
        } catch (final RuntimeException e) {
            throw new IndexException(NAME, "Embedding failed for " + eligible.size() + " blocks", e);
        }
        if (vectors.size() != eligible.size()) {
            throw new IndexException(NAME, "Embedder returned " + vectors.size() + " vectors for "
                    + eligible.size() + " blocks", null);
        }

        for (int i = 0; i < eligible.size(); i++) {
            final IndexedBlock block = eligible.get(i);
            final float[] vector = vectors.get(i);
            ensureConsistentDimension(vector);

            final Document d = baseDocument(block);
            d.add(new StoredField(FIELD_TEXT, StringUtils.truncate(block.block().content().strip(), storedContentLength)));
            d.add(new KnnFloatVectorField(FIELD_VECTOR, vector, VectorSimilarityFunction.COSINE));
            docs.put(block.uid(), d);
        }
        return docs;
    }

    @Override
    protected TopDocs execute(final IndexSearcher searcher, final SearchQuery query, final Query filter) throws IOException {
        final float[] vector;
        try {
            vector = embeddingService.embedQuery(query.query());
        } catch (final RuntimeException e) {
            throw new IndexException(NAME, "Embedding failed for query: " + query.query(), e);
        }
        ensureConsistentDimension(vector);

        final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, vector, query.limit(), filter);
        final TopDocs topDocs = searcher.search(knn, query.limit());
        log.debug("[{}] '{}' matched {} blocks", NAME, query.query(), topDocs.scoreDocs.length);
        return topDocs;
    }

    @Override
    protected String snippet(final Document doc, final SearchQuery query) {
        return StringUtils.abbreviate(StringUtils.defaultString(doc.get(FIELD_TEXT)), snippetLength);
    }

    private boolean embeddable(final IndexedBlock block) {
        return block.block().content().strip().length() >= minContentLength;
    }

    /**
     * @throws IndexException if the vector does not match the embedder's dimension
     */
    private void ensureConsistentDimension(final float[] vector) {
        final int expected = embeddingService.dimension();
        if (vector == null || vector.length != expected) {
            throw new IndexException(NAME, "Vector dimension mismatch. Expected=" + expected
                    + ", got=" + (vector == null ? "null" : vector.length)
                    + " (reindex into a fresh index if you changed the embedder)", null);
        }
    }
}
