package eu.virtualparadox.regreader.application.config;

import eu.virtualparadox.regreader.rag.embed.EmbeddingService;
import eu.virtualparadox.regreader.rag.index.KeywordIndex;
import eu.virtualparadox.regreader.rag.index.LuceneIndexResources;
import eu.virtualparadox.regreader.rag.index.LuceneKeywordIndex;
import eu.virtualparadox.regreader.rag.index.LuceneVectorIndex;
import eu.virtualparadox.regreader.rag.index.VectorIndex;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.cjk.CJKAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Creates the Lucene search backends.
 * <p>Each backend owns its own index directory under {@code regreader.index-dir}. The backend
 * in use is chosen by {@code regreader.index.keyword-backend} and
 * {@code regreader.index.vector-backend}. Indexes are closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    static final String KEYWORD_DIR = "keyword";
    static final String VECTOR_DIR = "vector";

    private LuceneKeywordIndex keywordIndex;
    private LuceneVectorIndex vectorIndex;

    /**
     * Provides the BM25 keyword backend. Chinese text is tokenized into overlapping bigrams.
     *
     * @param props application configuration
     * @return opened keyword index
     * @throws IOException if the index directory cannot be created or opened
     */
    @Bean(destroyMethod = "")
    @ConditionalOnProperty(prefix = "regreader.index", name = "keyword-backend", havingValue = "lucene", matchIfMissing = true)
    public KeywordIndex keywordIndex(final ApplicationConfig props) throws IOException {
        final Path path = props.getIndexDir().resolve(KEYWORD_DIR);
        this.keywordIndex = new LuceneKeywordIndex(LuceneIndexResources.open(path, new CJKAnalyzer()), props.getIndex());
        log.info("Opened keyword index at {}", path);
        return this.keywordIndex;
    }

    /**
     * Provides the HNSW vector backend.
     *
     * @param props            application configuration
     * @param embeddingService embedder for blocks and queries
     * @return opened vector index
     * @throws IOException if the index directory cannot be created or opened
     */
    @Bean(destroyMethod = "")
    @ConditionalOnProperty(prefix = "regreader.index", name = "vector-backend", havingValue = "lucene-hnsw", matchIfMissing = true)
    public VectorIndex vectorIndex(final ApplicationConfig props, final EmbeddingService embeddingService) throws IOException {
        final Path path = props.getIndexDir().resolve(VECTOR_DIR);
        this.vectorIndex = new LuceneVectorIndex(LuceneIndexResources.open(path, new StandardAnalyzer()),
                embeddingService, props.getIndex());
        log.info("Opened vector index at {} (dimension {})", path, embeddingService.dimension());
        return this.vectorIndex;
    }

    /**
     * Ensures Lucene resources are closed cleanly on shutdown.
     */
    @PreDestroy
    public void close() {
        try { if (keywordIndex != null) keywordIndex.close(); } catch (Exception e) {
            log.error("Unable to close keyword index", e);
        }

        try { if (vectorIndex != null) vectorIndex.close(); } catch (Exception e) {
            log.error("Unable to close vector index", e);
        }
    }
}
