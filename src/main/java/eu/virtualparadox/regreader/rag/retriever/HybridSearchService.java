package eu.virtualparadox.regreader.rag.retriever;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.rag.index.KeywordIndex;
import eu.virtualparadox.regreader.rag.index.SearchQuery;
import eu.virtualparadox.regreader.rag.index.VectorIndex;
import eu.virtualparadox.regreader.storage.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hybrid retriever: lexical BM25 search and semantic k-NN search, fused with weighted
 * Reciprocal Rank Fusion.
 * <p>
 * Steps:
 * <ol>
 *   <li>Run the query against the keyword backend</li>
 *   <li>Run the same query, with the same filters, against the vector backend</li>
 *   <li>Fuse both rankings with {@link ReciprocalRankFuser}</li>
 *   <li>Return the top {@code limit} results</li>
 * </ol>
 * A failing backend fails the search; partial results are never returned silently.
 */
@Service
@Slf4j
public class HybridSearchService {

    private final KeywordIndex keywordIndex;
    private final VectorIndex vectorIndex;
    private final ReciprocalRankFuser fuser;
    private final double keywordWeight;
    private final double vectorWeight;
    private final int candidateMultiplier;
    private final int defaultLimit;

    public HybridSearchService(final KeywordIndex keywordIndex,
                               final VectorIndex vectorIndex,
                               final ApplicationConfig config) {
        final ApplicationConfig.Search search = config.getSearch();
        if (search.getKeywordWeight() < 0 || search.getVectorWeight() < 0
                || search.getKeywordWeight() + search.getVectorWeight() <= 0) {
            throw new IllegalArgumentException("Search weights must be non-negative with a positive sum");
        }
        if (search.getCandidateMultiplier() < 1 || search.getDefaultLimit() < 1) {
            throw new IllegalArgumentException("regreader.search.candidate-multiplier and default-limit must be >= 1");
        }
        this.keywordIndex = keywordIndex;
        this.vectorIndex = vectorIndex;
        this.fuser = new ReciprocalRankFuser(search.getRrfK());
        this.keywordWeight = search.getKeywordWeight();
        this.vectorWeight = search.getVectorWeight();
        this.candidateMultiplier = search.getCandidateMultiplier();
        this.defaultLimit = search.getDefaultLimit();
    }

    /**
     * Searches one collection with the configured default limit.
     */
    public List<SearchResult> search(final String query, final String regId) {
        return search(SearchQuery.builder().query(query).regId(regId).limit(defaultLimit).build());
    }

    /**
     * @param query text, filters and limit
     * @return fused results, best first, at most {@code query.limit()}
     */
    public List<SearchResult> search(final SearchQuery query) {
        final SearchQuery candidates = query.withLimit(query.limit() * candidateMultiplier);

        final List<SearchResult> keywordResults = keywordIndex.search(candidates);
        final List<SearchResult> vectorResults = vectorIndex.search(candidates);
        log.debug("Hybrid search '{}': {} keyword hits, {} vector hits",
                query.query(), keywordResults.size(), vectorResults.size());

        return fuser.fuse(List.of(
                new RankedList(keywordIndex.name(), keywordWeight, keywordResults),
                new RankedList(vectorIndex.name(), vectorWeight, vectorResults)), query.limit());
    }
}
