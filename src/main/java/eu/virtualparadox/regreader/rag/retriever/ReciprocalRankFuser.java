package eu.virtualparadox.regreader.rag.retriever;

import eu.virtualparadox.regreader.storage.model.SearchResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted Reciprocal Rank Fusion.
 * <p>
 * Every result is keyed by {@code (regId, pageNum, blockId)}. Its fused score is
 * {@code Σ weight / (k + rank + 1)} over the lists it appears in, with {@code rank} 0-based.
 * Results are ordered by fused score, then by page number, then by block id, which makes the
 * output a pure function of the input lists.
 */
@Slf4j
public final class ReciprocalRankFuser {

    private static final Comparator<SearchResult> FUSED_ORDER =
            Comparator.comparingDouble(SearchResult::score).reversed()
                    .thenComparingInt(SearchResult::pageNum)
                    .thenComparing(SearchResult::blockId, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(SearchResult::regId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final int k;

    /**
     * @param k damping constant, larger values flatten the difference between top ranks
     */
    public ReciprocalRankFuser(final int k) {
        if (k < 0) {
            throw new IllegalArgumentException("RRF constant must be >= 0, got " + k);
        }
        this.k = k;
    }

    /**
     * @param lists per-backend rankings
     * @param limit maximum number of fused results
     * @return fused results carrying their fused score, best first
     */
    public List<SearchResult> fuse(final List<RankedList> lists, final int limit) {
        final Map<SearchResult.Key, Double> scores = new LinkedHashMap<>();
        final Map<SearchResult.Key, SearchResult> representatives = new LinkedHashMap<>();

        for (final RankedList list : lists) {
            // a key listed twice by one backend counts at its best rank only
            final Set<SearchResult.Key> seen = new HashSet<>();
            final List<SearchResult> results = list.results();
            for (int rank = 0; rank < results.size(); rank++) {
                final SearchResult result = results.get(rank);
                final SearchResult.Key key = result.key();
                if (key.blockId() == null) {
                    log.warn("[RRF] {}[{}] has null blockId, all such results collapse to one key", list.source(), rank);
                }
                if (!seen.add(key)) {
                    continue;
                }
                scores.merge(key, list.weight() / (k + rank + 1), Double::sum);
                representatives.putIfAbsent(key, result);
            }
        }

        final List<SearchResult> fused = new ArrayList<>(scores.size());
        scores.forEach((key, score) -> fused.add(representatives.get(key).withScore(score)));
        fused.sort(FUSED_ORDER);

        log.debug("[RRF] {} lists, {} unique keys, returning {}", lists.size(), fused.size(), Math.min(limit, fused.size()));
        return fused.size() > limit ? List.copyOf(fused.subList(0, limit)) : List.copyOf(fused);
    }
}
