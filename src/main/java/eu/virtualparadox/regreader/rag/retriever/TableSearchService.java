package eu.virtualparadox.regreader.rag.retriever;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.rag.index.KeywordIndex;
import eu.virtualparadox.regreader.rag.index.SearchQuery;
import eu.virtualparadox.regreader.rag.index.VectorIndex;
import eu.virtualparadox.regreader.storage.PageStore;
import eu.virtualparadox.regreader.storage.model.BlockType;
import eu.virtualparadox.regreader.storage.model.SearchResult;
import eu.virtualparadox.regreader.storage.model.TableEntry;
import eu.virtualparadox.regreader.storage.model.TableRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Searches logical tables instead of blocks.
 * <p>
 * Both backends are queried for {@code TABLE} blocks only. Every hit is mapped through the
 * collection's table registry to its master table, so a table split over three pages is
 * returned once, at the rank of its best segment. In hybrid mode the two master rankings are
 * fused with {@link ReciprocalRankFuser}; the other modes keep the backend score.
 */
@Service
@Slf4j
public class TableSearchService {

    private final KeywordIndex keywordIndex;
    private final VectorIndex vectorIndex;
    private final PageStore pageStore;
    private final ReciprocalRankFuser fuser;
    private final double keywordWeight;
    private final double vectorWeight;
    private final int candidateMultiplier;
    private final int defaultLimit;

    public TableSearchService(final KeywordIndex keywordIndex,
                              final VectorIndex vectorIndex,
                              final PageStore pageStore,
                              final ApplicationConfig config) {
        final ApplicationConfig.Search search = config.getSearch();
        this.keywordIndex = keywordIndex;
        this.vectorIndex = vectorIndex;
        this.pageStore = pageStore;
        this.fuser = new ReciprocalRankFuser(search.getRrfK());
        this.keywordWeight = search.getKeywordWeight();
        this.vectorWeight = search.getVectorWeight();
        this.candidateMultiplier = Math.max(1, search.getCandidateMultiplier());
        this.defaultLimit = search.getDefaultLimit();
    }

    public List<TableSearchResult> search(final String query, final String regId) {
        return search(SearchQuery.builder().query(query).regId(regId).limit(defaultLimit).build(), TableSearchMode.HYBRID);
    }

    /**
     * @param query text, collection and chapter scope; block type and section filters are replaced
     * @param mode  backends to consult
     * @return logical tables, best first, at most {@code query.limit()}
     * @throws eu.virtualparadox.regreader.core.exception.RegulationNotFoundException if
     *                                    {@code query.regId()} names no stored collection
     */
    public List<TableSearchResult> search(final SearchQuery query, final TableSearchMode mode) {
        final Map<String, Optional<TableRegistry>> registries = new HashMap<>();
        if (query.regId() != null) {
            registries.put(query.regId(), pageStore.loadTableRegistry(query.regId()));
        }

        // several segments of one table may rank, so ask for more candidates than tables wanted
        final SearchQuery candidates = query.toBuilder()
                .blockTypes(Set.of(BlockType.TABLE))
                .sectionNumber(null)
                .limit(query.limit() * candidateMultiplier)
                .build();

        final List<SearchResult> ranked = switch (mode) {
            case KEYWORD -> truncate(toMasters(keywordIndex.search(candidates), registries), query.limit());
            case SEMANTIC -> truncate(toMasters(vectorIndex.search(candidates), registries), query.limit());
            case HYBRID -> fuser.fuse(List.of(
                    new RankedList(keywordIndex.name(), keywordWeight, toMasters(keywordIndex.search(candidates), registries)),
                    new RankedList(vectorIndex.name(), vectorWeight, toMasters(vectorIndex.search(candidates), registries))),
                    query.limit());
        };

        final List<TableSearchResult> results = new ArrayList<>(ranked.size());
        for (final SearchResult hit : ranked) {
            final TableRegistry registry = registries.get(hit.regId()).orElseThrow();
            results.add(new TableSearchResult(hit.regId(), registry.fullTable(hit.blockId()), hit.snippet(), hit.score(), mode));
        }
        log.debug("Table search '{}' ({}): {} tables", query.query(), mode, results.size());
        return results;
    }

    /**
     * Replaces segment hits by hits on their master table, keeping the first (best) occurrence.
     */
    private List<SearchResult> toMasters(final List<SearchResult> hits,
                                         final Map<String, Optional<TableRegistry>> registries) {
        final List<SearchResult> masters = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (final SearchResult hit : hits) {
            final Optional<TableRegistry> registry = registries.computeIfAbsent(hit.regId(), this::registryIfStored);
            final String masterId = registry.map(r -> r.segmentToTable().get(hit.blockId())).orElse(null);
            if (masterId == null) {
                log.debug("Table hit {} of {} has no registry entry, skipped", hit.blockId(), hit.regId());
                continue;
            }
            if (!seen.add(hit.regId() + "/" + masterId)) {
                continue;
            }
            final TableEntry entry = registry.get().fullTable(masterId);
            masters.add(new SearchResult(hit.regId(), entry.pageStart(), entry.chapterPath(), masterId, hit.snippet(), hit.score()));
        }
        return masters;
    }

    private Optional<TableRegistry> registryIfStored(final String regId) {
        return pageStore.exists(regId) ? pageStore.loadTableRegistry(regId) : Optional.empty();
    }

    private static List<SearchResult> truncate(final List<SearchResult> results, final int limit) {
        return results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;
    }
}
