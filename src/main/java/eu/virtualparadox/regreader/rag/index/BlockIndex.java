package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.core.exception.IndexException;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.SearchResult;

import java.util.List;

/**
 * Common contract of the search backends.
 * <p>
 * Implementations ingest content blocks with their chapter and table metadata and answer
 * ranked queries. Backends are selected by configuration and are interchangeable for callers.
 * All failures surface as {@link IndexException}.
 */
public interface BlockIndex {

    /**
     * @return backend name used in logs and errors
     */
    String name();

    /**
     * Adds or replaces blocks. A block is identified by {@code (regId, blockId)}; indexing it
     * again replaces the earlier entry. Changes are visible to search when the call returns.
     *
     * @param blocks blocks to index
     */
    void indexBlocks(List<IndexedBlock> blocks);

    default void indexBlock(final String regId,
                            final int pageNum,
                            final ContentBlock block,
                            final List<String> chapterPath,
                            final String tableId) {
        indexBlocks(List.of(new IndexedBlock(regId, pageNum, block, chapterPath, tableId, null)));
    }

    /**
     * @param query text and filters
     * @return up to {@code query.limit()} results, best first, scored by this backend
     */
    List<SearchResult> search(SearchQuery query);

    /**
     * Removes every entry of a collection. Deleting an unknown collection is a no-op.
     */
    void deleteCollection(String regId);
}
