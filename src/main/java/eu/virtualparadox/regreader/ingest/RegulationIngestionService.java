package eu.virtualparadox.regreader.ingest;

import eu.virtualparadox.regreader.application.executor.IngestionExecutor;
import eu.virtualparadox.regreader.ingest.structure.DocumentStructureBuilder;
import eu.virtualparadox.regreader.ingest.structure.StructuredDocument;
import eu.virtualparadox.regreader.ingest.table.TableRegistryBuilder;
import eu.virtualparadox.regreader.ingest.table.TableRegistryResult;
import eu.virtualparadox.regreader.rag.index.BlockIndexingService;
import eu.virtualparadox.regreader.storage.PageStore;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.DocumentStructure;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.storage.model.TableRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages the full lifecycle of a regulation collection:
 * <ul>
 *   <li>Chapter tree and table registry, built from the parsed pages</li>
 *   <li>Page storage (filesystem)</li>
 *   <li>Keyword and vector indexes (Lucene)</li>
 * </ul>
 * Re-ingesting a collection replaces it. If any step fails, everything stored for the
 * collection so far is removed and the failure is rethrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RegulationIngestionService {

    private final PageStore pageStore;
    private final DocumentStructureBuilder structureBuilder;
    private final TableRegistryBuilder tableRegistryBuilder;
    private final BlockIndexingService indexingService;
    private final IngestionExecutor ingestionExecutor;

    private final Set<String> inProgress = ConcurrentHashMap.newKeySet();

    /**
     * Stores and indexes a regulation.
     *
     * @throws IllegalArgumentException if the pages are not numbered 1..n, belong to another
     *                                  collection or repeat a block id
     * @throws IllegalStateException    if the same collection is already being ingested
     */
    public IngestionResult ingest(final IngestionRequest request) {
        final String regId = request.regId();
        final List<PageDocument> pages = validatedPages(request);

        if (!inProgress.add(regId)) {
            throw new IllegalStateException("Collection " + regId + " is already being ingested");
        }
        try {
            if (pageStore.exists(regId)) {
                log.info("Collection {} exists, replacing it", regId);
                deleteCollection(regId);
            }
            return run(request, pages);
        } catch (final RuntimeException e) {
            log.error("Ingestion of {} failed, cleaning up", regId, e);
            try {
                deleteCollection(regId);
            } catch (final RuntimeException cleanupEx) {
                log.error("Cleanup failed for {}", regId, cleanupEx);
                e.addSuppressed(cleanupEx);
            }
            throw e;
        } finally {
            inProgress.remove(regId);
        }
    }

    /**
     * Queues {@link #ingest(IngestionRequest)} on the ingestion executor.
     */
    public CompletableFuture<IngestionResult> ingestAsync(final IngestionRequest request) {
        log.info("Queued ingestion of {} ({} pages)", request.regId(), request.pages().size());
        return ingestionExecutor.submitCompletable(() -> ingest(request));
    }

    /**
     * Deletes stored pages, artifacts and index entries of a collection.
     *
     * @return {@code true} if stored pages existed
     */
    public boolean deleteCollection(final String regId) {
        final boolean existed = pageStore.deleteCollection(regId);
        indexingService.deleteCollection(regId);
        log.info("Deleted collection {} from page store and indexes", regId);
        return existed;
    }

    private IngestionResult run(final IngestionRequest request, final List<PageDocument> input) {
        final String regId = request.regId();
        log.info("Ingestion of {} started ({} pages)", regId, input.size());

        // 1. Chapter tree
        final StructuredDocument structured = structureBuilder.build(regId, input);
        final DocumentStructure structure = structured.structure();

        // 2. Table registry
        final TableRegistryResult tables = tableRegistryBuilder.build(regId, structured.pages());
        final TableRegistry registry = tables.registry();
        final List<PageDocument> pages = tables.pages();

        // 3. Pages and artifacts
        pageStore.savePages(regId, pages, structure, registry, request.title(), request.sourceFile());

        // 4. Indexes
        final int indexed = indexingService.index(regId, pages, structure, registry);

        log.info("Ingestion of {} completed: {} pages, {} chapters, {} tables ({} cross-page), {} blocks indexed",
                regId, pages.size(), structure.allNodes().size(), registry.totalTables(),
                registry.crossPageTables(), indexed);
        return new IngestionResult(regId, pages.size(), structure.allNodes().size(),
                registry.totalTables(), registry.crossPageTables(), indexed);
    }

    private static List<PageDocument> validatedPages(final IngestionRequest request) {
        final List<PageDocument> pages = new ArrayList<>(request.pages());
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("Collection " + request.regId() + " has no pages");
        }
        pages.sort(Comparator.comparingInt(PageDocument::pageNum));

        final Set<String> blockIds = new HashSet<>();
        for (int i = 0; i < pages.size(); i++) {
            final PageDocument page = pages.get(i);
            if (!request.regId().equals(page.regId())) {
                throw new IllegalArgumentException("Page P" + page.pageNum() + " belongs to "
                        + page.regId() + ", not " + request.regId());
            }
            if (page.pageNum() != i + 1) {
                throw new IllegalArgumentException("Pages of " + request.regId()
                        + " must be numbered 1.." + pages.size() + " without gaps, found P" + page.pageNum()
                        + " at position " + (i + 1));
            }
            for (final ContentBlock block : page.contentBlocks()) {
                if (!blockIds.add(block.blockId())) {
                    throw new IllegalArgumentException("Duplicate block id " + block.blockId()
                            + " on P" + page.pageNum() + " of " + request.regId());
                }
            }
        }
        return pages;
    }
}
