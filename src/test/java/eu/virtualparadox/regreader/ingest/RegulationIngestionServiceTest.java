package eu.virtualparadox.regreader.ingest;

import eu.virtualparadox.regreader.TestPages;
import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.application.executor.IngestionExecutor;
import eu.virtualparadox.regreader.core.exception.IndexException;
import eu.virtualparadox.regreader.ingest.structure.DocumentStructureBuilder;
import eu.virtualparadox.regreader.ingest.table.TableRegistryBuilder;
import eu.virtualparadox.regreader.query.QueryFixtures;
import eu.virtualparadox.regreader.rag.embed.HashingEmbeddingService;
import eu.virtualparadox.regreader.rag.index.BlockIndexingService;
import eu.virtualparadox.regreader.rag.index.IndexFixtures;
import eu.virtualparadox.regreader.rag.index.LuceneKeywordIndex;
import eu.virtualparadox.regreader.rag.index.LuceneVectorIndex;
import eu.virtualparadox.regreader.rag.index.SearchQuery;
import eu.virtualparadox.regreader.storage.PageStore;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.storage.model.RegulationInfo;
import eu.virtualparadox.regreader.storage.model.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static eu.virtualparadox.regreader.TestPages.REG_ID;
import static eu.virtualparadox.regreader.TestPages.page;
import static eu.virtualparadox.regreader.TestPages.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RegulationIngestionServiceTest {

    @TempDir
    Path tempDir;

    private ApplicationConfig config;
    private PageStore pageStore;
    private LuceneKeywordIndex keywordIndex;
    private LuceneVectorIndex vectorIndex;
    private IngestionExecutor executor;
    private RegulationIngestionService service;

    @BeforeEach
    void setUp() throws Exception {
        config = TestPages.config(tempDir);
        pageStore = new PageStore(config, TestPages.objectMapper());
        keywordIndex = IndexFixtures.keywordIndex();
        vectorIndex = IndexFixtures.vectorIndex(new HashingEmbeddingService(64), config.getIndex());

        executor = new IngestionExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("ingest-test-");
        executor.initialize();

        service = newService(new BlockIndexingService(keywordIndex, vectorIndex));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        keywordIndex.close();
        vectorIndex.close();
    }

    private RegulationIngestionService newService(final BlockIndexingService indexingService) {
        return new RegulationIngestionService(pageStore, new DocumentStructureBuilder(config),
                new TableRegistryBuilder(), indexingService, executor);
    }

    private static SearchQuery query(final String text) {
        return SearchQuery.builder().query(text).regId(REG_ID).limit(5).build();
    }

    private static IngestionRequest request(final List<PageDocument> pages) {
        return new IngestionRequest(REG_ID, "调度规程", "dispatch.pdf", pages);
    }

    @Test
    @DisplayName("Ingestion stores pages and artifacts and feeds both indexes")
    void testIngest() {
        final IngestionResult result = service.ingest(request(QueryFixtures.pages()));

        assertEquals(REG_ID, result.regId());
        assertEquals(4, result.pages());
        assertEquals(5, result.chapters());
        assertEquals(1, result.tables());
        assertEquals(1, result.crossPageTables());
        assertEquals(13, result.indexedBlocks());

        final RegulationInfo info = pageStore.loadInfo(REG_ID).orElseThrow();
        assertEquals("调度规程", info.title());
        assertEquals(4, info.totalPages());
        assertTrue(pageStore.loadDocumentStructure(REG_ID).isPresent());
        assertTrue(pageStore.getTableById(REG_ID, "tbl_p3_1").crossPage());

        final List<SearchResult> hits = keywordIndex.search(query("变压器过载"));
        final SearchResult overload = hits.stream().filter(h -> "p3_b1".equals(h.blockId())).findFirst().orElseThrow();
        assertEquals(3, overload.pageNum());
        assertEquals(List.of("2 设备管理", "2.1 变压器"), overload.chapterPath());
        assertFalse(vectorIndex.search(query("变压器过载")).isEmpty());
    }

    @Test
    @DisplayName("Pages must be numbered without gaps and repeat no block id")
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> service.ingest(request(List.of(page(1, text("a", "甲")), page(3, text("b", "乙"))))));
        assertThrows(IllegalArgumentException.class,
                () -> service.ingest(request(List.of(page(1, text("a", "甲")), page(2, text("a", "乙"))))));
        assertThrows(IllegalArgumentException.class, () -> service.ingest(request(List.of())));
        assertFalse(pageStore.exists(REG_ID));
    }

    @Test
    @DisplayName("Unordered pages are accepted and sorted")
    void testUnorderedPages() {
        final IngestionResult result = service.ingest(request(List.of(
                page(2, text("b", "第二页的正文内容较长一些")),
                page(1, text("a", "第一页的正文内容较长一些")))));

        assertEquals(2, result.pages());
        assertEquals(List.of(1, 2), pageStore.pageNumbers(REG_ID));
    }

    @Test
    @DisplayName("Re-ingesting replaces the previous collection")
    void testReingest() {
        service.ingest(request(QueryFixtures.pages()));
        final IngestionResult result = service.ingest(request(List.of(
                page(1, text("n1", "新版规程只有一页，内容为母线检修要求。")))));

        assertEquals(1, result.pages());
        assertEquals(List.of(1), pageStore.pageNumbers(REG_ID));
        assertTrue(keywordIndex.search(query("变压器过载")).isEmpty());
        assertThat(keywordIndex.search(query("母线检修")))
                .extracting(SearchResult::blockId).containsExactly("n1");
    }

    @Test
    @DisplayName("A failing index step removes everything stored so far")
    void testCleanupOnFailure() {
        final BlockIndexingService failing = mock(BlockIndexingService.class);
        final IndexException failure = new IndexException("lucene", "disk full", null);
        doThrow(failure).when(failing).index(eq(REG_ID), anyList(), any(), any());
        final RegulationIngestionService broken = newService(failing);

        final IndexException thrown = assertThrows(IndexException.class,
                () -> broken.ingest(request(QueryFixtures.pages())));

        assertSame(failure, thrown);
        assertFalse(pageStore.exists(REG_ID));
        verify(failing).deleteCollection(REG_ID);
    }

    @Test
    @DisplayName("Asynchronous ingestion completes on the ingestion executor")
    void testIngestAsync() throws Exception {
        final IngestionResult result = service.ingestAsync(request(QueryFixtures.pages())).get(30, TimeUnit.SECONDS);

        assertEquals(13, result.indexedBlocks());
        assertTrue(pageStore.exists(REG_ID));
    }

    @Test
    @DisplayName("Deleting a collection clears the store and both indexes")
    void testDeleteCollection() {
        service.ingest(request(QueryFixtures.pages()));

        assertTrue(service.deleteCollection(REG_ID));
        assertFalse(pageStore.exists(REG_ID));
        assertTrue(keywordIndex.search(query("变压器")).isEmpty());
        assertTrue(vectorIndex.search(query("变压器")).isEmpty());
        assertFalse(service.deleteCollection(REG_ID));
    }
}
