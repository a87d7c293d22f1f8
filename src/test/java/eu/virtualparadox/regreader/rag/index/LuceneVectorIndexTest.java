package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.core.exception.IndexException;
import eu.virtualparadox.regreader.rag.embed.EmbeddingService;
import eu.virtualparadox.regreader.rag.embed.HashingEmbeddingService;
import eu.virtualparadox.regreader.storage.model.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static eu.virtualparadox.regreader.TestPages.REG_ID;
import static eu.virtualparadox.regreader.TestPages.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LuceneVectorIndexTest {

    private ApplicationConfig.Index config;
    private LuceneVectorIndex index;

    @BeforeEach
    void setUp() throws IOException {
        config = new ApplicationConfig.Index();
        config.setStoredContentLength(12);
        index = IndexFixtures.vectorIndex(new HashingEmbeddingService(256), config);
        index.indexBlocks(IndexFixtures.corpus());
    }

    @AfterEach
    void tearDown() {
        index.close();
    }

    @Test
    @DisplayName("The closest block ranks first")
    void testNearest() {
        final List<SearchResult> results = index.search(SearchQuery.builder()
                .query("变压器过载运行").regId(REG_ID).limit(3).build());

        assertEquals("b1", results.get(0).blockId());
        assertEquals(3, results.get(0).pageNum());
        assertThat(results).extracting(SearchResult::regId).containsOnly(REG_ID);
    }

    @Test
    @DisplayName("Blocks shorter than the minimum length are not embedded")
    void testShortBlocksSkipped() {
        final List<SearchResult> results = index.search(SearchQuery.builder()
                .query("见下表").regId(REG_ID).limit(10).build());

        assertThat(results).extracting(SearchResult::blockId).doesNotContain("b4");
        assertEquals(3, results.size());
    }

    @Test
    @DisplayName("Filters are applied inside the nearest neighbour search")
    void testFilter() {
        final List<SearchResult> results = index.search(SearchQuery.builder()
                .query("变压器过载运行").regId(REG_ID).sectionNumber("2").limit(5).build());

        assertThat(results).extracting(SearchResult::blockId).containsExactly("b2");
    }

    @Test
    @DisplayName("Only the configured prefix of the content is stored")
    void testStoredContentLength() {
        final List<SearchResult> results = index.search(SearchQuery.builder()
                .query("母线停电").regId(REG_ID).limit(5).build());

        assertThat(results).allSatisfy(r -> assertTrue(r.snippet().length() <= 12));
    }

    @Test
    @DisplayName("Deleted collections disappear from the results")
    void testDeleteCollection() {
        index.deleteCollection(REG_ID);

        assertTrue(index.search(SearchQuery.builder().query("变压器").regId(REG_ID).limit(5).build()).isEmpty());
        assertEquals(1, index.search(SearchQuery.of("变压器", 5)).size());
    }

    @Test
    @DisplayName("Vectors with the wrong dimension are rejected")
    void testDimensionMismatch() throws IOException {
        final EmbeddingService broken = mock(EmbeddingService.class);
        when(broken.dimension()).thenReturn(8);
        when(broken.embedDocuments(anyList())).thenReturn(List.of(new float[4]));
        when(broken.embedQuery(anyString())).thenReturn(new float[4]);

        try (LuceneVectorIndex brokenIndex = IndexFixtures.vectorIndex(broken, new ApplicationConfig.Index())) {
            final IndexException e = assertThrows(IndexException.class,
                    () -> brokenIndex.indexBlock(REG_ID, 1, text("x", "变压器过载运行规定"), List.of(), null));
            assertEquals("lucene-hnsw", e.getBackend());
            assertThrows(IndexException.class, () -> brokenIndex.search(SearchQuery.of("变压器", 3)));
        }
    }

    @Test
    @DisplayName("Embedding failures surface as index errors")
    void testEmbeddingFailure() throws IOException {
        final EmbeddingService failing = mock(EmbeddingService.class);
        when(failing.dimension()).thenReturn(8);
        when(failing.embedQuery(anyString())).thenThrow(new IllegalStateException("model not loaded"));

        try (LuceneVectorIndex failingIndex = IndexFixtures.vectorIndex(failing, new ApplicationConfig.Index())) {
            final IndexException e = assertThrows(IndexException.class,
                    () -> failingIndex.search(SearchQuery.of("变压器", 3)));
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }
}
