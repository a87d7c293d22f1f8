package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.storage.model.BlockType;
import eu.virtualparadox.regreader.storage.model.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static eu.virtualparadox.regreader.TestPages.REG_ID;
import static eu.virtualparadox.regreader.TestPages.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LuceneKeywordIndexTest {

    private LuceneKeywordIndex index;

    @BeforeEach
    void setUp() throws IOException {
        index = IndexFixtures.keywordIndex();
        index.indexBlocks(IndexFixtures.corpus());
    }

    @AfterEach
    void tearDown() {
        index.close();
    }

    private List<SearchResult> search(final SearchQuery.SearchQueryBuilder query) {
        return index.search(query.limit(10).build());
    }

    @Test
    @DisplayName("Chinese terms match through bigrams")
    void testMatch() {
        final List<SearchResult> results = search(SearchQuery.builder().query("变压器").regId(REG_ID));

        assertThat(results).extracting(SearchResult::blockId).containsExactlyInAnyOrder("b1", "t1");
        final SearchResult b1 = results.stream().filter(r -> r.blockId().equals("b1")).findFirst().orElseThrow();
        assertEquals(3, b1.pageNum());
        assertEquals(IndexFixtures.DEVICE_PATH, b1.chapterPath());
        assertTrue(b1.score() > 0);
    }

    @Test
    @DisplayName("Without a collection filter every collection is searched")
    void testAllCollections() {
        assertThat(search(SearchQuery.builder().query("变压器")))
                .extracting(SearchResult::regId)
                .contains(REG_ID, "other_reg");
    }

    @Test
    @DisplayName("Block type, section and chapter filters narrow the hits")
    void testFilters() {
        assertThat(search(SearchQuery.builder().query("变压器").regId(REG_ID).blockTypes(Set.of(BlockType.TABLE))))
                .extracting(SearchResult::blockId).containsExactly("t1");

        assertThat(search(SearchQuery.builder().query("安全措施").regId(REG_ID).sectionNumber("1.2")))
                .isEmpty();

        assertThat(search(SearchQuery.builder().query("操作").chapterScope("运行管理")))
                .extracting(SearchResult::blockId).containsExactly("b2");
        assertThat(search(SearchQuery.builder().query("变压器").chapterScope("运行管理")))
                .isEmpty();
    }

    @Test
    @DisplayName("Reindexing a block replaces the earlier entry")
    void testUpsert() {
        index.indexBlock(REG_ID, 3, text("b1", "断路器检修规定"), IndexFixtures.DEVICE_PATH, null);

        assertThat(search(SearchQuery.builder().query("断路器").regId(REG_ID)))
                .extracting(SearchResult::blockId).containsExactly("b1");
        assertThat(search(SearchQuery.builder().query("过载").regId(REG_ID))).isEmpty();
    }

    @Test
    @DisplayName("Operators typed by the user are taken literally")
    void testEscaping() {
        assertDoesNotThrow(() -> search(SearchQuery.builder().query("变压器 (母线 \"")));
        assertTrue(search(SearchQuery.builder().query("？？")).isEmpty());
    }

    @Test
    @DisplayName("Limit caps the number of results")
    void testLimit() {
        assertEquals(1, index.search(SearchQuery.builder().query("变压器").limit(1).build()).size());
    }

    @Test
    @DisplayName("Deleting a collection leaves the others intact")
    void testDeleteCollection() {
        index.deleteCollection(REG_ID);

        assertTrue(search(SearchQuery.builder().query("变压器").regId(REG_ID)).isEmpty());
        assertEquals(1, search(SearchQuery.builder().query("变压器").regId("other_reg")).size());
        assertDoesNotThrow(() -> index.deleteCollection("never_indexed"));
    }

    @Test
    @DisplayName("Long content is cut around the first query term")
    void testSnippet() {
        final String filler = "电网调度运行规定正文内容".repeat(30);
        index.indexBlock(REG_ID, 9, text("long", filler + "继电保护定值" + filler), List.of(), null);

        final SearchResult result = search(SearchQuery.builder().query("继电保护").regId(REG_ID)).get(0);

        assertEquals("long", result.blockId());
        assertTrue(result.snippet().contains("继电保护"));
        assertTrue(result.snippet().startsWith("..."));
        assertTrue(result.snippet().length() <= 200 + 6);
    }
}
