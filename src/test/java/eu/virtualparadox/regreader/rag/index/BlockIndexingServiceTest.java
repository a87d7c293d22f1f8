package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.ingest.structure.DocumentStructureBuilder;
import eu.virtualparadox.regreader.ingest.structure.StructuredDocument;
import eu.virtualparadox.regreader.ingest.table.TableRegistryBuilder;
import eu.virtualparadox.regreader.ingest.table.TableRegistryResult;
import eu.virtualparadox.regreader.query.QueryFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static eu.virtualparadox.regreader.TestPages.REG_ID;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class BlockIndexingServiceTest {

    private static List<IndexedBlock> indexedFixture() {
        final StructuredDocument structured = new DocumentStructureBuilder(new ApplicationConfig())
                .build(REG_ID, QueryFixtures.pages());
        final TableRegistryResult tables = new TableRegistryBuilder().build(REG_ID, structured.pages());
        return BlockIndexingService.toIndexedBlocks(tables.pages(), structured.structure(), tables.registry());
    }

    @Test
    @DisplayName("Every block carries its section number and chapter path")
    void testChapterMetadata() {
        final Map<String, IndexedBlock> byId = indexedFixture().stream()
                .collect(Collectors.toMap(b -> b.block().blockId(), Function.identity()));

        assertEquals(13, byId.size());
        assertEquals("2.1", byId.get("p3_b1").sectionNumber());
        assertEquals(List.of("2 设备管理", "2.1 变压器"), byId.get("p3_b1").chapterPath());
        assertEquals("6", byId.get("p4_b2").sectionNumber());
        assertNull(byId.get("p4_b2").tableId());
    }

    @Test
    @DisplayName("Both segments of a cross-page table point at the master table")
    void testTableIds() {
        final Map<String, IndexedBlock> byId = indexedFixture().stream()
                .collect(Collectors.toMap(b -> b.block().blockId(), Function.identity()));

        assertEquals("tbl_p2_1", byId.get("tbl_p2_1").tableId());
        assertEquals("tbl_p2_1", byId.get("tbl_p3_1").tableId());
        assertEquals(3, byId.get("tbl_p3_1").pageNum());
    }

    @Test
    @DisplayName("Deleting a collection reaches both backends")
    void testDeleteCollection() {
        final KeywordIndex keyword = mock(KeywordIndex.class);
        final VectorIndex vector = mock(VectorIndex.class);
        final BlockIndexingService service = new BlockIndexingService(keyword, vector);

        service.deleteCollection(REG_ID);

        verify(keyword).deleteCollection(REG_ID);
        verify(vector).deleteCollection(REG_ID);
    }

    @Test
    @DisplayName("Indexing feeds the same blocks to both backends")
    void testIndex() {
        final KeywordIndex keyword = mock(KeywordIndex.class);
        final VectorIndex vector = mock(VectorIndex.class);
        final StructuredDocument structured = new DocumentStructureBuilder(new ApplicationConfig())
                .build(REG_ID, QueryFixtures.pages());
        final TableRegistryResult tables = new TableRegistryBuilder().build(REG_ID, structured.pages());

        final int count = new BlockIndexingService(keyword, vector)
                .index(REG_ID, tables.pages(), structured.structure(), tables.registry());

        assertEquals(13, count);
        verify(keyword).indexBlocks(anyList());
        verify(vector).indexBlocks(anyList());
    }
}
