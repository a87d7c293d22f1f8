package eu.virtualparadox.regreader.query.block;

import eu.virtualparadox.regreader.core.exception.BlockNotFoundException;
import eu.virtualparadox.regreader.core.exception.ErrorKind;
import eu.virtualparadox.regreader.core.exception.RegulationNotFoundException;
import eu.virtualparadox.regreader.query.QueryFixtures;
import eu.virtualparadox.regreader.storage.model.BlockType;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static eu.virtualparadox.regreader.TestPages.REG_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BlockContextReaderTest {

    @TempDir
    Path tempDir;

    private BlockContextReader reader;

    @BeforeEach
    void setUp() {
        reader = new BlockContextReader(QueryFixtures.store(tempDir));
    }

    @Test
    @DisplayName("Neighbours on both sides are returned in reading order")
    void testContext() {
        final BlockContext context = reader.getBlockWithContext(REG_ID, "p1_b3", 1, null);

        assertEquals(1, context.pageNum());
        assertEquals("p1_b3", context.block().blockId());
        assertThat(context.before()).extracting(ContentBlock::blockId).containsExactly("p1_b2");
        assertThat(context.after()).extracting(ContentBlock::blockId).containsExactly("p1_b4");
        assertThat(context.toMarkdown())
                .startsWith("本规程适用于省级及以上电网调度机构。")
                .endsWith("各级调度机构的运行值班工作，详见表2-1。");
        assertEquals(REG_ID + " P1", context.source());
    }

    @Test
    @DisplayName("Context is clipped at the page edges")
    void testClippedAtPageEdges() {
        final BlockContext first = reader.getBlockWithContext(REG_ID, "p1_b1");

        assertTrue(first.before().isEmpty());
        assertThat(first.after()).extracting(ContentBlock::blockId).containsExactly("p1_b2", "p1_b3");

        final BlockContext last = reader.getBlockWithContext(REG_ID, "p3_b1", 5, null);
        assertEquals(3, last.pageNum());
        assertThat(last.before()).extracting(ContentBlock::blockType).containsExactly(BlockType.TABLE);
        assertTrue(last.after().isEmpty());
        assertEquals(List.of("2 设备管理", "2.1 变压器"), last.chapterPath());
    }

    @Test
    @DisplayName("A wrong page hint falls back to scanning every page")
    void testWrongPageHint() {
        final BlockContext context = reader.getBlockWithContext(REG_ID, "p4_b2", 0, 1);

        assertEquals(4, context.pageNum());
        assertTrue(context.before().isEmpty());
        assertTrue(context.after().isEmpty());
        assertEquals("第十条 本规程自发布之日起施行。", context.toMarkdown());
    }

    @Test
    @DisplayName("Unknown blocks, unknown collections and negative context fail")
    void testFailures() {
        final BlockNotFoundException missing = assertThrows(BlockNotFoundException.class,
                () -> reader.getBlockWithContext(REG_ID, "p9_b9"));
        assertEquals(ErrorKind.BLOCK_NOT_FOUND, missing.getKind());
        assertEquals("p9_b9", missing.getBlockId());

        assertThrows(RegulationNotFoundException.class, () -> reader.getBlockWithContext("missing", "p1_b1"));
        assertThrows(IllegalArgumentException.class, () -> reader.getBlockWithContext(REG_ID, "p1_b1", -1, null));
    }
}
