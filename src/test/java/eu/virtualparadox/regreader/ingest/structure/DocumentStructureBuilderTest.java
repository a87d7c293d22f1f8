package eu.virtualparadox.regreader.ingest.structure;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.storage.model.BlockType;
import eu.virtualparadox.regreader.storage.model.ChapterNode;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.DocumentStructure;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.storage.model.TocItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eu.virtualparadox.regreader.TestPages.REG_ID;
import static eu.virtualparadox.regreader.TestPages.heading;
import static eu.virtualparadox.regreader.TestPages.page;
import static eu.virtualparadox.regreader.TestPages.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentStructureBuilderTest {

    private final DocumentStructureBuilder builder = new DocumentStructureBuilder(new ApplicationConfig());

    private static List<PageDocument> pages() {
        return List.of(
                page(1,
                        heading("b1", "第一章 总则"),
                        text("b2", "本规程适用于省级及以上电网调度机构。"),
                        text("b3", "1.1 适用范围"),
                        text("b4", "1.1.1 一般规定")),
                page(2,
                        text("b5", "续上页的规定内容。"),
                        text("b6", "1.2 调度管理"),
                        text("b7", "第二章 运行管理"),
                        text("b8", "运行值班人员应服从调度指令。")));
    }

    private static ChapterNode node(final DocumentStructure structure, final String sectionNumber) {
        return structure.findBySectionNumber(sectionNumber).orElseThrow();
    }

    @Test
    @DisplayName("Heading levels 1,2,3,2,1 produce two roots with nested children")
    void testTreeShape() {
        final DocumentStructure structure = builder.build(REG_ID, pages()).structure();

        assertEquals(5, structure.allNodes().size());
        assertEquals(2, structure.rootNodeIds().size());
        assertThat(structure.preOrder()).extracting(ChapterNode::sectionNumber)
                .containsExactly("1", "1.1", "1.1.1", "1.2", "2");

        final ChapterNode chapterOne = node(structure, "1");
        assertEquals(List.of(node(structure, "1.1").nodeId(), node(structure, "1.2").nodeId()), chapterOne.childrenIds());
        assertEquals(node(structure, "1.1").nodeId(), node(structure, "1.1.1").parentId());
        assertNull(node(structure, "2").parentId());
    }

    @Test
    @DisplayName("Parent and child links agree for every node")
    void testLinksConsistent() {
        final DocumentStructure structure = builder.build(REG_ID, pages()).structure();

        for (final ChapterNode node : structure.allNodes().values()) {
            for (final String childId : node.childrenIds()) {
                assertEquals(node.nodeId(), structure.node(childId).orElseThrow().parentId());
            }
            if (node.parentId() != null) {
                assertTrue(structure.node(node.parentId()).orElseThrow().childrenIds().contains(node.nodeId()));
            } else {
                assertTrue(structure.rootNodeIds().contains(node.nodeId()));
            }
        }
    }

    @Test
    @DisplayName("Blocks are owned by the open node, across page breaks")
    void testBlockOwnership() {
        final StructuredDocument result = builder.build(REG_ID, pages());
        final DocumentStructure structure = result.structure();

        final ContentBlock b2 = result.pages().get(0).contentBlocks().get(1);
        assertEquals(node(structure, "1").nodeId(), b2.chapterNodeId());
        assertEquals(List.of("1 总则"), b2.chapterPath());

        final PageDocument second = result.pages().get(1);
        final ContentBlock b5 = second.contentBlocks().get(0);
        assertEquals(node(structure, "1.1.1").nodeId(), b5.chapterNodeId());
        assertEquals(List.of("1 总则", "1.1 适用范围", "1.1.1 一般规定"), second.chapterPath());
        assertTrue(node(structure, "1.1.1").contentBlockIds().contains("b5"));
    }

    @Test
    @DisplayName("Heading blocks are rewritten with level and node link")
    void testHeadingRewrite() {
        final StructuredDocument result = builder.build(REG_ID, pages());
        final ContentBlock b6 = result.pages().get(1).contentBlocks().get(1);

        assertEquals(BlockType.HEADING, b6.blockType());
        assertEquals(Integer.valueOf(2), b6.headingLevel());
        assertEquals("1.2 调度管理", b6.content());
        assertEquals(List.of(0, 1, 2, 3), result.pages().get(1).contentBlocks().stream().map(ContentBlock::orderInPage).toList());
    }

    @Test
    @DisplayName("Body text on a heading line becomes section content")
    void testSectionContent() {
        final String body = "各单位应当严格执行调度指令并及时汇报设备运行情况。".repeat(3);
        final StructuredDocument result = builder.build(REG_ID, List.of(page(1, text("h1", "2.3 操作要求，" + body))));

        final List<ContentBlock> blocks = result.pages().get(0).contentBlocks();
        assertEquals(2, blocks.size());
        assertEquals("2.3 操作要求", blocks.get(0).content());
        assertEquals(BlockType.SECTION_CONTENT, blocks.get(1).blockType());
        assertEquals("h1_content", blocks.get(1).blockId());
        assertEquals(body, blocks.get(1).content());

        final ChapterNode node = result.structure().findBySectionNumber("2.3").orElseThrow();
        assertEquals(List.of("h1_content"), node.contentBlockIds());
    }

    @Test
    @DisplayName("A sentence opening with a voltage value stays in the open section")
    void testValueSentenceIsNotHeading() {
        final StructuredDocument result = builder.build(REG_ID, List.of(page(1,
                text("a", "2.1 线路运行"),
                text("b", "500 千伏及以上变电站的运行维护由省调负责"),
                text("c", "线路巡视周期为一个月。"))));

        final DocumentStructure structure = result.structure();
        assertEquals(1, structure.allNodes().size());
        final ChapterNode section = node(structure, "2.1");
        assertEquals(List.of("b", "c"), section.contentBlockIds());
        assertThat(result.pages().get(0).contentBlocks())
                .extracting(ContentBlock::chapterNodeId)
                .containsOnly(section.nodeId());
    }

    @Test
    @DisplayName("Glued numbering opens chapters like spaced numbering")
    void testGluedNumbering() {
        final DocumentStructure structure = builder.build(REG_ID, List.of(page(1,
                text("a", "1.总则"),
                text("b", "2.调度范围"),
                text("c", "2.1.线路"),
                text("d", "220 千伏线路由地调负责。")))).structure();

        assertThat(structure.preOrder()).extracting(ChapterNode::sectionNumber)
                .containsExactly("1", "2", "2.1");
        assertEquals(node(structure, "2").nodeId(), node(structure, "2.1").parentId());
        assertEquals(List.of("d"), node(structure, "2.1").contentBlockIds());
    }

    @Test
    @DisplayName("A section marker is numbered below its chapter")
    void testSectionMarker() {
        final DocumentStructure structure = builder.build(REG_ID, List.of(
                page(1, text("a", "第三章 电网运行"), text("b", "第二节 频率调整")))).structure();

        final ChapterNode section = node(structure, "3.2");
        assertEquals(2, section.level());
        assertEquals(node(structure, "3").nodeId(), section.parentId());
    }

    @Test
    @DisplayName("A document without headings has an empty tree and unowned blocks")
    void testNoHeadings() {
        final StructuredDocument result = builder.build(REG_ID, List.of(page(1, text("a", "正文。"), text("b", "更多正文。"))));

        assertTrue(result.structure().allNodes().isEmpty());
        assertTrue(result.structure().rootNodeIds().isEmpty());
        assertNull(result.pages().get(0).contentBlocks().get(0).chapterNodeId());
        assertTrue(result.pages().get(0).chapterPath().isEmpty());
    }

    @Test
    @DisplayName("Table of contents spans each chapter up to the next sibling")
    void testToc() {
        final List<TocItem> toc = builder.build(REG_ID, pages()).structure().toc();

        assertEquals(2, toc.size());
        assertEquals(1, toc.get(0).pageStart());
        assertEquals(2, toc.get(0).pageEnd());
        assertEquals(2, toc.get(0).children().size());
        assertEquals("1.1.1", toc.get(0).children().get(0).children().get(0).sectionNumber());
        assertEquals(2, toc.get(1).pageEnd());
    }
}
