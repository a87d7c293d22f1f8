package eu.virtualparadox.regreader.ingest.structure;

import eu.virtualparadox.regreader.application.config.ApplicationConfig;
import eu.virtualparadox.regreader.storage.model.BlockType;
import eu.virtualparadox.regreader.storage.model.ChapterNode;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.DocumentStructure;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the chapter tree of a regulation in one forward pass over its pages.
 * <p>
 * Text and heading blocks are offered to the {@link HeadingParser}. A recognized heading opens
 * a node; open nodes are kept on a stack of levels, and before a node is pushed every entry
 * with a level greater than or equal to the new one is popped, so the remaining top is the
 * parent. All other blocks are owned by the node on top of the stack. The stack survives page
 * breaks, so a chapter's blocks may span pages.
 * <p>
 * Heading blocks are rewritten to carry only the numbering and title; body text printed on the
 * heading line becomes a separate {@link BlockType#SECTION_CONTENT} block owned by the new node.
 */
@Service
@Slf4j
public class DocumentStructureBuilder {

    static final String SECTION_CONTENT_SUFFIX = "_content";
    private static final String NODE_ID_FORMAT = "ch_%04d";

    private final HeadingParser headingParser;

    public DocumentStructureBuilder(final ApplicationConfig config) {
        this.headingParser = new HeadingParser(
                config.getStructure().getDirectContentThreshold(),
                config.getStructure().getMaxTitleLength());
    }

    /**
     * @param regId collection id
     * @param pages all pages in ascending order
     * @return chapter tree plus the pages with chapter links filled in
     */
    public StructuredDocument build(final String regId, final List<PageDocument> pages) {
        final Map<String, NodeDraft> drafts = new LinkedHashMap<>();
        final List<String> rootIds = new ArrayList<>();
        final Deque<NodeDraft> stack = new ArrayDeque<>();
        final List<PageDocument> linkedPages = new ArrayList<>(pages.size());

        for (final PageDocument page : pages) {
            final List<String> pathAtTop = stack.isEmpty() ? List.of() : stack.peek().path;
            final List<ContentBlock> blocks = new ArrayList<>();
            int order = 0;

            for (final ContentBlock block : page.contentBlocks()) {
                final Optional<ParsedHeading> heading = isHeadingCandidate(block)
                        ? headingParser.parse(block.content())
                        : Optional.empty();

                if (heading.isEmpty()) {
                    final NodeDraft owner = stack.peek();
                    blocks.add(block.toBuilder()
                            .orderInPage(order++)
                            .chapterNodeId(owner == null ? null : owner.nodeId)
                            .chapterPath(owner == null ? List.of() : owner.path)
                            .build());
                    if (owner != null) {
                        owner.contentBlockIds.add(block.blockId());
                    }
                    continue;
                }

                final ParsedHeading parsed = heading.get();
                while (!stack.isEmpty() && stack.peek().level >= parsed.level()) {
                    stack.pop();
                }
                final NodeDraft parent = stack.peek();
                final NodeDraft node = new NodeDraft(
                        String.format(NODE_ID_FORMAT, drafts.size() + 1),
                        sectionNumber(parsed, parent),
                        parsed.title(),
                        parsed.level(),
                        page.pageNum(),
                        parent);
                drafts.put(node.nodeId, node);
                if (parent == null) {
                    rootIds.add(node.nodeId);
                } else {
                    parent.childrenIds.add(node.nodeId);
                }
                stack.push(node);

                blocks.add(block.toBuilder()
                        .blockType(BlockType.HEADING)
                        .content(parsed.headingText())
                        .headingLevel(parsed.level())
                        .orderInPage(order++)
                        .chapterNodeId(node.nodeId)
                        .chapterPath(node.path)
                        .build());

                if (parsed.hasDirectContent()) {
                    final String contentId = block.blockId() + SECTION_CONTENT_SUFFIX;
                    blocks.add(ContentBlock.builder()
                            .blockId(contentId)
                            .blockType(BlockType.SECTION_CONTENT)
                            .content(parsed.directContent())
                            .orderInPage(order++)
                            .chapterNodeId(node.nodeId)
                            .chapterPath(node.path)
                            .build());
                    node.contentBlockIds.add(contentId);
                }
            }

            linkedPages.add(page.toBuilder()
                    .chapterPath(pathAtTop)
                    .contentBlocks(blocks)
                    .build());
        }

        final Map<String, ChapterNode> nodes = new LinkedHashMap<>();
        drafts.values().forEach(d -> nodes.put(d.nodeId, d.freeze()));

        log.info("Built chapter tree of {}: {} nodes, {} roots over {} pages",
                regId, nodes.size(), rootIds.size(), pages.size());
        return new StructuredDocument(new DocumentStructure(regId, nodes, rootIds, pages.size()), linkedPages);
    }

    private static boolean isHeadingCandidate(final ContentBlock block) {
        return block.blockType() == BlockType.TEXT || block.blockType() == BlockType.HEADING;
    }

    /**
     * Dotted numbers are kept as printed. A chapter marker becomes its arabic number; a section
     * marker is numbered below the enclosing chapter when there is one.
     */
    private static String sectionNumber(final ParsedHeading parsed, final NodeDraft parent) {
        switch (parsed.style()) {
            case CHAPTER:
                return Integer.toString(parsed.number());
            case SECTION:
                return parent != null && parent.sectionNumber != null
                        ? parent.sectionNumber + "." + parsed.number()
                        : Integer.toString(parsed.number());
            default:
                return parsed.marker();
        }
    }

    /**
     * Mutable node used while the pass is in progress.
     */
    private static final class NodeDraft {
        private final String nodeId;
        private final String sectionNumber;
        private final String title;
        private final int level;
        private final int pageNum;
        private final String parentId;
        private final List<String> path;
        private final List<String> childrenIds = new ArrayList<>();
        private final List<String> contentBlockIds = new ArrayList<>();

        private NodeDraft(final String nodeId,
                          final String sectionNumber,
                          final String title,
                          final int level,
                          final int pageNum,
                          final NodeDraft parent) {
            this.nodeId = nodeId;
            this.sectionNumber = sectionNumber;
            this.title = title;
            this.level = level;
            this.pageNum = pageNum;
            this.parentId = parent == null ? null : parent.nodeId;

            final List<String> p = new ArrayList<>(parent == null ? List.of() : parent.path);
            p.add(freeze().displayTitle());
            this.path = List.copyOf(p);
        }

        private ChapterNode freeze() {
            return new ChapterNode(nodeId, sectionNumber, title, level, pageNum, parentId,
                    childrenIds, contentBlockIds);
        }
    }
}
