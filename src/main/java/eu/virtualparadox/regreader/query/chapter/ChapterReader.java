package eu.virtualparadox.regreader.query.chapter;

import eu.virtualparadox.regreader.core.exception.ChapterNotFoundException;
import eu.virtualparadox.regreader.core.exception.PageNotFoundException;
import eu.virtualparadox.regreader.storage.PageStore;
import eu.virtualparadox.regreader.storage.model.ChapterNode;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.DocumentStructure;
import eu.virtualparadox.regreader.storage.model.TocItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads whole chapters by section number.
 * <p>
 * A chapter owns the blocks between its heading and the next heading. Its pages are scanned
 * from the heading page to the page where the next heading at the same or a higher level
 * begins (the next heading of any level when children are excluded).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChapterReader {

    private final PageStore pageStore;

    /**
     * @throws ChapterNotFoundException if the collection has no structure or no such section
     */
    public ChapterContent readChapter(final String regId, final String sectionNumber, final boolean includeChildren) {
        final DocumentStructure structure = structure(regId, sectionNumber);
        final ChapterNode node = structure.findBySectionNumber(sectionNumber)
                .orElseThrow(() -> new ChapterNotFoundException(regId, sectionNumber));
        return read(structure, node, includeChildren);
    }

    /**
     * @throws ChapterNotFoundException if the collection has no structure
     */
    public List<TocItem> toc(final String regId) {
        return structure(regId, null).toc();
    }

    /**
     * Gathers the blocks of an already resolved node.
     */
    public ChapterContent read(final DocumentStructure structure, final ChapterNode node, final boolean includeChildren) {
        final String regId = structure.regId();
        final Set<String> owners = new HashSet<>();
        owners.add(node.nodeId());
        if (includeChildren) {
            structure.descendants(node.nodeId()).forEach(d -> owners.add(d.nodeId()));
        }

        final int lastPage = lastPage(structure, node, includeChildren);
        final List<String> parts = new ArrayList<>();
        int firstHit = -1;
        int lastHit = node.pageNum();
        for (int pageNum = node.pageNum(); pageNum <= lastPage; pageNum++) {
            final List<ContentBlock> blocks;
            try {
                blocks = pageStore.loadPage(regId, pageNum).contentBlocks();
            } catch (final PageNotFoundException e) {
                log.warn("Page {} P{} missing while reading chapter {}", regId, pageNum, node.sectionNumber());
                continue;
            }
            for (final ContentBlock block : blocks) {
                if (owners.contains(block.chapterNodeId()) && !block.content().isBlank()) {
                    parts.add(block.toMarkdown());
                    firstHit = firstHit < 0 ? pageNum : firstHit;
                    lastHit = pageNum;
                }
            }
        }

        final List<ChapterContent.ChildSummary> children = node.childrenIds().stream()
                .map(structure::node)
                .flatMap(Optional::stream)
                .map(c -> new ChapterContent.ChildSummary(c.sectionNumber(), c.title(), c.pageNum()))
                .toList();

        log.debug("Read chapter {} of {}: {} blocks from P{}-P{}",
                node.sectionNumber(), regId, parts.size(), firstHit, lastHit);
        return new ChapterContent(regId, node.nodeId(), node.sectionNumber(), node.title(),
                structure.chapterPath(node.nodeId()),
                firstHit < 0 ? node.pageNum() : firstHit, lastHit,
                String.join("\n\n", parts), parts.size(), children);
    }

    private DocumentStructure structure(final String regId, final String sectionNumber) {
        return pageStore.loadDocumentStructure(regId)
                .orElseThrow(() -> new ChapterNotFoundException(regId, sectionNumber));
    }

    private static int lastPage(final DocumentStructure structure, final ChapterNode node, final boolean includeChildren) {
        final List<ChapterNode> ordered = structure.preOrder();
        final int index = ordered.indexOf(node);
        for (int i = index + 1; i < ordered.size(); i++) {
            final ChapterNode next = ordered.get(i);
            if (!includeChildren || next.level() <= node.level()) {
                return Math.max(node.pageNum(), next.pageNum());
            }
        }
        return Math.max(node.pageNum(), structure.totalPages());
    }
}
