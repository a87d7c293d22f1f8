package eu.virtualparadox.regreader.query.block;

import eu.virtualparadox.regreader.core.exception.BlockNotFoundException;
import eu.virtualparadox.regreader.storage.PageStore;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads a single block with the blocks around it, the usual follow-up to a search hit whose
 * snippet is too short to answer from.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BlockContextReader {

    public static final int DEFAULT_CONTEXT_BLOCKS = 2;

    private final PageStore pageStore;

    public BlockContext getBlockWithContext(final String regId, final String blockId) {
        return getBlockWithContext(regId, blockId, DEFAULT_CONTEXT_BLOCKS, null);
    }

    /**
     * @param regId         collection id
     * @param blockId       block to read
     * @param contextBlocks neighbours to include on each side, clipped at the page edges
     * @param pageHint      page expected to carry the block, {@code null} to scan all pages
     * @throws BlockNotFoundException if no page of the collection carries the block
     * @throws eu.virtualparadox.regreader.core.exception.RegulationNotFoundException if the
     *                                collection does not exist
     */
    public BlockContext getBlockWithContext(final String regId,
                                            final String blockId,
                                            final int contextBlocks,
                                            final Integer pageHint) {
        if (contextBlocks < 0) {
            throw new IllegalArgumentException("contextBlocks must be >= 0, got " + contextBlocks);
        }
        final List<Integer> pageNumbers = pageStore.pageNumbers(regId);
        if (pageHint != null && pageNumbers.contains(pageHint)) {
            final BlockContext hinted = findOnPage(pageStore.loadPage(regId, pageHint), blockId, contextBlocks);
            if (hinted != null) {
                return hinted;
            }
        }
        for (final int pageNum : pageNumbers) {
            if (pageHint != null && pageNum == pageHint) {
                continue;
            }
            final BlockContext found = findOnPage(pageStore.loadPage(regId, pageNum), blockId, contextBlocks);
            if (found != null) {
                log.debug("Block {} of {} found on P{}", blockId, regId, pageNum);
                return found;
            }
        }
        throw new BlockNotFoundException(regId, blockId);
    }

    private static BlockContext findOnPage(final PageDocument page, final String blockId, final int contextBlocks) {
        final List<ContentBlock> blocks = page.contentBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            final ContentBlock block = blocks.get(i);
            if (!block.blockId().equals(blockId)) {
                continue;
            }
            final List<ContentBlock> before = blocks.subList(Math.max(0, i - contextBlocks), i);
            final List<ContentBlock> after = blocks.subList(i + 1, Math.min(blocks.size(), i + 1 + contextBlocks));
            final List<String> chapterPath = block.chapterPath().isEmpty() ? page.chapterPath() : block.chapterPath();
            return new BlockContext(page.regId(), page.pageNum(), chapterPath, block, before, after);
        }
        return null;
    }
}
