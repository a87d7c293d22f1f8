package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.storage.model.ChapterNode;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.DocumentStructure;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.storage.model.TableRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Feeds every content block of a regulation, enriched with chapter and table metadata, into
 * both search backends.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BlockIndexingService {

    private final KeywordIndex keywordIndex;
    private final VectorIndex vectorIndex;

    /**
     * @param regId     collection id
     * @param pages     pages linked to the chapter tree and table registry
     * @param structure chapter tree
     * @param registry  table registry
     * @return number of blocks offered to the backends
     */
    public int index(final String regId,
                     final List<PageDocument> pages,
                     final DocumentStructure structure,
                     final TableRegistry registry) {
        final List<IndexedBlock> blocks = toIndexedBlocks(pages, structure, registry);

        keywordIndex.indexBlocks(blocks);
        log.info("Indexed {} blocks of {} into {}", blocks.size(), regId, keywordIndex.name());

        vectorIndex.indexBlocks(blocks);
        log.info("Indexed {} blocks of {} into {}", blocks.size(), regId, vectorIndex.name());

        return blocks.size();
    }

    public void deleteCollection(final String regId) {
        keywordIndex.deleteCollection(regId);
        vectorIndex.deleteCollection(regId);
        log.info("Deleted index entries of {}", regId);
    }

    static List<IndexedBlock> toIndexedBlocks(final List<PageDocument> pages,
                                              final DocumentStructure structure,
                                              final TableRegistry registry) {
        final List<IndexedBlock> blocks = new ArrayList<>();
        for (final PageDocument page : pages) {
            for (final ContentBlock block : page.contentBlocks()) {
                final List<String> chapterPath = block.chapterPath().isEmpty() ? page.chapterPath() : block.chapterPath();
                final String sectionNumber = structure.node(block.chapterNodeId())
                        .map(ChapterNode::sectionNumber)
                        .orElse(null);
                final String tableId = block.tableBlock()
                        ? registry.segmentToTable().get(block.blockId())
                        : null;
                blocks.add(new IndexedBlock(page.regId(), page.pageNum(), block, chapterPath, tableId, sectionNumber));
            }
        }
        return blocks;
    }
}
