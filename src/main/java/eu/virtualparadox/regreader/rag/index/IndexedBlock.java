package eu.virtualparadox.regreader.rag.index;

import eu.virtualparadox.regreader.storage.model.ContentBlock;

import java.util.List;

/**
 * A content block together with the metadata the indexes store next to it.
 *
 * @param regId         collection id
 * @param pageNum       page the block is printed on
 * @param block         the block
 * @param chapterPath   chapter titles owning the block
 * @param tableId       master table id for table blocks, may be {@code null}
 * @param sectionNumber section number of the owning chapter, may be {@code null}
 */
public record IndexedBlock(String regId,
                           int pageNum,
                           ContentBlock block,
                           List<String> chapterPath,
                           String tableId,
                           String sectionNumber) {

    public IndexedBlock {
        if (regId == null || regId.isBlank()) {
            throw new IllegalArgumentException("regId must not be blank");
        }
        if (block == null) {
            throw new IllegalArgumentException("block must not be null");
        }
        chapterPath = chapterPath == null ? List.of() : List.copyOf(chapterPath);
    }

    /**
     * @return collection-wide unique key of the block
     */
    public String uid() {
        return regId + "/" + block.blockId();
    }
}
