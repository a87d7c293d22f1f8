package eu.virtualparadox.regreader.storage.model;

import lombok.Builder;

import java.util.List;

/**
 * Smallest addressable unit of a page.
 *
 * @param blockId       unique within the collection
 * @param blockType     kind of block
 * @param content       text or markdown
 * @param orderInPage   0-based reading order on the page
 * @param tableMeta     table structure, {@code TABLE} blocks only
 * @param chapterNodeId owning chapter node, assigned by the structure builder
 * @param headingLevel  heading depth, {@code HEADING} blocks only
 * @param chapterPath   titles from the root chapter down to the owning node
 */
@Builder(toBuilder = true)
public record ContentBlock(String blockId,
                           BlockType blockType,
                           String content,
                           int orderInPage,
                           TableMeta tableMeta,
                           String chapterNodeId,
                           Integer headingLevel,
                           List<String> chapterPath) {

    public ContentBlock {
        if (blockId == null || blockId.isBlank()) {
            throw new IllegalArgumentException("blockId must not be blank");
        }
        if (blockType == null) {
            throw new IllegalArgumentException("blockType must not be null for block " + blockId);
        }
        content = content == null ? "" : content;
        chapterPath = chapterPath == null ? List.of() : List.copyOf(chapterPath);
    }

    public boolean tableBlock() {
        return blockType == BlockType.TABLE;
    }

    /**
     * @return block rendered as markdown; headings get {@code #} markers by level
     */
    public String toMarkdown() {
        if (blockType == BlockType.HEADING) {
            final int level = headingLevel == null ? 1 : Math.min(6, Math.max(1, headingLevel));
            return "#".repeat(level) + " " + content;
        }
        return content;
    }
}
