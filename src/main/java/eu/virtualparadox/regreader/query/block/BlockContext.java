package eu.virtualparadox.regreader.query.block;

import eu.virtualparadox.regreader.storage.model.ContentBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * A block together with its neighbours on the same page.
 *
 * @param regId       collection id
 * @param pageNum     page the block is printed on
 * @param chapterPath chapter titles owning the block
 * @param block       the requested block
 * @param before      preceding blocks in reading order, nearest last
 * @param after       following blocks in reading order, nearest first
 */
public record BlockContext(String regId,
                           int pageNum,
                           List<String> chapterPath,
                           ContentBlock block,
                           List<ContentBlock> before,
                           List<ContentBlock> after) {

    public BlockContext {
        chapterPath = chapterPath == null ? List.of() : List.copyOf(chapterPath);
        before = before == null ? List.of() : List.copyOf(before);
        after = after == null ? List.of() : List.copyOf(after);
    }

    /**
     * @return context and block rendered as markdown in reading order
     */
    public String toMarkdown() {
        final List<String> parts = new ArrayList<>();
        before.forEach(b -> parts.add(b.toMarkdown()));
        parts.add(block.toMarkdown());
        after.forEach(b -> parts.add(b.toMarkdown()));
        return String.join("\n\n", parts);
    }

    public String source() {
        return regId + " P" + pageNum;
    }
}
