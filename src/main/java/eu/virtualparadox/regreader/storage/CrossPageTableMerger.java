package eu.virtualparadox.regreader.storage;

import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.util.MarkdownTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders consecutive pages as one markdown document, stitching tables that were split at
 * page breaks.
 * <p>
 * A table opens when its page has {@code continuesToNext} and the block is flagged truncated.
 * On the following page, if {@code continuesFromPrev} is set, the first table block is the
 * continuation: its header rows are dropped and its data rows appended. The stitched table is
 * written where the first segment stood.
 */
@Slf4j
public final class CrossPageTableMerger {

    static final String PAGE_MARKER_FORMAT = "<!-- Page %d -->";

    /**
     * @param markdown        merged markdown
     * @param hasMergedTables whether any continuation was stitched
     */
    public record MergedPages(String markdown, boolean hasMergedTables) {
    }

    /**
     * @param pages pages in ascending page order, gaps allowed
     * @return merged markdown
     */
    public MergedPages merge(final List<PageDocument> pages) {
        final List<String> parts = new ArrayList<>();
        boolean merged = false;

        List<String> pendingRows = null;
        int pendingSlot = -1;
        int previousPage = -1;

        for (final PageDocument page : pages) {
            parts.add(String.format(PAGE_MARKER_FORMAT, page.pageNum()));

            final boolean adjacent = previousPage >= 0 && page.pageNum() == previousPage + 1;
            final int continuationIdx = pendingRows != null && adjacent && page.continuesFromPrev()
                    ? firstTableIndex(page.contentBlocks())
                    : -1;

            if (pendingRows != null && continuationIdx < 0) {
                log.warn("Table opened before {} P{} has no continuation, emitting it as is",
                        page.regId(), page.pageNum());
                parts.set(pendingSlot, String.join("\n", pendingRows));
                pendingRows = null;
            }

            final int openIdx = page.continuesToNext() ? lastTruncatedTableIndex(page.contentBlocks()) : -1;
            final List<ContentBlock> blocks = page.contentBlocks();

            for (int i = 0; i < blocks.size(); i++) {
                final ContentBlock block = blocks.get(i);
                if (i == continuationIdx) {
                    pendingRows.addAll(MarkdownTable.dataRows(block.content()));
                    merged = true;
                    if (i != openIdx) {
                        parts.set(pendingSlot, String.join("\n", pendingRows));
                        pendingRows = null;
                    }
                } else if (i == openIdx) {
                    // slot is filled once the table is complete
                    pendingRows = new ArrayList<>(MarkdownTable.rows(block.content()));
                    pendingSlot = parts.size();
                    parts.add("");
                } else {
                    parts.add(block.toMarkdown());
                }
            }

            final String notes = page.annotationsMarkdown();
            if (!notes.isEmpty()) {
                parts.add(notes);
            }
            previousPage = page.pageNum();
        }

        if (pendingRows != null) {
            parts.set(pendingSlot, String.join("\n", pendingRows));
        }

        return new MergedPages(String.join("\n\n", parts), merged);
    }

    private static int firstTableIndex(final List<ContentBlock> blocks) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).tableBlock()) {
                return i;
            }
        }
        return -1;
    }

    private static int lastTruncatedTableIndex(final List<ContentBlock> blocks) {
        for (int i = blocks.size() - 1; i >= 0; i--) {
            final ContentBlock block = blocks.get(i);
            if (block.tableBlock() && block.tableMeta() != null && block.tableMeta().truncated()) {
                return i;
            }
        }
        return -1;
    }
}
