package eu.virtualparadox.regreader.storage.model;

import java.util.List;

/**
 * Merged view over a page range.
 *
 * @param startPage       first page requested
 * @param endPage         last page covered, after capping
 * @param contentMarkdown page contents with cross-page tables stitched in place
 * @param pages           pages actually loaded
 * @param hasMergedTables at least one table was stitched across pages
 * @param continuesToNext the last loaded page has a table that continues beyond the range
 */
public record PageContent(String regId,
                          int startPage,
                          int endPage,
                          String contentMarkdown,
                          List<PageDocument> pages,
                          boolean hasMergedTables,
                          boolean continuesToNext) {

    public PageContent {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }
}
