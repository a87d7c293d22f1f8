package eu.virtualparadox.regreader.storage.model;

import java.util.List;

/**
 * One logical table, possibly stitched from segments on consecutive pages.
 *
 * @param tableId        id of the first segment, the master id
 * @param caption        caption of the first segment
 * @param chapterPath    chapter path of the first segment's block
 * @param pageStart      first page
 * @param pageEnd        last page
 * @param crossPage      {@code true} when the table has more than one segment
 * @param segments       segments ordered by segment index
 * @param rowCount       data rows of the stitched table
 * @param colCount       columns
 * @param colHeaders     column headers of the first segment
 * @param mergedMarkdown stitched markdown with exactly one header
 */
public record TableEntry(String tableId,
                         String caption,
                         List<String> chapterPath,
                         int pageStart,
                         int pageEnd,
                         boolean crossPage,
                         List<TableSegment> segments,
                         int rowCount,
                         int colCount,
                         List<String> colHeaders,
                         String mergedMarkdown) {

    public TableEntry {
        chapterPath = chapterPath == null ? List.of() : List.copyOf(chapterPath);
        segments = segments == null ? List.of() : List.copyOf(segments);
        colHeaders = colHeaders == null ? List.of() : List.copyOf(colHeaders);
        mergedMarkdown = mergedMarkdown == null ? "" : mergedMarkdown;
    }
}
