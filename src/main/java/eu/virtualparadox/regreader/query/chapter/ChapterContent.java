package eu.virtualparadox.regreader.query.chapter;

import java.util.List;

/**
 * Content of one chapter gathered across pages.
 *
 * @param regId           collection id
 * @param nodeId          chapter node id
 * @param sectionNumber   section number of the chapter
 * @param title           chapter title
 * @param chapterPath     titles from the root down to the chapter
 * @param pageStart       first page with content of the chapter
 * @param pageEnd         last page with content of the chapter
 * @param contentMarkdown blocks rendered as markdown in reading order
 * @param blockCount      number of blocks gathered
 * @param children        direct sub-chapters
 */
public record ChapterContent(String regId,
                             String nodeId,
                             String sectionNumber,
                             String title,
                             List<String> chapterPath,
                             int pageStart,
                             int pageEnd,
                             String contentMarkdown,
                             int blockCount,
                             List<ChildSummary> children) {

    public ChapterContent {
        chapterPath = chapterPath == null ? List.of() : List.copyOf(chapterPath);
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * @return citation of the form {@code regId P12} or {@code regId P12-15}
     */
    public String source() {
        return pageStart == pageEnd
                ? regId + " P" + pageStart
                : regId + " P" + pageStart + "-" + pageEnd;
    }

    public record ChildSummary(String sectionNumber, String title, int pageNum) {
    }
}
