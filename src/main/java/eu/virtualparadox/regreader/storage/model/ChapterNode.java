package eu.virtualparadox.regreader.storage.model;

import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * One heading of the chapter tree. Links to parent and children are ids into the owning
 * {@link DocumentStructure}.
 *
 * @param nodeId          id, unique within the structure
 * @param sectionNumber   normalized numbering, e.g. {@code 2.1.4}; CJK chapter markers are
 *                        converted to arabic numbers
 * @param title           heading text without the number, may be empty
 * @param level           depth, {@code 1} for top-level chapters
 * @param pageNum         page the heading is printed on
 * @param parentId        parent node id, {@code null} for roots
 * @param childrenIds     direct children in document order
 * @param contentBlockIds blocks owned by this node, across pages, in reading order
 */
public record ChapterNode(String nodeId,
                          String sectionNumber,
                          String title,
                          int level,
                          int pageNum,
                          String parentId,
                          List<String> childrenIds,
                          List<String> contentBlockIds) {

    public ChapterNode {
        title = title == null ? "" : title;
        childrenIds = childrenIds == null ? List.of() : List.copyOf(childrenIds);
        contentBlockIds = contentBlockIds == null ? List.of() : List.copyOf(contentBlockIds);
    }

    /**
     * @return number and title as shown in chapter paths, e.g. {@code 2.1 总则}
     */
    public String displayTitle() {
        return StringUtils.normalizeSpace(StringUtils.defaultString(sectionNumber) + " " + title);
    }
}
