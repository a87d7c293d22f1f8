package eu.virtualparadox.regreader.storage.model;

import java.util.List;

/**
 * Table of contents entry.
 *
 * @param pageEnd page on which the next heading of the same or a higher level begins,
 *                or the last page of the document
 */
public record TocItem(String nodeId,
                      String sectionNumber,
                      String title,
                      int level,
                      int pageStart,
                      int pageEnd,
                      List<TocItem> children) {

    public TocItem {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
