package eu.virtualparadox.regreader.storage.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * One physical page of a regulation, the unit of storage.
 *
 * @param regId             collection id
 * @param pageNum           1-based page number
 * @param chapterPath       chapter titles active at the top of the page
 * @param contentBlocks     blocks in reading order
 * @param continuesFromPrev the first table on this page continues a table from the previous page
 * @param continuesToNext   a truncated table on this page continues on the next page
 * @param annotations       notes printed on this page
 */
@Builder(toBuilder = true)
public record PageDocument(String regId,
                           int pageNum,
                           List<String> chapterPath,
                           List<ContentBlock> contentBlocks,
                           boolean continuesFromPrev,
                           boolean continuesToNext,
                           List<Annotation> annotations) {

    public PageDocument {
        if (regId == null || regId.isBlank()) {
            throw new IllegalArgumentException("regId must not be blank");
        }
        if (pageNum < 1) {
            throw new IllegalArgumentException("pageNum must be >= 1, got " + pageNum);
        }
        chapterPath = chapterPath == null ? List.of() : List.copyOf(chapterPath);
        contentBlocks = contentBlocks == null ? List.of() : List.copyOf(contentBlocks);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    /**
     * @return page content as markdown, notes appended after a rule
     */
    public String toMarkdown() {
        final List<String> parts = new ArrayList<>();
        for (final ContentBlock block : contentBlocks) {
            parts.add(block.toMarkdown());
        }
        final String annotationSection = annotationsMarkdown();
        if (!annotationSection.isEmpty()) {
            parts.add(annotationSection);
        }
        return String.join("\n\n", parts);
    }

    /**
     * @return the notes block of {@link #toMarkdown()}, empty when the page has no notes
     */
    public String annotationsMarkdown() {
        if (annotations.isEmpty()) {
            return "";
        }
        final List<String> lines = new ArrayList<>();
        lines.add("---");
        for (final Annotation annotation : annotations) {
            lines.add(annotation.toMarkdown());
        }
        return String.join("\n\n", lines);
    }
}
