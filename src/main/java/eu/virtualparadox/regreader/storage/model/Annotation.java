package eu.virtualparadox.regreader.storage.model;

import eu.virtualparadox.regreader.util.AnnotationIdNormalizer;

import java.util.List;

/**
 * Footnote-style note printed on a page ("注1", "方案A").
 *
 * @param annotationId  id as printed
 * @param normalizedId  canonical id, always derived from {@code annotationId}
 * @param content       note text
 * @param pageNum       page the note is printed on
 * @param relatedBlocks blocks that reference the note
 */
public record Annotation(String annotationId,
                         String normalizedId,
                         String content,
                         int pageNum,
                         List<String> relatedBlocks) {

    public Annotation {
        if (annotationId == null || annotationId.isBlank()) {
            throw new IllegalArgumentException("annotationId must not be blank");
        }
        normalizedId = AnnotationIdNormalizer.normalize(annotationId);
        content = content == null ? "" : content;
        relatedBlocks = relatedBlocks == null ? List.of() : List.copyOf(relatedBlocks);
    }

    public static Annotation of(final String annotationId, final String content, final int pageNum) {
        return new Annotation(annotationId, null, content, pageNum, List.of());
    }

    public String toMarkdown() {
        return "**" + annotationId + "**: " + content;
    }
}
