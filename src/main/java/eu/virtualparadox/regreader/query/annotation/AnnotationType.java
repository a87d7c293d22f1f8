package eu.virtualparadox.regreader.query.annotation;

import eu.virtualparadox.regreader.util.AnnotationIdNormalizer;

/**
 * Kind of annotation, derived from the prefix of its canonical id.
 */
public enum AnnotationType {

    /** "注1", "注①" */
    NOTE,

    /** "方案A", "方案甲" */
    PLAN,

    OTHER;

    public static AnnotationType of(final String normalizedId) {
        if (normalizedId.startsWith(AnnotationIdNormalizer.PLAN_PREFIX)) {
            return PLAN;
        }
        if (normalizedId.startsWith(AnnotationIdNormalizer.NOTE_PREFIX)) {
            return NOTE;
        }
        return OTHER;
    }
}
