package eu.virtualparadox.regreader.query.reference;

/**
 * Kind of cross-reference target.
 */
public enum ReferenceType {
    CHAPTER,
    TABLE,
    SECTION,
    ANNOTATION,
    APPENDIX,
    ARTICLE
}
