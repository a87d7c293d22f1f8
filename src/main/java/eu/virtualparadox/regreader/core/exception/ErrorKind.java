package eu.virtualparadox.regreader.core.exception;

/**
 * Discriminator for every failure mode the engine reports.
 */
public enum ErrorKind {
    PARSER,
    STORAGE,
    REGULATION_NOT_FOUND,
    PAGE_NOT_FOUND,
    INVALID_PAGE_RANGE,
    CHAPTER_NOT_FOUND,
    ANNOTATION_NOT_FOUND,
    TABLE_NOT_FOUND,
    BLOCK_NOT_FOUND,
    REFERENCE_RESOLUTION,
    INDEX
}
