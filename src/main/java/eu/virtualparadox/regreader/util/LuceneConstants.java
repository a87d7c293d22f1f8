package eu.virtualparadox.regreader.util;

public class LuceneConstants {
    /** Unique per indexed block: {@code regId/blockId}. Used for upserts. */
    public static final String FIELD_UID = "uid";
    public static final String FIELD_REG_ID = "regId";
    public static final String FIELD_BLOCK_ID = "blockId";
    public static final String FIELD_BLOCK_TYPE = "blockType";
    public static final String FIELD_PAGE_NUM = "pageNum";
    public static final String FIELD_CHAPTER_PATH = "chapterPath";
    public static final String FIELD_SECTION_NUMBER = "sectionNumber";
    public static final String FIELD_TABLE_ID = "tableId";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_VECTOR = "vector";

    /** Separator used to flatten the chapter path into one stored value. */
    public static final String CHAPTER_PATH_SEPARATOR = " > ";

    private LuceneConstants() {
        // prevent instantiation
    }
}
