package eu.virtualparadox.regreader.ingest.structure;

/**
 * A text line recognized as a chapter heading.
 *
 * @param marker        numbering as printed, e.g. {@code 2.1.4} or {@code 第六章}
 * @param number        arabic number of a CJK marker, {@code -1} for dotted numbering
 * @param style         numbering style
 * @param level         depth derived from the numbering
 * @param title         short title, may be empty
 * @param directContent body text printed after the title, may be empty
 */
public record ParsedHeading(String marker,
                            int number,
                            NumberingStyle style,
                            int level,
                            String title,
                            String directContent) {

    public enum NumberingStyle {
        /** {@code 2.1.4}, level is the dot count plus one. */
        DOTTED,
        /** {@code 第六章}, always level 1. */
        CHAPTER,
        /** {@code 第二节}, always level 2. */
        SECTION
    }

    /**
     * @return heading line without the direct content
     */
    public String headingText() {
        return title.isEmpty() ? marker : marker + " " + title;
    }

    public boolean hasDirectContent() {
        return !directContent.isEmpty();
    }
}
