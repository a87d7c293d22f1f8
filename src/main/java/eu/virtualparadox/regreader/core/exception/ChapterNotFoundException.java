package eu.virtualparadox.regreader.core.exception;

public class ChapterNotFoundException extends RegReaderException {

    private final String regId;
    private final String sectionNumber;

    public ChapterNotFoundException(final String regId, final String sectionNumber) {
        super(ErrorKind.CHAPTER_NOT_FOUND, "Chapter not found: " + regId + " " + sectionNumber);
        this.regId = regId;
        this.sectionNumber = sectionNumber;
    }

    public String getRegId() {
        return regId;
    }

    public String getSectionNumber() {
        return sectionNumber;
    }
}
