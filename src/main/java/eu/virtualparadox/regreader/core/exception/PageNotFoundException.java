package eu.virtualparadox.regreader.core.exception;

public class PageNotFoundException extends RegReaderException {

    private final String regId;
    private final int pageNum;

    public PageNotFoundException(final String regId, final int pageNum) {
        super(ErrorKind.PAGE_NOT_FOUND, "Page not found: " + regId + " P" + pageNum);
        this.regId = regId;
        this.pageNum = pageNum;
    }

    public String getRegId() {
        return regId;
    }

    public int getPageNum() {
        return pageNum;
    }
}
