package eu.virtualparadox.regreader.core.exception;

public class InvalidPageRangeException extends RegReaderException {

    private final int startPage;
    private final int endPage;

    public InvalidPageRangeException(final int startPage, final int endPage) {
        super(ErrorKind.INVALID_PAGE_RANGE, "Invalid page range: " + startPage + "-" + endPage);
        this.startPage = startPage;
        this.endPage = endPage;
    }

    public int getStartPage() {
        return startPage;
    }

    public int getEndPage() {
        return endPage;
    }
}
