package eu.virtualparadox.regreader.storage.model;

/**
 * @param row     0-based row index within the segment
 * @param col     0-based column index
 * @param content cell text
 * @param rowSpan number of rows covered, at least 1
 * @param colSpan number of columns covered, at least 1
 */
public record TableCell(int row, int col, String content, int rowSpan, int colSpan) {

    public TableCell {
        rowSpan = Math.max(1, rowSpan);
        colSpan = Math.max(1, colSpan);
    }
}
