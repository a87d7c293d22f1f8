package eu.virtualparadox.regreader.storage.model;

import lombok.Builder;

import java.util.List;

/**
 * Structural description of one table block.
 *
 * @param tableId       id of this segment
 * @param caption       caption text, may be {@code null}
 * @param truncated     the table is cut off at the bottom of the page
 * @param rowCount      number of rows in this segment
 * @param colCount      number of columns
 * @param colHeaders    column header texts
 * @param rowHeaders    row header texts
 * @param cells         cell grid
 * @param masterTableId id of the first segment; set on continuation segments only
 * @param segmentIndex  position of this segment within its logical table, {@code 0} for the first
 */
@Builder(toBuilder = true)
public record TableMeta(String tableId,
                        String caption,
                        boolean truncated,
                        int rowCount,
                        int colCount,
                        List<String> colHeaders,
                        List<String> rowHeaders,
                        List<TableCell> cells,
                        String masterTableId,
                        int segmentIndex) {

    public TableMeta {
        colHeaders = colHeaders == null ? List.of() : List.copyOf(colHeaders);
        rowHeaders = rowHeaders == null ? List.of() : List.copyOf(rowHeaders);
        cells = cells == null ? List.of() : List.copyOf(cells);
    }
}
