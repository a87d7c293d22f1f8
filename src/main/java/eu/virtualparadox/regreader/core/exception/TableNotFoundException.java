package eu.virtualparadox.regreader.core.exception;

public class TableNotFoundException extends RegReaderException {

    private final String regId;
    private final String tableId;

    public TableNotFoundException(final String regId, final String tableId) {
        super(ErrorKind.TABLE_NOT_FOUND, "Table not found: " + regId + " " + tableId);
        this.regId = regId;
        this.tableId = tableId;
    }

    public String getRegId() {
        return regId;
    }

    public String getTableId() {
        return tableId;
    }
}
