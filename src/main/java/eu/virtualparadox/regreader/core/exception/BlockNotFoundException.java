package eu.virtualparadox.regreader.core.exception;

public class BlockNotFoundException extends RegReaderException {

    private final String regId;
    private final String blockId;

    public BlockNotFoundException(final String regId, final String blockId) {
        super(ErrorKind.BLOCK_NOT_FOUND, "Block not found: " + regId + " " + blockId);
        this.regId = regId;
        this.blockId = blockId;
    }

    public String getRegId() {
        return regId;
    }

    public String getBlockId() {
        return blockId;
    }
}
