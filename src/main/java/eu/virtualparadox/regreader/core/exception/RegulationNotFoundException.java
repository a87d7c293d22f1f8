package eu.virtualparadox.regreader.core.exception;

public class RegulationNotFoundException extends RegReaderException {

    private final String regId;

    public RegulationNotFoundException(final String regId) {
        super(ErrorKind.REGULATION_NOT_FOUND, "Regulation not found: " + regId);
        this.regId = regId;
    }

    public String getRegId() {
        return regId;
    }
}
