package eu.virtualparadox.regreader.core.exception;

/**
 * A free-text reference could not be parsed, or its target does not exist.
 */
public class ReferenceResolutionException extends RegReaderException {

    private final String referenceText;
    private final String reason;

    public ReferenceResolutionException(final String referenceText, final String reason) {
        super(ErrorKind.REFERENCE_RESOLUTION, "Cannot resolve reference '" + referenceText + "': " + reason);
        this.referenceText = referenceText;
        this.reason = reason;
    }

    public ReferenceResolutionException(final String referenceText, final String reason, final Throwable cause) {
        super(ErrorKind.REFERENCE_RESOLUTION, "Cannot resolve reference '" + referenceText + "': " + reason, cause);
        this.referenceText = referenceText;
        this.reason = reason;
    }

    public String getReferenceText() {
        return referenceText;
    }

    public String getReason() {
        return reason;
    }
}
