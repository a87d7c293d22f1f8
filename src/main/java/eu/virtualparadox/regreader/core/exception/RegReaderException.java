package eu.virtualparadox.regreader.core.exception;

/**
 * Base type of all engine errors.
 * <p>
 * Subclasses carry the structured identifiers (regulation id, page numbers, offending text)
 * a caller needs to render a precise message; {@link #getKind()} allows a single switch over
 * every failure mode.
 */
public abstract class RegReaderException extends RuntimeException {

    private final ErrorKind kind;

    protected RegReaderException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    protected RegReaderException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
