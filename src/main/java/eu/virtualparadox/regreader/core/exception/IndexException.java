package eu.virtualparadox.regreader.core.exception;

/** Failure while ingesting into or querying a search backend. */
public class IndexException extends RegReaderException {

    private final String backend;

    public IndexException(final String backend, final String message, final Throwable cause) {
        super(ErrorKind.INDEX, "[" + backend + "] " + message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
