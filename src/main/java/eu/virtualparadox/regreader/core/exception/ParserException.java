package eu.virtualparadox.regreader.core.exception;

/** Raised by the upstream page parser; passed through unchanged by the engine. */
public class ParserException extends RegReaderException {

    public ParserException(final String message) {
        super(ErrorKind.PARSER, message);
    }

    public ParserException(final String message, final Throwable cause) {
        super(ErrorKind.PARSER, message, cause);
    }
}
