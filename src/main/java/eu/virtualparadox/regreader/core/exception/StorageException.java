package eu.virtualparadox.regreader.core.exception;

/** I/O failure while reading or writing stored artifacts. */
public class StorageException extends RegReaderException {

    public StorageException(final String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(final String message, final Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
