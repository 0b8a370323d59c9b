package dk.cloudcreate.essentials.statebased.store;

/**
 * The document store couldn't perform the requested operation (connection loss, I/O failure, timeouts, ...)
 */
public class DocumentStoreException extends RuntimeException {
    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
