package orderbookService;

/**
 * Raised when a snapshot cannot be written to or listed from its store.
 */
public class SnapshotException extends RuntimeException {

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
