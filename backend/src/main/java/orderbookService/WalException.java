package orderbookService;

/**
 * Raised when the write-ahead log cannot durably record or read an entry.
 */
public class WalException extends RuntimeException {

    public WalException(String message) {
        super(message);
    }

    public WalException(String message, Throwable cause) {
        super(message, cause);
    }
}
