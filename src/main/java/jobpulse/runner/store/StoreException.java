package jobpulse.runner.store;

/**
 * Unchecked wrapper for persistence failures (pool, schema, SQL).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
