package uk.gegc.courseprogress.shared.exception;

/**
 * The durable store failed. Not recovered locally; the caller owns retry and backoff.
 * Every mutating operation is idempotent, so a blind retry is safe.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
