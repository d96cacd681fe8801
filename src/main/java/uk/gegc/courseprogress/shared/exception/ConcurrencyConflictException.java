package uk.gegc.courseprogress.shared.exception;

/**
 * Write conflict that persisted through every local retry. Transient; the caller may retry later.
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final int attempts;

    public ConcurrencyConflictException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
