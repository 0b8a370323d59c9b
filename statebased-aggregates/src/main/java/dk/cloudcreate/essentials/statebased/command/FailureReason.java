package dk.cloudcreate.essentials.statebased.command;

/**
 * Why a command failed, with the HTTP-like status code reported for it
 */
public enum FailureReason {
    /**
     * An aggregate refused the state transition or a value object refused its input
     */
    VALIDATION_FAILED(400, false),
    /**
     * The aggregate doesn't exist
     */
    NOT_FOUND(404, false),
    /**
     * An aggregate with the same id already exists
     */
    ALREADY_EXISTS(409, false),
    /**
     * The aggregate was changed by someone else after it was loaded. Safe to retry with a fresh load
     */
    CONCURRENCY_CONFLICT(409, true),
    /**
     * The document store couldn't be reached or failed
     */
    STORAGE_UNAVAILABLE(503, false);

    public final int     statusCode;
    public final boolean retryable;

    FailureReason(int statusCode, boolean retryable) {
        this.statusCode = statusCode;
        this.retryable = retryable;
    }
}
