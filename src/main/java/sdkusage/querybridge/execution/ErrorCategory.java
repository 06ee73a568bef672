package sdkusage.querybridge.execution;

/**
 * Classification of a failed query attempt and what the client may do about it.
 */
public enum ErrorCategory {

    TIMEOUT(true, true),
    CONNECTION(true, true),
    TRANSIENT(true, true),
    SERVER_ERROR(false, true),
    AUTHENTICATION(false, false),
    MALFORMED_STATEMENT(false, false),
    STATEMENT_SAFETY(false, false);

    private final boolean retryable;
    private final boolean fallbackAllowed;

    ErrorCategory(boolean retryable, boolean fallbackAllowed) {
        this.retryable = retryable;
        this.fallbackAllowed = fallbackAllowed;
    }

    /**
     * Another attempt on the same transport may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * The next transport strategy may be tried once this one gives up.
     */
    public boolean isFallbackAllowed() {
        return fallbackAllowed;
    }
}
