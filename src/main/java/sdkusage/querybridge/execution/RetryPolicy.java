package sdkusage.querybridge.execution;

/**
 * Bounded retry with a delay that doubles after every failed attempt.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final long initialDelayMs;

    public RetryPolicy(int maxAttempts, long initialDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1000);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    /**
     * Wait before attempt {@code attempt} (1-based): none before the first, then initial, 2x, 4x...
     */
    public long delayBefore(int attempt) {
        if (attempt <= 1) {
            return 0;
        }
        return initialDelayMs << Math.min(attempt - 2, 30);
    }

    public RetryState newState() {
        return new RetryState(this);
    }
}
