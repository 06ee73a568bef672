package sdkusage.querybridge.execution;

/**
 * Attempt bookkeeping for one transport within one execute() call.
 */
public class RetryState {

    private final RetryPolicy policy;
    private int attempt;
    private ErrorCategory lastCategory;
    private String lastMessage;

    RetryState(RetryPolicy policy) {
        this.policy = policy;
    }

    /**
     * Start the next attempt and return its 1-based number.
     */
    public int beginAttempt() {
        return ++attempt;
    }

    public void recordFailure(QueryExecutionException failure) {
        this.lastCategory = failure.getCategory();
        this.lastMessage = failure.getMessage();
    }

    /**
     * True when the last failure is retryable and attempts remain.
     */
    public boolean canRetry() {
        return lastCategory != null && lastCategory.isRetryable() && attempt < policy.getMaxAttempts();
    }

    public long nextDelayMs() {
        return policy.delayBefore(attempt + 1);
    }

    public int getAttempt() {
        return attempt;
    }

    public ErrorCategory getLastCategory() {
        return lastCategory;
    }

    public String getLastMessage() {
        return lastMessage;
    }
}
