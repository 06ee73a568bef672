package sdkusage.querybridge.execution;

/**
 * Failure of one query attempt, carrying its {@link ErrorCategory}.
 */
public class QueryExecutionException extends RuntimeException {

    private final ErrorCategory category;

    public QueryExecutionException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public QueryExecutionException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * Wrap any failure, classifying it by its message when it is not already categorized.
     */
    public static QueryExecutionException from(Throwable failure) {
        if (failure instanceof QueryExecutionException) {
            return (QueryExecutionException) failure;
        }
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return new QueryExecutionException(SqlErrorClassifier.classifyMessage(message), message, failure);
    }
}
