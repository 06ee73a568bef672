package sdkusage.querybridge.execution;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps SQL Server, HTTP and generic failures onto {@link ErrorCategory}.
 */
public final class SqlErrorClassifier {

    /** Azure SQL error numbers documented as transient. */
    private static final Set<Integer> TRANSIENT_ERROR_CODES =
        Set.of(4221, 10928, 10929, 40197, 40501, 40540, 40613, 49918, 49919, 49920);
    private static final Set<Integer> AUTHENTICATION_ERROR_CODES = Set.of(18456, 18488, 33155, 33134);
    private static final Set<Integer> MALFORMED_ERROR_CODES = Set.of(102, 105, 156, 207, 208, 4104, 8120);

    private static final List<String> AUTHENTICATION_HINTS =
        List.of("login failed", "access token", "unauthorized", "forbidden", "authentication");
    private static final List<String> TIMEOUT_HINTS = List.of("timeout", "timed out");
    private static final List<String> CONNECTION_HINTS = List.of("connection", "network", "reset", "refused", "unreachable");
    private static final List<String> TRANSIENT_HINTS = List.of("transient", "temporary", "temporarily", "throttl");

    private SqlErrorClassifier() {
    }

    public static ErrorCategory classify(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return ErrorCategory.TIMEOUT;
        }
        int code = e.getErrorCode();
        if (AUTHENTICATION_ERROR_CODES.contains(code) || "28000".equals(e.getSQLState())) {
            return ErrorCategory.AUTHENTICATION;
        }
        if (TRANSIENT_ERROR_CODES.contains(code)) {
            return ErrorCategory.TRANSIENT;
        }
        if (MALFORMED_ERROR_CODES.contains(code) || (e.getSQLState() != null && e.getSQLState().startsWith("42"))) {
            return ErrorCategory.MALFORMED_STATEMENT;
        }
        if (e.getSQLState() != null && e.getSQLState().startsWith("08")) {
            ErrorCategory byMessage = classifyMessage(e.getMessage());
            return byMessage == ErrorCategory.SERVER_ERROR ? ErrorCategory.CONNECTION : byMessage;
        }
        return classifyMessage(e.getMessage());
    }

    /**
     * Category of an HTTP status returned by a REST endpoint; 2xx is not an error and is not expected here.
     */
    public static ErrorCategory classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorCategory.AUTHENTICATION;
        }
        if (status == 400) {
            return ErrorCategory.MALFORMED_STATEMENT;
        }
        if (status == 408 || status == 504) {
            return ErrorCategory.TIMEOUT;
        }
        if (status == 429 || status == 502 || status == 503) {
            return ErrorCategory.TRANSIENT;
        }
        return ErrorCategory.SERVER_ERROR;
    }

    /**
     * Keyword classification for failures that carry only a message.
     */
    public static ErrorCategory classifyMessage(String message) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (containsAny(text, AUTHENTICATION_HINTS)) {
            return ErrorCategory.AUTHENTICATION;
        }
        if (containsAny(text, TIMEOUT_HINTS)) {
            return ErrorCategory.TIMEOUT;
        }
        if (containsAny(text, CONNECTION_HINTS)) {
            return ErrorCategory.CONNECTION;
        }
        if (containsAny(text, TRANSIENT_HINTS)) {
            return ErrorCategory.TRANSIENT;
        }
        return ErrorCategory.SERVER_ERROR;
    }

    private static boolean containsAny(String text, List<String> hints) {
        for (String hint : hints) {
            if (text.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
