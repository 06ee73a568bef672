package sdkusage.querybridge.translation;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Gate for any SQL that reaches execution: it must start with SELECT and must not contain a
 * write or DDL keyword anywhere in its text.
 */
public final class StatementSafetyCheck {

    public static final List<String> FORBIDDEN_KEYWORDS =
        List.of("DROP", "DELETE", "INSERT", "UPDATE", "CREATE", "ALTER", "TRUNCATE", "EXEC", "EXECUTE");

    private StatementSafetyCheck() {
    }

    public static boolean isSafe(String sql) {
        return rejectionReason(sql).isEmpty();
    }

    /**
     * Why {@code sql} is refused, or empty when it may run.
     */
    public static Optional<String> rejectionReason(String sql) {
        if (sql == null || sql.isBlank()) {
            return Optional.of("SQL statement is empty");
        }
        String upper = sql.trim().toUpperCase(Locale.ROOT);
        if (!upper.startsWith("SELECT")) {
            return Optional.of("Only SELECT statements are allowed");
        }
        for (String keyword : FORBIDDEN_KEYWORDS) {
            if (upper.contains(keyword)) {
                return Optional.of("Statement contains forbidden keyword: " + keyword);
            }
        }
        return Optional.empty();
    }
}
