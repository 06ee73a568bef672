package sdkusage.querybridge.translation;

/**
 * Renders a {@link QueryIntent} as T-SQL:
 * {@code SELECT [TOP N] cols FROM table [WHERE predicate] [ORDER BY col dir]}.
 */
public class SqlQueryRenderer {

    public String render(QueryIntent intent) {
        StringBuilder sql = new StringBuilder("SELECT ");
        intent.getLimit().ifPresent(limit -> sql.append("TOP ").append(limit).append(' '));
        sql.append(String.join(", ", intent.getColumns()));
        sql.append(" FROM ").append(intent.getTable());
        if (!intent.isTautology()) {
            sql.append(" WHERE ").append(intent.getPredicate());
        }
        intent.getOrderColumn().ifPresent(column ->
            sql.append(" ORDER BY ").append(column).append(' ').append(intent.getDirection().name()));
        return sql.toString();
    }
}
