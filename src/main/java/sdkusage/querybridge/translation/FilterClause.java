package sdkusage.querybridge.translation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One AND-ed filter condition derived from a question. Both renderers consume the same clauses.
 */
public final class FilterClause {

    public enum Operator {
        EQUALS("="), ANY_OF("IN"), PREFIX("LIKE"), CONTAINS("LIKE"),
        GT(">"), LT("<"), GTE(">="), LTE("<=");

        private final String sql;

        Operator(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    /** Which detection step produced the clause. Declaration order is evaluation order. */
    public enum Origin {
        DATE, PRODUCT, TRACK, PROVIDER, RESOURCE, API_VERSION, HTTP_METHOD, OS, NUMERIC
    }

    private final String column;
    private final Operator operator;
    private final List<String> values;
    private final Origin origin;

    private FilterClause(String column, Operator operator, List<String> values, Origin origin) {
        this.column = column;
        this.operator = operator;
        this.values = List.copyOf(values);
        this.origin = origin;
    }

    public static FilterClause equalTo(String column, String value, Origin origin) {
        return new FilterClause(column, Operator.EQUALS, List.of(value), origin);
    }

    /**
     * OR group over {@code values}; a single value degrades to equality.
     */
    public static FilterClause anyOf(String column, List<String> values, Origin origin) {
        if (values.size() == 1) {
            return equalTo(column, values.get(0), origin);
        }
        return new FilterClause(column, Operator.ANY_OF, values, origin);
    }

    public static FilterClause prefix(String column, String value, Origin origin) {
        return new FilterClause(column, Operator.PREFIX, List.of(value), origin);
    }

    public static FilterClause contains(String column, String value, Origin origin) {
        return new FilterClause(column, Operator.CONTAINS, List.of(value), origin);
    }

    public static FilterClause compare(String column, Operator operator, long value) {
        if (operator != Operator.GT && operator != Operator.LT && operator != Operator.GTE
            && operator != Operator.LTE && operator != Operator.EQUALS) {
            throw new IllegalArgumentException("Not a comparison operator: " + operator);
        }
        return new FilterClause(column, operator, List.of(Long.toString(value)), Origin.NUMERIC);
    }

    public String getColumn() {
        return column;
    }

    public Operator getOperator() {
        return operator;
    }

    public List<String> getValues() {
        return values;
    }

    public String getValue() {
        return values.get(0);
    }

    public Origin getOrigin() {
        return origin;
    }

    public boolean isNumeric() {
        return origin == Origin.NUMERIC;
    }

    public String toSql() {
        switch (operator) {
            case ANY_OF:
                return "(" + values.stream()
                    .map(v -> column + " = " + quote(v))
                    .collect(Collectors.joining(" OR ")) + ")";
            case PREFIX:
                return column + " LIKE " + quote(getValue() + "%");
            case CONTAINS:
                return column + " LIKE " + quote("%" + getValue() + "%");
            default:
                return column + " " + operator.sql() + " " + (isNumeric() ? getValue() : quote(getValue()));
        }
    }

    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("column", column)
            .put("operator", operator.name())
            .put("values", new JsonArray(values))
            .put("origin", origin.name())
            .put("sql", toSql());
    }

    @Override
    public String toString() {
        return toSql();
    }
}
