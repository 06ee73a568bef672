package sdkusage.querybridge.translation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import sdkusage.querybridge.translation.OrderingDeriver.Direction;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Everything resolved from one question, before rendering. Immutable.
 */
public final class QueryIntent {

    private final String table;
    private final List<String> columns;
    private final List<FilterClause> filters;
    private final Integer limit;
    private final String orderColumn;
    private final Direction direction;

    public QueryIntent(String table, List<String> columns, List<FilterClause> filters,
                       Integer limit, String orderColumn, Direction direction) {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table is required");
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("at least one column is required");
        }
        this.table = table;
        this.columns = List.copyOf(columns);
        this.filters = filters == null ? List.of() : List.copyOf(filters);
        this.limit = limit;
        this.orderColumn = orderColumn;
        this.direction = direction == null ? Direction.DESC : direction;
    }

    public String getTable() {
        return table;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<FilterClause> getFilters() {
        return filters;
    }

    /**
     * AND-ed predicate text, {@code 1=1} when there are no filters.
     */
    public String getPredicate() {
        return PredicateBuilder.render(filters);
    }

    public boolean isTautology() {
        return filters.isEmpty();
    }

    public OptionalInt getLimit() {
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    public Optional<String> getOrderColumn() {
        return Optional.ofNullable(orderColumn);
    }

    public Direction getDirection() {
        return direction;
    }

    public JsonObject toJson() {
        JsonArray filterArray = new JsonArray();
        filters.forEach(f -> filterArray.add(f.toJson()));
        return new JsonObject()
            .put("table", table)
            .put("columns", new JsonArray(columns))
            .put("where", getPredicate())
            .put("filters", filterArray)
            .put("order_by", orderColumn)
            .put("order_direction", orderColumn != null ? direction.name() : null)
            .put("limit", limit);
    }

    @Override
    public String toString() {
        return "QueryIntent" + toJson().encode();
    }
}
