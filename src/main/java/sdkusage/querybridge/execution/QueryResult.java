package sdkusage.querybridge.execution;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Uniform outcome of an execute() call, whichever transport served it.
 */
public final class QueryResult {

    private final boolean success;
    private final String query;
    private final JsonArray rows;
    private final ErrorCategory errorCategory;
    private final String error;
    private final JsonObject metadata;
    private final List<String> hints;

    private QueryResult(boolean success, String query, JsonArray rows, ErrorCategory errorCategory,
                        String error, JsonObject metadata, List<String> hints) {
        this.success = success;
        this.query = query;
        this.rows = rows != null ? rows : new JsonArray();
        this.errorCategory = errorCategory;
        this.error = error;
        this.metadata = metadata != null ? metadata : new JsonObject();
        this.hints = hints != null ? List.copyOf(hints) : List.of();
    }

    public static QueryResult success(String query, JsonArray rows, JsonObject metadata) {
        return new QueryResult(true, query, rows, null, null, metadata, null);
    }

    public static QueryResult failure(String query, ErrorCategory category, String error,
                                      JsonObject metadata, List<String> hints) {
        return new QueryResult(false, query, null, category, error, metadata, hints);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getQuery() {
        return query;
    }

    /**
     * Row objects with columns in result-set order; SQL NULLs are kept as JSON nulls.
     */
    public JsonArray getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public ErrorCategory getErrorCategory() {
        return errorCategory;
    }

    public String getError() {
        return error;
    }

    public JsonObject getMetadata() {
        return metadata;
    }

    public List<String> getHints() {
        return hints;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("success", success)
            .put("query", query);
        if (success) {
            json.put("data", rows).put("row_count", rows.size());
        } else {
            json.put("error", error)
                .put("error_type", errorCategory != null ? errorCategory.name() : null);
            if (!hints.isEmpty()) {
                json.put("troubleshooting", new JsonArray(hints));
            }
        }
        json.put("execution", metadata);
        return json;
    }

    @Override
    public String toString() {
        return success
            ? "QueryResult{success, rows=" + rows.size() + ", metadata=" + metadata.encode() + "}"
            : "QueryResult{failure=" + errorCategory + ", error='" + error + "'}";
    }
}
