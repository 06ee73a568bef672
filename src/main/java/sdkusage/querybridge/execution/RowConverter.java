package sdkusage.querybridge.execution;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * Turns result rows into JSON objects. Nulls stay null, integral and floating numbers and booleans
 * keep their type, timestamps become ISO text, binary is decoded as UTF-8 and anything else is
 * stringified.
 */
public final class RowConverter {

    private RowConverter() {
    }

    public static JsonArray toJson(ResultSet rs) throws SQLException {
        JsonArray results = new JsonArray();
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();

        while (rs.next()) {
            JsonObject row = new JsonObject();
            for (int i = 1; i <= columnCount; i++) {
                putValue(row, metaData.getColumnLabel(i), rs.getObject(i));
            }
            results.add(row);
        }
        return results;
    }

    static void putValue(JsonObject row, String columnName, Object value) {
        if (value == null) {
            row.putNull(columnName);
        } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            row.put(columnName, ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            row.put(columnName, ((Number) value).doubleValue());
        } else if (value instanceof BigDecimal || value instanceof BigInteger) {
            row.put(columnName, value.toString());
        } else if (value instanceof Boolean) {
            row.put(columnName, (Boolean) value);
        } else if (value instanceof Timestamp) {
            row.put(columnName, ((Timestamp) value).toLocalDateTime().toString());
        } else if (value instanceof java.sql.Date) {
            row.put(columnName, ((java.sql.Date) value).toLocalDate().toString());
        } else if (value instanceof byte[]) {
            row.put(columnName, new String((byte[]) value, StandardCharsets.UTF_8));
        } else {
            row.put(columnName, value.toString());
        }
    }

    /**
     * Rows of a REST response shaped as {@code {"columns": [...], "rows": [[...], ...]}}; rows that
     * are already objects are passed through.
     */
    public static JsonArray fromColumnsAndRows(JsonObject body) {
        JsonArray results = new JsonArray();
        if (body == null) {
            return results;
        }
        JsonArray columns = body.getJsonArray("columns", new JsonArray());
        JsonArray rows = body.getJsonArray("rows", new JsonArray());
        for (Object rawRow : rows) {
            if (rawRow instanceof JsonObject) {
                results.add(rawRow);
                continue;
            }
            if (!(rawRow instanceof JsonArray)) {
                continue;
            }
            JsonArray values = (JsonArray) rawRow;
            JsonObject row = new JsonObject();
            for (int i = 0; i < columns.size(); i++) {
                Object column = columns.getValue(i);
                String columnName = column instanceof JsonObject
                    ? ((JsonObject) column).getString("name", "column" + i)
                    : String.valueOf(column);
                Object value = i < values.size() ? values.getValue(i) : null;
                if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String) {
                    row.put(columnName, value);
                } else {
                    row.put(columnName, value.toString());
                }
            }
            results.add(row);
        }
        return results;
    }
}
