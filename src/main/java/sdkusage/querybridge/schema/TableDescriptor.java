package sdkusage.querybridge.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One table of the usage schema with its columns in manifest order.
 *
 * <p>Column roles are derived from names and formats: the temporal column is the
 * first of {@code Month}, {@code RequestsDate} or any date-formatted column, and
 * the measure columns are the known count columns present in the table.</p>
 */
public final class TableDescriptor {

    /** Count columns in the order they are preferred for filtering and ordering. */
    public static final List<String> MEASURE_COLUMNS =
        List.of("RequestCount", "SubscriptionCount", "RequestCounts", "CCIDCount");

    private static final List<String> TEMPORAL_COLUMNS = List.of("Month", "RequestsDate");

    private final String name;
    private final boolean enabled;
    private final String description;
    private final List<String> columnNames;
    private final Map<String, ColumnMetadata> columns;

    public TableDescriptor(String name, boolean enabled, String description, List<ColumnMetadata> columns) {
        this.name = name;
        this.enabled = enabled;
        this.description = description != null ? description : "";
        Map<String, ColumnMetadata> byName = new LinkedHashMap<>();
        for (ColumnMetadata column : columns) {
            if (byName.containsKey(column.getName())) {
                throw new IllegalArgumentException("Duplicate column '" + column.getName() + "' in table " + name);
            }
            byName.put(column.getName(), column);
        }
        this.columns = Collections.unmodifiableMap(byName);
        this.columnNames = List.copyOf(byName.keySet());
    }

    public String getName() {
        return name;
    }

    /**
     * Lower-cased name used for case-insensitive lookups.
     */
    public String getKey() {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Human form of the name, underscores read as spaces.
     */
    public String getDisplayName() {
        return name.replace('_', ' ').toLowerCase(Locale.ROOT);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public Map<String, ColumnMetadata> getColumns() {
        return columns;
    }

    public ColumnMetadata getColumn(String columnName) {
        return columns.get(columnName);
    }

    public boolean hasColumn(String columnName) {
        return columns.containsKey(columnName);
    }

    public Optional<String> temporalColumn() {
        for (String candidate : TEMPORAL_COLUMNS) {
            if (hasColumn(candidate)) {
                return Optional.of(candidate);
            }
        }
        for (ColumnMetadata column : columns.values()) {
            String format = column.getFormat();
            if ("date".equals(format) || "date-time".equals(format)) {
                return Optional.of(column.getName());
            }
        }
        return Optional.empty();
    }

    public List<String> measureColumns() {
        List<String> present = new ArrayList<>();
        for (String measure : MEASURE_COLUMNS) {
            if (hasColumn(measure)) {
                present.add(measure);
            }
        }
        return present;
    }

    public JsonObject toJson() {
        JsonArray columnArray = new JsonArray();
        columns.values().forEach(c -> columnArray.add(c.toJson()));
        return new JsonObject()
            .put("name", name)
            .put("enabled", enabled)
            .put("description", description)
            .put("columns", columnArray);
    }

    @Override
    public String toString() {
        return "TableDescriptor{name='" + name + "', enabled=" + enabled + ", columns=" + columnNames + "}";
    }
}
