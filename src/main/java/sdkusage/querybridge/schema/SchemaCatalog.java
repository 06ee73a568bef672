package sdkusage.querybridge.schema;

import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import sdkusage.querybridge.services.LogUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only catalog of the usage tables, columns and enum definitions described by a schema manifest.
 *
 * <p>Loading never fails: a missing, unreadable or malformed manifest yields an empty catalog and a
 * logged warning. {@link #shared(Vertx, String)} memoizes the first load for the whole process.
 * Instances are immutable and safe for concurrent readers.</p>
 */
public final class SchemaCatalog {

    private static final String COMPONENT = "SchemaCatalog";
    private static final String REF_PREFIX = "#/definitions/";

    private static volatile SchemaCatalog shared;

    private final Map<String, TableDescriptor> tablesByKey;
    private final List<TableDescriptor> tables;
    private final Map<String, EnumDefinition> enums;
    private final JsonObject definitions;

    private SchemaCatalog(List<TableDescriptor> tables, Map<String, EnumDefinition> enums, JsonObject definitions) {
        Map<String, TableDescriptor> byKey = new LinkedHashMap<>();
        for (TableDescriptor table : tables) {
            byKey.put(table.getKey(), table);
        }
        this.tablesByKey = Collections.unmodifiableMap(byKey);
        this.tables = List.copyOf(byKey.values());
        this.enums = Collections.unmodifiableMap(new LinkedHashMap<>(enums));
        this.definitions = definitions.copy();
    }

    public static SchemaCatalog empty() {
        return new SchemaCatalog(List.of(), Map.of(), new JsonObject());
    }

    /**
     * Process-wide catalog. The manifest is read on the first call only; later calls return the same
     * instance whatever path they pass.
     */
    public static SchemaCatalog shared(Vertx vertx, String manifestPath) {
        SchemaCatalog current = shared;
        if (current == null) {
            synchronized (SchemaCatalog.class) {
                current = shared;
                if (current == null) {
                    current = load(vertx, manifestPath);
                    shared = current;
                }
            }
        }
        return current;
    }

    /**
     * Load a manifest from the file system, falling back to the classpath for bundled manifests.
     */
    public static SchemaCatalog load(Vertx vertx, String manifestPath) {
        if (manifestPath == null || manifestPath.isBlank()) {
            LogUtil.logWarning(vertx, "No schema manifest path configured - using empty catalog",
                COMPONENT, "Load", "Schema");
            return empty();
        }
        try {
            String content = readManifest(manifestPath);
            SchemaCatalog catalog = fromManifest(new JsonObject(content), vertx);
            LogUtil.logInfo(vertx, "Loaded schema manifest " + manifestPath + " with " + catalog.getTables().size()
                + " tables (" + catalog.getEnabledTables().size() + " enabled)", COMPONENT, "Load", "Schema", false);
            return catalog;
        } catch (IOException e) {
            LogUtil.logWarning(vertx, "Schema manifest unreadable at " + manifestPath + ": " + e.getMessage()
                + " - using empty catalog", COMPONENT, "Load", "Schema");
        } catch (DecodeException | ClassCastException | SchemaLoadException e) {
            LogUtil.logWarning(vertx, "Schema manifest malformed at " + manifestPath + ": " + e.getMessage()
                + " - using empty catalog", COMPONENT, "Load", "Schema");
        }
        return empty();
    }

    /**
     * Build a catalog from a parsed manifest. Invalid entries inside an otherwise valid manifest are
     * skipped with a warning; a manifest without a {@code Tables} array is rejected.
     */
    public static SchemaCatalog fromManifest(JsonObject manifest, Vertx vertx) throws SchemaLoadException {
        Object rawTables = manifest.getValue("Tables");
        if (!(rawTables instanceof JsonArray)) {
            throw new SchemaLoadException("manifest has no 'Tables' array");
        }
        Object rawDefinitions = manifest.getValue("definitions");
        JsonObject definitions = rawDefinitions instanceof JsonObject ? (JsonObject) rawDefinitions : new JsonObject();

        Map<String, EnumDefinition> enums = new LinkedHashMap<>();
        for (String definitionName : definitions.fieldNames()) {
            Object definition = definitions.getValue(definitionName);
            if (definition instanceof JsonObject) {
                List<String> literals = stringList(((JsonObject) definition).getValue("enum"));
                if (!literals.isEmpty()) {
                    enums.put(definitionName, new EnumDefinition(definitionName, literals));
                }
            }
        }

        List<TableDescriptor> tables = new ArrayList<>();
        Set<String> seenKeys = new LinkedHashSet<>();
        for (Object entry : (JsonArray) rawTables) {
            if (!(entry instanceof JsonObject)) {
                LogUtil.logWarning(vertx, "Skipping non-object table entry", COMPONENT, "Parse", "Schema");
                continue;
            }
            JsonObject tableJson = (JsonObject) entry;
            String tableName = tableJson.getValue("TableName") instanceof String ? tableJson.getString("TableName") : null;
            if (tableName == null || tableName.isBlank()) {
                LogUtil.logWarning(vertx, "Skipping table entry without TableName", COMPONENT, "Parse", "Schema");
                continue;
            }
            if (!seenKeys.add(tableName.toLowerCase(Locale.ROOT))) {
                LogUtil.logWarning(vertx, "Skipping duplicate table " + tableName, COMPONENT, "Parse", "Schema");
                continue;
            }
            tables.add(parseTable(tableName, tableJson, definitions, vertx));
        }
        return new SchemaCatalog(tables, enums, definitions);
    }

    private static TableDescriptor parseTable(String tableName, JsonObject tableJson, JsonObject definitions, Vertx vertx) {
        boolean enabled = parseEnabled(tableJson.getValue("enabled"));
        String description = tableJson.getValue("Description") instanceof String ? tableJson.getString("Description") : "";

        List<ColumnMetadata> columns = new ArrayList<>();
        Set<String> seenColumns = new LinkedHashSet<>();
        Object rawColumns = tableJson.getValue("Columns");
        if (rawColumns instanceof JsonArray) {
            for (Object rawColumn : (JsonArray) rawColumns) {
                if (!(rawColumn instanceof JsonObject)) {
                    continue;
                }
                JsonObject columnJson = (JsonObject) rawColumn;
                String columnName = columnJson.getValue("ColumnName") instanceof String ? columnJson.getString("ColumnName") : null;
                if (columnName == null || columnName.isBlank()) {
                    continue;
                }
                if (!seenColumns.add(columnName)) {
                    LogUtil.logWarning(vertx, "Skipping duplicate column " + columnName + " in " + tableName,
                        COMPONENT, "Parse", "Schema");
                    continue;
                }
                columns.add(parseColumn(columnName, columnJson, definitions));
            }
        }
        return new TableDescriptor(tableName, enabled, description, columns);
    }

    private static ColumnMetadata parseColumn(String columnName, JsonObject columnJson, JsonObject definitions) {
        Object ref = columnJson.getValue("$ref");
        if (!(ref instanceof String) || !((String) ref).startsWith(REF_PREFIX)) {
            return ColumnMetadata.plain(columnName);
        }
        String definitionName = ((String) ref).substring(REF_PREFIX.length());
        Object rawDefinition = definitions.getValue(definitionName);
        if (!(rawDefinition instanceof JsonObject)) {
            return ColumnMetadata.plain(columnName);
        }
        JsonObject definition = (JsonObject) rawDefinition;
        Object minimum = definition.getValue("minimum");
        return new ColumnMetadata(
            columnName,
            optionalString(definition, "title"),
            optionalString(definition, "description"),
            optionalString(definition, "type"),
            stringList(definition.getValue("enum")),
            optionalString(definition, "pattern"),
            optionalString(definition, "format"),
            minimum instanceof Number ? ((Number) minimum).doubleValue() : null,
            definitionName);
    }

    private static boolean parseEnabled(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "true".equalsIgnoreCase(((String) value).trim());
        }
        // Tables without the flag take part in resolution
        return value == null;
    }

    private static String optionalString(JsonObject json, String key) {
        Object value = json.getValue(key);
        return value instanceof String ? (String) value : null;
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof JsonArray)) {
            return List.of();
        }
        List<String> literals = new ArrayList<>();
        for (Object item : (JsonArray) value) {
            if (item != null) {
                literals.add(item.toString());
            }
        }
        return literals;
    }

    private static String readManifest(String manifestPath) throws IOException {
        Path path = Path.of(manifestPath);
        if (Files.isRegularFile(path)) {
            return Files.readString(path, StandardCharsets.UTF_8);
        }
        String resource = manifestPath.startsWith("/") ? manifestPath.substring(1) : manifestPath;
        try (InputStream in = SchemaCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("file not found");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public Optional<TableDescriptor> getTable(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tablesByKey.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * All tables in manifest order, disabled ones included.
     */
    public List<TableDescriptor> getTables() {
        return tables;
    }

    public List<TableDescriptor> getEnabledTables() {
        List<TableDescriptor> enabled = new ArrayList<>();
        for (TableDescriptor table : tables) {
            if (table.isEnabled()) {
                enabled.add(table);
            }
        }
        return enabled;
    }

    /**
     * Literals of the named enum definition, empty when undefined.
     */
    public List<String> getEnum(String name) {
        EnumDefinition definition = enums.get(name);
        return definition != null ? definition.getLiterals() : List.of();
    }

    public Collection<EnumDefinition> getEnums() {
        return enums.values();
    }

    public JsonObject getDefinitions() {
        return definitions.copy();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }
}
