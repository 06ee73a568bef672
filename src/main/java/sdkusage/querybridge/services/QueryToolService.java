package sdkusage.querybridge.services;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import sdkusage.querybridge.execution.AccessTokenProvider;
import sdkusage.querybridge.execution.QueryExecutionException;
import sdkusage.querybridge.execution.SqlExecutionClient;
import sdkusage.querybridge.schema.ColumnMetadata;
import sdkusage.querybridge.schema.EnumDefinition;
import sdkusage.querybridge.schema.SchemaCatalog;
import sdkusage.querybridge.schema.TableDescriptor;
import sdkusage.querybridge.translation.FilterClause;
import sdkusage.querybridge.translation.KustoQueryRenderer;
import sdkusage.querybridge.translation.QueryIntent;
import sdkusage.querybridge.translation.QueryIntentResolver;
import sdkusage.querybridge.translation.SqlQueryRenderer;
import sdkusage.querybridge.translation.StatementSafetyCheck;
import sdkusage.querybridge.translation.TranslationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The operations exposed as tools. Every method answers with a JSON object; failures are reported
 * in the payload ({@code success=false}) and never thrown.
 */
public class QueryToolService {

    private static final String COMPONENT = "QueryToolService";

    public static final List<String> SUGGESTIONS = List.of(
        "Try asking about products, or request counts",
        "Include specific dates like '2024-01' or time periods",
        "Mention specific products like 'Python-SDK' or 'Java Fluent Premium'",
        "Ask for top/bottom N results",
        "Filter by providers like 'Microsoft.Compute' or OS like 'Windows'");

    private static final Map<String, String> ENUM_FIELDS = new LinkedHashMap<>();
    private static final Map<String, String> OPEN_FIELDS = new LinkedHashMap<>();

    static {
        ENUM_FIELDS.put("product", "Product");
        ENUM_FIELDS.put("trackinfo", "TrackInfo");
        ENUM_FIELDS.put("track", "TrackInfo");
        ENUM_FIELDS.put("httpmethod", "HttpMethod");
        ENUM_FIELDS.put("method", "HttpMethod");
        ENUM_FIELDS.put("os", "OS");
        ENUM_FIELDS.put("operatingsystem", "OS");

        OPEN_FIELDS.put("provider", "Azure resource provider names (e.g., Microsoft.Compute, Microsoft.Storage)");
        OPEN_FIELDS.put("resource", "Azure resource types (e.g., virtualMachines, storageAccounts)");
        OPEN_FIELDS.put("apiversion", "Azure API versions (e.g., 2021-04-01, 2020-12-01)");
    }

    private final Vertx vertx;
    private final QueryIntentResolver resolver;
    private final SqlQueryRenderer sqlRenderer;
    private final KustoQueryRenderer kustoRenderer;
    private final SqlExecutionClient executionClient;

    /**
     * @param executionClient may be null when no SQL target is configured; execution tools then
     *                        report that instead of running
     */
    public QueryToolService(Vertx vertx, QueryIntentResolver resolver, SqlQueryRenderer sqlRenderer,
                            KustoQueryRenderer kustoRenderer, SqlExecutionClient executionClient) {
        this.vertx = vertx;
        this.resolver = resolver;
        this.sqlRenderer = sqlRenderer;
        this.kustoRenderer = kustoRenderer;
        this.executionClient = executionClient;
    }

    public JsonObject translate(String question) {
        try {
            QueryIntent intent = resolver.resolve(question);
            String sql = sqlRenderer.render(intent);
            LogUtil.logDetail(vertx, "Translated question to: " + sql, COMPONENT, "Translate", "Translation");
            return new JsonObject()
                .put("success", true)
                .put("original_question", question)
                .put("table_name", intent.getTable())
                .put("columns", new JsonArray(intent.getColumns()))
                .put("where_clause", intent.isTautology() ? "" : intent.getPredicate())
                .put("order_clause", orderClause(intent))
                .put("limit_clause", intent.getLimit().isPresent() ? "TOP " + intent.getLimit().getAsInt() : "")
                .put("sql", sql)
                .put("query_components", intent.toJson());
        } catch (TranslationException e) {
            LogUtil.logInfo(vertx, "Could not translate question: " + e.getMessage(), COMPONENT, "Translate", "Translation", false);
            return translationFailure(question, e);
        }
    }

    /**
     * Translation without execution, reporting what the query would do.
     */
    public JsonObject validateQuery(String question) {
        try {
            QueryIntent intent = resolver.resolve(question);
            String sql = sqlRenderer.render(intent);
            Optional<String> rejection = StatementSafetyCheck.rejectionReason(sql);
            JsonArray filters = new JsonArray();
            intent.getFilters().forEach(f -> filters.add(f.toSql()));
            JsonObject result = new JsonObject()
                .put("success", true)
                .put("valid", rejection.isEmpty())
                .put("original_question", question)
                .put("generated_sql", sql)
                .put("table_used", intent.getTable())
                .put("columns_selected", new JsonArray(intent.getColumns()))
                .put("filters_applied", filters)
                .put("order_by", intent.getOrderColumn().orElse(null))
                .put("limit", intent.getLimit().isPresent() ? intent.getLimit().getAsInt() : null);
            rejection.ifPresent(reason -> result.put("error", reason));
            return result;
        } catch (TranslationException e) {
            return translationFailure(question, e).put("valid", false);
        }
    }

    public Future<JsonObject> translateAndExecute(String question) {
        QueryIntent intent;
        try {
            intent = resolver.resolve(question);
        } catch (TranslationException e) {
            return Future.succeededFuture(translationFailure(question, e));
        }
        String sql = sqlRenderer.render(intent);
        return run(sql).map(result -> result
            .put("original_question", question)
            .put("table_used", intent.getTable())
            .put("query_components", intent.toJson()));
    }

    public Future<JsonObject> executeRaw(String sql) {
        return run(sql);
    }

    private Future<JsonObject> run(String sql) {
        if (executionClient == null) {
            return Future.succeededFuture(new JsonObject()
                .put("success", false)
                .put("query", sql)
                .put("error", "SQL execution is not configured. Set SQL_SERVER and SQL_DATABASE.")
                .put("error_type", "CONFIGURATION"));
        }
        return executionClient.execute(sql)
            .map(result -> result.toJson())
            .otherwise(err -> new JsonObject()
                .put("success", false)
                .put("query", sql)
                .put("error", err.getMessage())
                .put("error_type", QueryExecutionException.from(err).getCategory().name()));
    }

    public JsonObject listSchema() {
        SchemaCatalog catalog = resolver.getCatalog();
        JsonArray tables = new JsonArray();
        catalog.getEnabledTables().forEach(t -> tables.add(t.toJson()));
        JsonObject enums = new JsonObject();
        for (EnumDefinition definition : catalog.getEnums()) {
            enums.put(definition.getName(), new JsonObject()
                .put("count", definition.getLiterals().size())
                .put("values", new JsonArray(definition.getLiterals())));
        }
        return new JsonObject()
            .put("success", true)
            .put("tables", tables)
            .put("table_count", tables.size())
            .put("enums", enums);
    }

    public JsonObject getEnumValues(String fieldName) {
        String field = fieldName == null ? "" : fieldName.trim();
        String key = field.toLowerCase(Locale.ROOT);
        SchemaCatalog catalog = resolver.getCatalog();

        String enumName = ENUM_FIELDS.get(key);
        if (enumName != null && !catalog.getEnum(enumName).isEmpty()) {
            List<String> values = catalog.getEnum(enumName);
            return new JsonObject()
                .put("success", true)
                .put("field_name", field)
                .put("enum_values", new JsonArray(values))
                .put("count", values.size());
        }

        if (OPEN_FIELDS.containsKey(key)) {
            return new JsonObject()
                .put("success", true)
                .put("field_name", field)
                .put("message", "No enum restriction for " + field)
                .put("description", OPEN_FIELDS.get(key))
                .put("note", "This field accepts any valid value from the database");
        }

        JsonObject definitions = catalog.getDefinitions();
        for (String definitionName : definitions.fieldNames()) {
            Object raw = definitions.getValue(definitionName);
            if (definitionName.equalsIgnoreCase(field) && raw instanceof JsonObject
                && ((JsonObject) raw).getValue("enum") instanceof JsonArray) {
                JsonArray values = ((JsonObject) raw).getJsonArray("enum");
                return new JsonObject()
                    .put("success", true)
                    .put("field_name", definitionName)
                    .put("enum_values", values)
                    .put("count", values.size())
                    .put("description", ((JsonObject) raw).getString("description", ""));
            }
        }

        JsonArray available = new JsonArray();
        ENUM_FIELDS.keySet().forEach(available::add);
        OPEN_FIELDS.keySet().forEach(available::add);
        return new JsonObject()
            .put("success", false)
            .put("error", "No enum information found for field '" + field + "'")
            .put("available_fields", available)
            .put("note", "Fields like 'provider', 'resource', and 'apiversion' have no enum restriction");
    }

    /**
     * Schema context for a caller composing its own SQL: tables, the suggested table with its
     * columns, enum values and example conditions drawn from the question.
     */
    public JsonObject queryHelper(String question) {
        SchemaCatalog catalog = resolver.getCatalog();
        JsonArray availableTables = new JsonArray();
        for (TableDescriptor table : catalog.getEnabledTables()) {
            availableTables.add(new JsonObject()
                .put("name", table.getName())
                .put("description", table.getDescription())
                .put("key", table.getKey()));
        }

        JsonObject result = new JsonObject()
            .put("success", true)
            .put("user_question", question)
            .put("available_tables", availableTables)
            .putNull("suggested_table")
            .put("available_columns", new JsonArray())
            .put("column_metadata", new JsonObject())
            .put("enum_values", new JsonObject())
            .put("example_columns", new JsonArray())
            .put("example_conditions", new JsonArray());

        if (question == null || question.isBlank()) {
            return result;
        }
        Optional<TableDescriptor> suggested = resolver.getTableResolver().resolve(question).flatMap(catalog::getTable);
        if (suggested.isEmpty()) {
            return result;
        }

        TableDescriptor table = suggested.get();
        JsonObject columnMetadata = new JsonObject();
        JsonObject enumValues = new JsonObject();
        for (ColumnMetadata column : table.getColumns().values()) {
            columnMetadata.put(column.getName(), column.toJson());
            if (column.hasEnum()) {
                enumValues.put(column.getName(), new JsonArray(column.getEnumValues()));
            }
        }

        JsonArray conditions = new JsonArray();
        JsonArray exampleColumns = new JsonArray();
        try {
            QueryIntent intent = resolver.resolveAgainst(question, table);
            intent.getColumns().forEach(exampleColumns::add);
            for (FilterClause clause : intent.getFilters()) {
                conditions.add(clause.toSql());
            }
        } catch (TranslationException e) {
            LogUtil.logDebug(vertx, "Helper could not resolve intent: " + e.getMessage(), COMPONENT, "QueryHelper", "Translation");
        }
        for (String column : enumValues.fieldNames()) {
            List<?> values = enumValues.getJsonArray(column).getList();
            if (!values.isEmpty()) {
                conditions.add(FilterClause.equalTo(column, String.valueOf(values.get(0)), originFor(column)).toSql());
            }
            if (values.size() > 1) {
                conditions.add(FilterClause.anyOf(column,
                    List.of(String.valueOf(values.get(0)), String.valueOf(values.get(1))), originFor(column)).toSql());
            }
        }

        return result
            .put("suggested_table", new JsonObject()
                .put("name", table.getName())
                .put("description", table.getDescription()))
            .put("available_columns", new JsonArray(table.getColumnNames()))
            .put("column_metadata", columnMetadata)
            .put("enum_values", enumValues)
            .put("example_columns", exampleColumns)
            .put("example_conditions", conditions);
    }

    public JsonObject generateKusto(String question) {
        if (question == null || question.isBlank()) {
            return new JsonObject().put("success", false).put("error", "Question is empty");
        }
        try {
            TableDescriptor stream = KustoQueryRenderer.enrichedStream(resolver.getCatalog(), resolver.getAliasResolver());
            QueryIntent intent = resolver.resolveAgainst(question, stream);
            String kql = kustoRenderer.render(question, intent);
            return new JsonObject()
                .put("success", true)
                .put("original_question", question)
                .put("query_type", kustoRenderer.detectQueryType(question, intent).name())
                .put("kusto_query", kql);
        } catch (TranslationException e) {
            return translationFailure(question, e);
        } catch (RuntimeException e) {
            LogUtil.logError(vertx, "Kusto generation failed", e, COMPONENT, "GenerateKusto", "Translation", false);
            return new JsonObject()
                .put("success", false)
                .put("original_question", question)
                .put("error", "Error generating Kusto query: " + e.getMessage());
        }
    }

    /**
     * Acquires tokens for the SQL and management scopes. Token text is never returned.
     */
    public Future<JsonObject> validateAuth() {
        if (executionClient == null) {
            return Future.succeededFuture(new JsonObject()
                .put("success", false)
                .put("error", "SQL execution is not configured. Set SQL_SERVER and SQL_DATABASE."));
        }
        AccessTokenProvider provider = executionClient.getTokenProvider();
        Future<JsonObject> sql = probe(provider, AccessTokenProvider.SQL_SCOPE);
        Future<JsonObject> management = probe(provider, AccessTokenProvider.MANAGEMENT_SCOPE);
        return Future.join(sql, management).map(done -> {
            JsonObject sqlResult = sql.result();
            JsonObject mgmtResult = management.result();
            return new JsonObject()
                .put("success", sqlResult.getBoolean("success") || mgmtResult.getBoolean("success"))
                .put("sql_database", sqlResult)
                .put("management_api", mgmtResult)
                .put("transports", new JsonArray(executionClient.transportNames()));
        }).otherwise(err -> new JsonObject().put("success", false).put("error", err.getMessage()));
    }

    private static Future<JsonObject> probe(AccessTokenProvider provider, String scope) {
        return provider.getToken(scope)
            .map(token -> new JsonObject().put("scope", scope).put("success", true).put("token_length", token.length()))
            .otherwise(err -> new JsonObject()
                .put("scope", scope)
                .put("success", false)
                .put("error", err.getMessage())
                .put("error_type", QueryExecutionException.from(err).getCategory().name()));
    }

    private static FilterClause.Origin originFor(String column) {
        switch (column) {
            case "TrackInfo":
                return FilterClause.Origin.TRACK;
            case "HttpMethod":
                return FilterClause.Origin.HTTP_METHOD;
            case "OS":
                return FilterClause.Origin.OS;
            default:
                return FilterClause.Origin.PRODUCT;
        }
    }

    private static String orderClause(QueryIntent intent) {
        return intent.getOrderColumn()
            .map(column -> "ORDER BY " + column + " " + intent.getDirection().name())
            .orElse("");
    }

    private static JsonObject translationFailure(String question, TranslationException e) {
        return new JsonObject()
            .put("success", false)
            .put("original_question", question)
            .put("error", e.getMessage())
            .put("suggestions", new JsonArray(SUGGESTIONS));
    }
}
