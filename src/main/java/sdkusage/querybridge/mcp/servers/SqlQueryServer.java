package sdkusage.querybridge.mcp.servers;

import sdkusage.querybridge.mcp.base.MCPServerBase;
import sdkusage.querybridge.mcp.base.MCPTool;
import sdkusage.querybridge.services.QueryToolService;

/**
 * MCP server for SDK usage questions against the relational usage database.
 * Translation tools answer synchronously; execution tools complete when the execution client does.
 */
public class SqlQueryServer extends MCPServerBase {

    public static final String PATH = "/mcp/servers/sql-query";

    private static final String QUESTION = "user_question";
    private static final String QUESTION_DESCRIPTION = "A natural language question about SDK usage data";

    private final QueryToolService toolService;

    public SqlQueryServer(QueryToolService toolService) {
        super("SqlQueryServer", PATH);
        this.toolService = toolService;
    }

    @Override
    protected void initializeTools() {
        registerSyncTool(MCPTool.withStringArgument(
            "parse_user_query",
            "Parse a natural language question into table name, columns, conditions, ordering and limit.",
            QUESTION, QUESTION_DESCRIPTION),
            args -> toolService.translate(args.getString(QUESTION)));

        registerSyncTool(MCPTool.withStringArgument(
            "validate_query",
            "Translate a question to SQL without running it and report the filters that would apply.",
            QUESTION, QUESTION_DESCRIPTION),
            args -> toolService.validateQuery(args.getString(QUESTION)));

        registerTool(MCPTool.withStringArgument(
            "execute_query",
            "Translate a question to SQL and execute it against the usage database.",
            QUESTION, QUESTION_DESCRIPTION),
            args -> toolService.translateAndExecute(args.getString(QUESTION)));

        registerTool(MCPTool.withStringArgument(
            "execute_custom_sql",
            "Execute a read-only SELECT statement against the usage database.",
            "sql_query", "A SELECT statement; write and DDL statements are rejected"),
            args -> toolService.executeRaw(args.getString("sql_query")));

        registerSyncTool(MCPTool.withoutArguments(
            "list_tables",
            "List the enabled tables with their columns and enum values."),
            args -> toolService.listSchema());

        registerSyncTool(MCPTool.withStringArgument(
            "get_enum_values",
            "Get the allowed values of an enum field such as Product, TrackInfo, HttpMethod or OS.",
            "field_name", "Field name, e.g. 'Product' or 'track'"),
            args -> toolService.getEnumValues(args.getString("field_name")));

        registerSyncTool(MCPTool.withStringArgument(
            "query_helper",
            "Schema context for composing SQL by hand: tables, suggested table, columns, enum values and example conditions.",
            QUESTION, QUESTION_DESCRIPTION),
            args -> toolService.queryHelper(args.getString(QUESTION)));

        registerTool(MCPTool.withoutArguments(
            "validate_auth",
            "Check that access tokens can be acquired for the database and management endpoints."),
            args -> toolService.validateAuth());
    }
}
