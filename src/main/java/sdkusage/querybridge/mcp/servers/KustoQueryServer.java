package sdkusage.querybridge.mcp.servers;

import sdkusage.querybridge.mcp.base.MCPServerBase;
import sdkusage.querybridge.mcp.base.MCPTool;
import sdkusage.querybridge.services.QueryToolService;

/**
 * MCP server that turns questions into Kusto queries over the request telemetry template.
 * Queries are generated only; running them is left to the caller.
 */
public class KustoQueryServer extends MCPServerBase {

    public static final String PATH = "/mcp/servers/kusto-query";

    private final QueryToolService toolService;

    public KustoQueryServer(QueryToolService toolService) {
        super("KustoQueryServer", PATH);
        this.toolService = toolService;
    }

    @Override
    protected void initializeTools() {
        registerSyncTool(MCPTool.withStringArgument(
            "generate_kusto_query",
            "Generate a Kusto query for a question about SDK request telemetry.",
            "user_question", "A natural language question, e.g. 'Top 5 products last month'"),
            args -> toolService.generateKusto(args.getString("user_question")));
    }
}
