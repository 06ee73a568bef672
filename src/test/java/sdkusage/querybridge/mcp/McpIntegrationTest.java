package sdkusage.querybridge.mcp;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import sdkusage.querybridge.TestCatalogs;
import sdkusage.querybridge.mcp.base.MCPResponse;
import sdkusage.querybridge.mcp.servers.KustoQueryServer;
import sdkusage.querybridge.mcp.servers.SqlQueryServer;
import sdkusage.querybridge.services.MCPRouterService;
import sdkusage.querybridge.services.QueryToolService;
import sdkusage.querybridge.translation.KustoQueryRenderer;
import sdkusage.querybridge.translation.QueryIntentResolver;
import sdkusage.querybridge.translation.SqlQueryRenderer;

/**
 * MCP servers behind the HTTP router, exercised over JSON-RPC.
 * No database is configured, so execution tools report a configuration error.
 */
@ExtendWith(VertxExtension.class)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class McpIntegrationTest {

    private MCPRouterService routerService;
    private WebClient client;

    @BeforeEach
    void deploy(Vertx vertx, VertxTestContext testContext) {
        QueryToolService toolService = new QueryToolService(vertx,
            new QueryIntentResolver(TestCatalogs.catalog(), TestCatalogs.august2025()),
            new SqlQueryRenderer(),
            new KustoQueryRenderer(TestCatalogs.august2025()),
            null);
        routerService = new MCPRouterService(0);
        client = WebClient.create(vertx);

        // Servers first, so their routers are mounted when the router service starts
        Future.all(
                vertx.deployVerticle(new SqlQueryServer(toolService)),
                vertx.deployVerticle(new KustoQueryServer(toolService)))
            .compose(v -> vertx.deployVerticle(routerService))
            .onComplete(testContext.succeedingThenComplete());
    }

    private Future<HttpResponse<Buffer>> call(String path, JsonObject body) {
        return client.post(routerService.actualPort(), "localhost", path).sendJsonObject(body);
    }

    private static JsonObject toolCall(String id, String tool, JsonObject arguments) {
        return new JsonObject()
            .put("jsonrpc", "2.0")
            .put("id", id)
            .put("method", "tools/call")
            .put("params", new JsonObject().put("name", tool).put("arguments", arguments));
    }

    @Test
    @Order(1)
    @DisplayName("Health lists both mounted servers")
    void health(Vertx vertx, VertxTestContext testContext) {
        client.get(routerService.actualPort(), "localhost", "/health").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                JsonArray servers = response.bodyAsJsonObject().getJsonArray("servers");
                Assertions.assertTrue(servers.contains(SqlQueryServer.PATH));
                Assertions.assertTrue(servers.contains(KustoQueryServer.PATH));
                testContext.completeNow();
            })));
    }

    @Test
    @Order(2)
    @DisplayName("tools/list returns the SQL tools")
    void listTools(Vertx vertx, VertxTestContext testContext) {
        JsonObject request = new JsonObject().put("jsonrpc", "2.0").put("id", 1).put("method", "tools/list");

        call(SqlQueryServer.PATH + "/tools/list", request)
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                JsonObject body = response.bodyAsJsonObject();
                Assertions.assertEquals("1", body.getString("id"));
                JsonArray tools = body.getJsonObject("result").getJsonArray("tools");
                Assertions.assertEquals(8, tools.size());
                Assertions.assertEquals("parse_user_query", tools.getJsonObject(0).getString("name"));
                testContext.completeNow();
            })));
    }

    @Test
    @Order(3)
    @DisplayName("parse_user_query answers with the translated statement")
    void parseUserQuery(Vertx vertx, VertxTestContext testContext) {
        call(SqlQueryServer.PATH + "/tools/call", toolCall("q1", "parse_user_query",
            new JsonObject().put("user_question", "Show me Go-SDK request counts this month")))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                JsonObject result = response.bodyAsJsonObject().getJsonObject("result");
                Assertions.assertTrue(result.getBoolean("success"));
                Assertions.assertEquals("UsageByMonthProduct", result.getString("table_name"));
                Assertions.assertTrue(result.getString("sql").contains("Product = 'Go-SDK'"));
                testContext.completeNow();
            })));
    }

    @Test
    @Order(4)
    @DisplayName("execute_query without a database reports the configuration problem")
    void executeWithoutDatabase(Vertx vertx, VertxTestContext testContext) {
        call(SqlQueryServer.PATH + "/tools/call", toolCall("q2", "execute_query",
            new JsonObject().put("user_question", "top 5 products")))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                JsonObject result = response.bodyAsJsonObject().getJsonObject("result");
                Assertions.assertFalse(result.getBoolean("success"));
                Assertions.assertEquals("CONFIGURATION", result.getString("error_type"));
                testContext.completeNow();
            })));
    }

    @Test
    @Order(5)
    @DisplayName("Protocol errors map to JSON-RPC codes")
    void protocolErrors(Vertx vertx, VertxTestContext testContext) {
        String path = SqlQueryServer.PATH + "/tools/call";
        Future<HttpResponse<Buffer>> unknownTool = call(path, toolCall("e1", "drop_everything", new JsonObject()));
        Future<HttpResponse<Buffer>> missingArgument = call(path, toolCall("e2", "validate_query", new JsonObject()));
        Future<HttpResponse<Buffer>> badVersion = call(path, toolCall("e3", "list_tables", null).put("jsonrpc", "1.0"));

        Future.all(unknownTool, missingArgument, badVersion)
            .onComplete(testContext.succeeding(all -> testContext.verify(() -> {
                Assertions.assertEquals(400, unknownTool.result().statusCode());
                Assertions.assertEquals(MCPResponse.ErrorCodes.METHOD_NOT_FOUND, errorCode(unknownTool));
                Assertions.assertEquals(MCPResponse.ErrorCodes.INVALID_PARAMS, errorCode(missingArgument));
                Assertions.assertEquals(MCPResponse.ErrorCodes.INVALID_REQUEST, errorCode(badVersion));
                testContext.completeNow();
            })));
    }

    @Test
    @Order(6)
    @DisplayName("Malformed bodies are parse errors")
    void parseError(Vertx vertx, VertxTestContext testContext) {
        client.post(routerService.actualPort(), "localhost", SqlQueryServer.PATH + "/tools/list")
            .putHeader("content-type", "application/json")
            .sendBuffer(Buffer.buffer("{not json"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(MCPResponse.ErrorCodes.PARSE_ERROR,
                    response.bodyAsJsonObject().getJsonObject("error").getInteger("code"));
                testContext.completeNow();
            })));
    }

    @Test
    @Order(7)
    @DisplayName("generate_kusto_query is served by the Kusto server")
    void generateKusto(Vertx vertx, VertxTestContext testContext) {
        call(KustoQueryServer.PATH + "/tools/call", toolCall("k1", "generate_kusto_query",
            new JsonObject().put("user_question", "js usage last month")))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                JsonObject result = response.bodyAsJsonObject().getJsonObject("result");
                Assertions.assertTrue(result.getBoolean("success"));
                Assertions.assertTrue(result.getString("kusto_query").contains("in~ (\"JavaScript\""));
                testContext.completeNow();
            })));
    }

    private static int errorCode(Future<HttpResponse<Buffer>> response) {
        return response.result().bodyAsJsonObject().getJsonObject("error").getInteger("code");
    }
}
