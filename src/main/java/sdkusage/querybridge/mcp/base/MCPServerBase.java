package sdkusage.querybridge.mcp.base;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import sdkusage.querybridge.services.LogUtil;
import sdkusage.querybridge.services.MCPRouterService;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Base verticle for the MCP servers. Serves {@code POST tools/list} and {@code POST tools/call}
 * under the server's path; subclasses register each tool together with the function answering it.
 *
 * <p>Arguments a tool declares as required are checked here, so handlers can read them without
 * null checks. A handler that throws or fails its future produces an internal error.</p>
 */
public abstract class MCPServerBase extends AbstractVerticle {

    private static final String COMPONENT = "MCPServerBase";

    private final Map<String, MCPTool> tools = new LinkedHashMap<>();
    private final Map<String, Function<JsonObject, Future<JsonObject>>> handlers = new LinkedHashMap<>();
    protected final String serverName;
    protected final String serverPath;

    protected MCPServerBase(String serverName, String serverPath) {
        this.serverName = serverName;
        this.serverPath = serverPath;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Router router = Router.router(vertx);
        router.post("/tools/list").handler(ctx -> withRequest(ctx, this::listTools));
        router.post("/tools/call").handler(ctx -> withRequest(ctx, this::callTool));

        initializeTools();

        MCPRouterService.registerRouter(serverPath, router);
        LogUtil.logDetail(vertx, serverName + " serving " + tools.size() + " tools at " + serverPath, COMPONENT, "Start", "MCP");
        startPromise.complete();
    }

    /**
     * Register the tools this server provides.
     */
    protected abstract void initializeTools();

    protected void registerTool(MCPTool tool, Function<JsonObject, Future<JsonObject>> handler) {
        tools.put(tool.getName(), tool);
        handlers.put(tool.getName(), handler);
        LogUtil.logDebug(vertx, serverName + " registered tool: " + tool.getName(), COMPONENT, "Register", "MCP");
    }

    /**
     * Tool whose answer is computed on the spot.
     */
    protected void registerSyncTool(MCPTool tool, Function<JsonObject, JsonObject> handler) {
        registerTool(tool, arguments -> Future.succeededFuture(handler.apply(arguments)));
    }

    private void withRequest(RoutingContext ctx, Function<MCPRequest, Future<MCPResponse>> action) {
        MCPRequest request;
        try {
            JsonObject body = ctx.body().asJsonObject();
            if (body == null) {
                send(ctx, MCPResponse.error(null, MCPResponse.ErrorCodes.PARSE_ERROR, "Request body is empty"));
                return;
            }
            request = MCPRequest.parse(body);
        } catch (DecodeException | ClassCastException e) {
            send(ctx, MCPResponse.error(null, MCPResponse.ErrorCodes.PARSE_ERROR, "Invalid JSON: " + e.getMessage()));
            return;
        }
        if (!request.isValid()) {
            send(ctx, MCPResponse.error(request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format"));
            return;
        }
        action.apply(request).onComplete(ar -> {
            if (ar.succeeded()) {
                send(ctx, ar.result());
            } else {
                LogUtil.logError(vertx, "Tool call failed", ar.cause(), COMPONENT, "ToolCall", "MCP", false);
                send(ctx, MCPResponse.error(request.getId(), MCPResponse.ErrorCodes.INTERNAL_ERROR,
                    "Internal server error: " + ar.cause().getMessage()));
            }
        });
    }

    private Future<MCPResponse> listTools(MCPRequest request) {
        JsonArray listed = new JsonArray();
        tools.values().forEach(tool -> listed.add(tool.toJson()));
        return Future.succeededFuture(MCPResponse.result(request.getId(), new JsonObject().put("tools", listed)));
    }

    private Future<MCPResponse> callTool(MCPRequest request) {
        String toolName = request.toolName();
        if (toolName == null) {
            return invalidParams(request, "Missing tool name");
        }
        Function<JsonObject, Future<JsonObject>> handler = handlers.get(toolName);
        if (handler == null) {
            return Future.succeededFuture(MCPResponse.error(request.getId(),
                MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Tool not found: " + toolName));
        }
        if (!request.hasWellFormedArguments()) {
            return invalidParams(request, "Tool arguments must be an object");
        }
        JsonObject arguments = request.toolArguments();
        for (String required : tools.get(toolName).requiredArguments()) {
            Object value = arguments.getValue(required);
            if (!(value instanceof String) || ((String) value).isBlank()) {
                return invalidParams(request, "Missing required argument: " + required);
            }
        }

        LogUtil.logDetail(vertx, serverName + " calling " + toolName, COMPONENT, "ToolCall", "MCP");
        Future<JsonObject> outcome;
        try {
            outcome = handler.apply(arguments);
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }
        return outcome.map(result -> MCPResponse.result(request.getId(), result));
    }

    private static Future<MCPResponse> invalidParams(MCPRequest request, String message) {
        return Future.succeededFuture(MCPResponse.error(request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, message));
    }

    private static void send(RoutingContext ctx, MCPResponse response) {
        if (ctx.response().ended()) {
            return;
        }
        ctx.response()
            .putHeader("content-type", "application/json")
            .setStatusCode(response.httpStatus())
            .end(response.encode());
    }
}
