package sdkusage.querybridge.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single HTTP listener in front of the MCP servers.
 *
 * <p>Each server hands its router to {@link #registerRouter(String, Router)} while it starts.
 * Routers registered before this verticle is up are held and mounted on start, so deployment
 * order does not matter. {@code GET /health} lists the mounted server paths.</p>
 */
public class MCPRouterService extends AbstractVerticle {

    private static final String COMPONENT = "MCPRouterService";
    private static final long MAX_BODY_BYTES = 1024 * 1024;

    private static final Map<String, Router> pendingRouters = new ConcurrentHashMap<>();
    private static volatile MCPRouterService instance;

    private final int port;
    private final Set<String> mountedPaths = new TreeSet<>();
    private Router mainRouter;
    private HttpServer httpServer;

    /**
     * @param port listening port; 0 picks a free one, see {@link #actualPort()}
     */
    public MCPRouterService(int port) {
        this.port = port;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        mainRouter = Router.router(vertx);
        mainRouter.route().handler(CorsHandler.create()
            .addOrigin("*")
            .allowedHeaders(Set.of("content-type", "authorization"))
            .allowedMethods(Set.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.OPTIONS)));
        mainRouter.route().handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES));
        mainRouter.get("/health").handler(this::health);
        mainRouter.route("/mcp/*").failureHandler(this::jsonRpcFailure);

        instance = this;
        pendingRouters.forEach(this::mount);
        pendingRouters.clear();

        vertx.createHttpServer()
            .requestHandler(mainRouter)
            .listen(port)
            .onSuccess(server -> {
                httpServer = server;
                LogUtil.logInfo(vertx, "MCP endpoints listening on port " + server.actualPort() + " for " + mountedPaths,
                    COMPONENT, "Start", "System", true);
                vertx.eventBus().publish("mcp.router.ready", new JsonObject()
                    .put("port", server.actualPort())
                    .put("servers", new JsonArray(new ArrayList<>(mountedPaths))));
                startPromise.complete();
            })
            .onFailure(err -> {
                instance = null;
                LogUtil.logError(vertx, "Cannot listen on port " + port, err, COMPONENT, "Start", "System", true);
                startPromise.fail(err);
            });
    }

    /**
     * Mounts {@code router} under {@code path}, now if the listener is up, otherwise once it starts.
     */
    public static void registerRouter(String path, Router router) {
        MCPRouterService current = instance;
        if (current == null) {
            pendingRouters.put(path, router);
        } else {
            current.context.runOnContext(v -> current.mount(path, router));
        }
    }

    private void mount(String path, Router router) {
        mainRouter.route(path + "/*").subRouter(router);
        mountedPaths.add(path);
        LogUtil.logDetail(vertx, "Mounted MCP server at " + path, COMPONENT, "Mount", "HTTP");
    }

    private void health(RoutingContext ctx) {
        ctx.response()
            .putHeader("content-type", "application/json")
            .end(new JsonObject()
                .put("status", "healthy")
                .put("servers", new JsonArray(new ArrayList<>(mountedPaths)))
                .put("timestamp", System.currentTimeMillis())
                .encode());
    }

    // Failures escaping a server router still answer in JSON-RPC shape
    private void jsonRpcFailure(RoutingContext ctx) {
        int status = ctx.statusCode() > 0 ? ctx.statusCode() : 500;
        Throwable failure = ctx.failure();
        if (failure != null) {
            LogUtil.logError(vertx, "Unhandled failure on " + ctx.request().path(), failure, COMPONENT, "Route", "HTTP", false);
        }
        ctx.response()
            .setStatusCode(status)
            .putHeader("content-type", "application/json")
            .end(new JsonObject()
                .put("jsonrpc", "2.0")
                .putNull("id")
                .put("error", new JsonObject()
                    .put("code", status)
                    .put("message", failure != null ? failure.getMessage() : "Request failed"))
                .encode());
    }

    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : port;
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (instance == this) {
            instance = null;
        }
        if (httpServer == null) {
            stopPromise.complete();
            return;
        }
        httpServer.close().onComplete(ar -> {
            LogUtil.logDetail(vertx, "MCP endpoints closed", COMPONENT, "Stop", "System");
            stopPromise.complete();
        });
    }
}
