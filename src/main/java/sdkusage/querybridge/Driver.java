package sdkusage.querybridge;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.ThreadingModel;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import sdkusage.querybridge.config.QueryBridgeConfig;
import sdkusage.querybridge.execution.SqlExecutionClient;
import sdkusage.querybridge.mcp.servers.KustoQueryServer;
import sdkusage.querybridge.mcp.servers.SqlQueryServer;
import sdkusage.querybridge.schema.SchemaCatalog;
import sdkusage.querybridge.services.Logger;
import sdkusage.querybridge.services.MCPRouterService;
import sdkusage.querybridge.services.QueryToolService;
import sdkusage.querybridge.translation.KustoQueryRenderer;
import sdkusage.querybridge.translation.QueryIntentResolver;
import sdkusage.querybridge.translation.SqlQueryRenderer;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Driver {
  public static int logLevel = 3; // 0=errors, 1=info, 2=detail, 3=debug
  public static Vertx vertx;

  private static final String DATA_PATH = "./data";
  public static final String queryBridgePath = DATA_PATH + "/querybridge";

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static volatile boolean loggerReady = false;

  private QueryBridgeConfig config;
  private SqlExecutionClient executionClient;

  /**
   * Captures log messages to emergency buffer or publishes directly if logger is ready.
   * Keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady || vertx == null) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.remove(0);
        }
        emergencyLogBuffer.add(message);
      }
    } else {
      vertx.eventBus().publish("log", message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish("log", entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(4)
        .setEventLoopPoolSize(1));

    captureOrPublishLog("=== SDK Usage Query Host Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Data path: " + queryBridgePath + ",2,Driver,System,System");

    // Deploy Logger FIRST before anything else
    vertx.deployVerticle(new Logger(queryBridgePath + "/logs")).onComplete(res -> {
      if (res.succeeded()) {
        loggerReady = true;
        flushEmergencyBuffer();
        captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");
        loadEnvironmentAndStart();
      } else {
        System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
        System.exit(1);
      }
    });
  }

  private static void loadEnvironmentAndStart() {
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,Config");
    } catch (DotenvException e) {
      captureOrPublishLog("Could not load .env.local file: " + e.getMessage().replace(",", ";") + ",1,Driver,StartUp,Config");
      System.err.println("Warning: Could not load .env.local file: " + e.getMessage());
    }

    Driver me = new Driver();
    try {
      me.config = QueryBridgeConfig.fromEnvironment();
    } catch (IllegalStateException e) {
      System.err.println("FATAL: " + e.getMessage());
      captureOrPublishLog("Invalid configuration: " + e.getMessage().replace(",", ";") + ",0,Driver,StartUp,Config");
      vertx.close().onComplete(v -> System.exit(1));
      return;
    }
    me.doIt();
  }

  private void doIt() {
    if (logLevel >= 1) captureOrPublishLog("Driver initialization starting,1,Driver,StartUp,MCP");

    SchemaCatalog catalog = SchemaCatalog.shared(vertx, config.getSchemaFilePath());
    if (catalog.isEmpty()) {
      captureOrPublishLog("Schema catalog is empty; every translation will fail until " + config.getSchemaFilePath()
          + " is fixed,0,Driver,StartUp,Schema");
    } else if (logLevel >= 1) {
      captureOrPublishLog("Schema catalog loaded with " + catalog.getEnabledTables().size() + " enabled tables,1,Driver,StartUp,Schema");
    }

    if (config.isExecutionConfigured()) {
      executionClient = SqlExecutionClient.create(vertx, config);
      if (logLevel >= 1) captureOrPublishLog("Execution client ready for " + config.getSqlServer() + "/" + config.getSqlDatabase()
          + ",1,Driver,StartUp,Database");
    } else {
      captureOrPublishLog("SQL_SERVER/SQL_DATABASE not set - execution tools disabled,1,Driver,StartUp,Database");
      System.err.println("Warning: SQL_SERVER/SQL_DATABASE not set (maybe check .env.local); execution tools disabled");
    }

    Clock clock = Clock.systemUTC();
    QueryToolService toolService = new QueryToolService(vertx,
        new QueryIntentResolver(catalog, clock),
        new SqlQueryRenderer(),
        new KustoQueryRenderer(clock),
        executionClient);

    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "querybridge-shutdown"));

    vertx.deployVerticle(new MCPRouterService(config.getMcpPort()))
        .compose(id -> deployServers(toolService))
        .onSuccess(count -> {
          captureOrPublishLog("=== SDK Usage Query Host Started (" + count + " MCP servers) ===,1,Driver,System,System");
          vertx.eventBus().publish("system.fully.ready", new JsonObject()
              .put("mcpServers", count)
              .put("port", config.getMcpPort())
              .put("timestamp", System.currentTimeMillis()));
        })
        .onFailure(err -> {
          captureOrPublishLog("Startup failed: " + String.valueOf(err.getMessage()).replace(",", ";") + ",0,Driver,StartUp,System");
          System.err.println("Fatal error - startup failed: " + err.getMessage());
        });
  }

  private Future<Integer> deployServers(QueryToolService toolService) {
    if (logLevel >= 1) captureOrPublishLog("Deploying MCP Servers...,1,Driver,StartUp,MCP");

    List<Future<String>> deploymentFutures = new ArrayList<>();
    // Worker: execution tools wait on JDBC and token calls
    deploymentFutures.add(vertx.deployVerticle(new SqlQueryServer(toolService),
        new DeploymentOptions().setThreadingModel(ThreadingModel.WORKER)));
    deploymentFutures.add(vertx.deployVerticle(new KustoQueryServer(toolService),
        new DeploymentOptions().setThreadingModel(ThreadingModel.EVENT_LOOP)));

    return Future.all(deploymentFutures).map(done -> {
      vertx.eventBus().publish("mcp.servers.ready", new JsonObject()
          .put("serverCount", deploymentFutures.size())
          .put("timestamp", System.currentTimeMillis()));
      return deploymentFutures.size();
    });
  }

  private void shutdown() {
    CountDownLatch latch = new CountDownLatch(1);
    Future<Void> closing = executionClient != null ? executionClient.close() : Future.succeededFuture();
    closing
        .compose(v -> vertx.eventBus().request("saveAllDataToFiles_OnTermination", "shutdown").<Void>mapEmpty())
        .onComplete(ar -> latch.countDown());
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
