package sdkusage.querybridge.execution;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import sdkusage.querybridge.config.QueryBridgeConfig;
import sdkusage.querybridge.services.LogUtil;
import sdkusage.querybridge.translation.StatementSafetyCheck;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Executes read-only statements against the usage database.
 *
 * <p>Transports are tried in order. Each gets a bounded retry loop for retryable failures;
 * authentication and malformed-statement failures end the call, anything else falls through to
 * the next transport. The returned future always succeeds with a {@link QueryResult}.</p>
 *
 * <p>One instance is created at startup and shared; {@link #close()} releases the worker pool and
 * the HTTP client.</p>
 */
public class SqlExecutionClient {

    private static final String COMPONENT = "SqlExecutionClient";

    public static final List<String> TROUBLESHOOTING_HINTS = List.of(
        "Check Azure authentication: ensure the managed identity or SQL_ACCESS_TOKEN is valid",
        "Verify SQL_SERVER and SQL_DATABASE are set correctly",
        "Check that the SQL server firewall allows this host",
        "Verify the identity has read permissions on the database");

    private final Vertx vertx;
    private final List<QueryTransport> transports;
    private final AccessTokenProvider tokenProvider;
    private final RetryPolicy retryPolicy;
    private final long attemptTimeoutMs;
    private final JsonObject targetMetadata;
    private final List<Runnable> closeActions = new ArrayList<>();
    private volatile boolean closed;

    public SqlExecutionClient(Vertx vertx, List<QueryTransport> transports, AccessTokenProvider tokenProvider,
                              RetryPolicy retryPolicy, long attemptTimeoutMs) {
        this(vertx, transports, tokenProvider, retryPolicy, attemptTimeoutMs, new JsonObject());
    }

    public SqlExecutionClient(Vertx vertx, List<QueryTransport> transports, AccessTokenProvider tokenProvider,
                              RetryPolicy retryPolicy, long attemptTimeoutMs, JsonObject targetMetadata) {
        if (transports.isEmpty()) {
            throw new IllegalArgumentException("At least one transport is required");
        }
        this.vertx = vertx;
        this.transports = List.copyOf(transports);
        this.tokenProvider = tokenProvider;
        this.retryPolicy = retryPolicy;
        this.attemptTimeoutMs = attemptTimeoutMs;
        this.targetMetadata = targetMetadata.copy();
    }

    /**
     * Client wired from configuration: direct JDBC first, then the management API when the
     * subscription and resource group are configured.
     */
    public static SqlExecutionClient create(Vertx vertx, QueryBridgeConfig config) {
        config.requireExecutionSettings();

        WebClient webClient = WebClient.create(vertx);
        WorkerExecutor workers = vertx.createSharedWorkerExecutor(
            "sql-execution", config.getWorkerPoolSize(), config.getExecutionTimeoutSeconds() * 2L, TimeUnit.SECONDS);

        AccessTokenProvider tokenProvider = config.getStaticAccessToken() != null
            ? new StaticAccessTokenProvider(config.getStaticAccessToken())
            : new ManagedIdentityTokenProvider(vertx, webClient, config.getIdentityEndpoint(), config.getIdentityHeader());

        List<QueryTransport> transports = new ArrayList<>();
        transports.add(new DirectSqlTransport(vertx, workers, config));
        if (config.isManagementApiConfigured()) {
            transports.add(new ManagementApiTransport(vertx, webClient, config));
        } else {
            LogUtil.logInfo(vertx, "Management API fallback disabled: AZURE_SUBSCRIPTION_ID or AZURE_RESOURCE_GROUP not set",
                COMPONENT, "Create", "System", false);
        }

        long attemptTimeoutMs = (config.getConnectTimeoutSeconds() + config.getExecutionTimeoutSeconds()) * 1000L;
        JsonObject target = new JsonObject()
            .put("server", config.getSqlServer())
            .put("database", config.getSqlDatabase());

        SqlExecutionClient client = new SqlExecutionClient(vertx, transports, tokenProvider,
            new RetryPolicy(config.getMaxAttempts(), config.getRetryDelayMs()), attemptTimeoutMs, target);
        client.closeActions.add(workers::close);
        client.closeActions.add(webClient::close);
        return client;
    }

    public Future<QueryResult> execute(String sql) {
        long started = System.currentTimeMillis();
        ExecutionTrace trace = new ExecutionTrace();

        if (closed) {
            trace.enter(ExecutionState.FAILED);
            return Future.succeededFuture(QueryResult.failure(sql, ErrorCategory.CONNECTION,
                "Execution client is closed", metadata(trace, null, 0, started), List.of()));
        }

        Optional<String> rejection = StatementSafetyCheck.rejectionReason(sql);
        if (rejection.isPresent()) {
            trace.enter(ExecutionState.FAILED);
            LogUtil.logWarning(vertx, "Rejected statement: " + rejection.get(), COMPONENT, "Execute", "Safety");
            return Future.succeededFuture(QueryResult.failure(sql, ErrorCategory.STATEMENT_SAFETY,
                rejection.get(), metadata(trace, null, 0, started), List.of()));
        }

        Map<String, Future<String>> tokens = new ConcurrentHashMap<>();
        Promise<QueryResult> promise = Promise.promise();
        runStrategy(sql, 0, trace, tokens, started, 0, promise);
        return promise.future();
    }

    private void runStrategy(String sql, int index, ExecutionTrace trace, Map<String, Future<String>> tokens,
                             long started, int previousAttempts, Promise<QueryResult> promise) {
        QueryTransport transport = transports.get(index);
        RetryState state = retryPolicy.newState();
        LogUtil.logDetail(vertx, "Executing via " + transport.name(), COMPONENT, "Execute", "Database");

        attemptWithRetry(sql, transport, state, trace, tokens).onComplete(ar -> {
            int attempts = previousAttempts + state.getAttempt();
            if (ar.succeeded()) {
                trace.enter(ExecutionState.SUCCEEDED);
                JsonObject meta = metadata(trace, transport, attempts, started);
                LogUtil.logInfo(vertx, "Query succeeded via " + transport.name() + " with " + ar.result().size()
                    + " rows after " + attempts + " attempt(s)", COMPONENT, "Execute", "Database", false);
                promise.complete(QueryResult.success(sql, ar.result(), meta));
                return;
            }

            QueryExecutionException failure = QueryExecutionException.from(ar.cause());
            boolean hasNext = index + 1 < transports.size();
            if (hasNext && failure.getCategory().isFallbackAllowed()) {
                LogUtil.logWarning(vertx, transport.name() + " failed (" + failure.getCategory() + "): "
                    + failure.getMessage() + "; falling back to " + transports.get(index + 1).name(),
                    COMPONENT, "Execute", "Database");
                runStrategy(sql, index + 1, trace, tokens, started, attempts, promise);
                return;
            }

            trace.enter(ExecutionState.FAILED);
            LogUtil.logError(vertx, "Query failed via " + transport.name() + " (" + failure.getCategory() + "): "
                + failure.getMessage(), COMPONENT, "Execute", "Database", false);
            List<String> hints = failure.getCategory() == ErrorCategory.MALFORMED_STATEMENT
                ? List.of() : TROUBLESHOOTING_HINTS;
            promise.complete(QueryResult.failure(sql, failure.getCategory(), failure.getMessage(),
                metadata(trace, transport, attempts, started), hints));
        });
    }

    private Future<JsonArray> attemptWithRetry(String sql, QueryTransport transport, RetryState state,
                                                ExecutionTrace trace, Map<String, Future<String>> tokens) {
        Promise<JsonArray> promise = Promise.promise();
        int attempt = state.beginAttempt();

        attempt(sql, transport, trace, tokens).onComplete(ar -> {
            if (ar.succeeded()) {
                promise.complete(ar.result());
                return;
            }
            QueryExecutionException failure = QueryExecutionException.from(ar.cause());
            state.recordFailure(failure);
            if (state.canRetry()) {
                long delay = state.nextDelayMs();
                LogUtil.logInfo(vertx, transport.name() + " attempt " + attempt + " failed (" + failure.getCategory()
                    + "), retrying in " + delay + "ms", COMPONENT, "Retry", "Database", false);
                Runnable retry = () -> attemptWithRetry(sql, transport, state, trace, tokens).onComplete(promise);
                if (delay > 0) {
                    vertx.setTimer(delay, id -> retry.run());
                } else {
                    retry.run();
                }
            } else {
                promise.fail(failure);
            }
        });
        return promise.future();
    }

    /**
     * One token + connect + execute round, abandoned as a retryable timeout when it overruns.
     */
    private Future<JsonArray> attempt(String sql, QueryTransport transport, ExecutionTrace trace,
                                      Map<String, Future<String>> tokens) {
        Promise<JsonArray> promise = Promise.promise();
        long timerId = vertx.setTimer(attemptTimeoutMs, id -> promise.tryFail(new QueryExecutionException(
            ErrorCategory.TIMEOUT, transport.name() + " attempt timed out after " + attemptTimeoutMs + "ms")));

        trace.enter(ExecutionState.AUTHENTICATING);
        token(transport.tokenScope(), tokens)
            .compose(token -> {
                trace.enter(ExecutionState.CONNECTING);
                return transport.execute(sql, token, trace);
            })
            .onComplete(ar -> {
                vertx.cancelTimer(timerId);
                if (ar.succeeded()) {
                    promise.tryComplete(ar.result());
                } else {
                    promise.tryFail(ar.cause());
                }
            });
        return promise.future();
    }

    private Future<String> token(String scope, Map<String, Future<String>> tokens) {
        Future<String> cached = tokens.get(scope);
        if (cached != null && !cached.failed()) {
            return cached;
        }
        Future<String> fresh = tokenProvider.getToken(scope);
        tokens.put(scope, fresh);
        return fresh;
    }

    private JsonObject metadata(ExecutionTrace trace, QueryTransport transport, int attempts, long started) {
        JsonObject meta = targetMetadata.copy()
            .put("attempts", attempts)
            .put("elapsedMs", System.currentTimeMillis() - started)
            .put("states", trace.toJson());
        if (transport != null) {
            meta.put("strategy", transport.name());
        }
        return meta;
    }

    public List<String> transportNames() {
        List<String> names = new ArrayList<>();
        transports.forEach(t -> names.add(t.name()));
        return names;
    }

    public AccessTokenProvider getTokenProvider() {
        return tokenProvider;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Idempotent.
     */
    public synchronized Future<Void> close() {
        if (closed) {
            return Future.succeededFuture();
        }
        closed = true;
        List<Future<Void>> closing = new ArrayList<>();
        transports.forEach(t -> closing.add(t.close()));
        closeActions.forEach(Runnable::run);
        LogUtil.logInfo(vertx, "Execution client closed", COMPONENT, "Close", "System", false);
        return Future.all(closing).mapEmpty();
    }
}
