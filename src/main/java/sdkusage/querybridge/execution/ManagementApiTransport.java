package sdkusage.querybridge.execution;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import sdkusage.querybridge.config.QueryBridgeConfig;
import sdkusage.querybridge.services.LogUtil;

/**
 * Runs the statement through the Azure management plane's database query endpoint. Used when the
 * direct connection is unavailable, e.g. blocked by a firewall.
 */
public class ManagementApiTransport implements QueryTransport {

    private static final String COMPONENT = "ManagementApiTransport";
    static final String API_VERSION = "2021-11-01";

    private final Vertx vertx;
    private final WebClient webClient;
    private final String queryUrl;
    private final long requestTimeoutMs;

    public ManagementApiTransport(Vertx vertx, WebClient webClient, QueryBridgeConfig config) {
        this.vertx = vertx;
        this.webClient = webClient;
        this.queryUrl = config.getManagementEndpoint()
            + "/subscriptions/" + config.getSubscriptionId()
            + "/resourceGroups/" + config.getResourceGroup()
            + "/providers/Microsoft.Sql/servers/" + config.getSqlServerShortName()
            + "/databases/" + config.getSqlDatabase()
            + "/query?api-version=" + API_VERSION;
        this.requestTimeoutMs = (config.getConnectTimeoutSeconds() + config.getExecutionTimeoutSeconds()) * 1000L;
    }

    @Override
    public String name() {
        return "management-api";
    }

    @Override
    public String tokenScope() {
        return AccessTokenProvider.MANAGEMENT_SCOPE;
    }

    String getQueryUrl() {
        return queryUrl;
    }

    @Override
    public Future<JsonArray> execute(String sql, String accessToken, ExecutionTrace trace) {
        trace.enter(ExecutionState.EXECUTING);
        return webClient.postAbs(queryUrl)
            .putHeader("Authorization", "Bearer " + accessToken)
            .putHeader("Content-Type", "application/json")
            .timeout(requestTimeoutMs)
            .sendJsonObject(new JsonObject().put("query", sql))
            .recover(err -> Future.failedFuture(QueryExecutionException.from(err)))
            .compose(response -> {
                int status = response.statusCode();
                if (status == 401) {
                    return Future.failedFuture(new QueryExecutionException(ErrorCategory.AUTHENTICATION,
                        "Authentication failed. Check managed identity configuration."));
                }
                if (status == 403) {
                    return Future.failedFuture(new QueryExecutionException(ErrorCategory.AUTHENTICATION,
                        "Access denied. Check RBAC permissions on the SQL server."));
                }
                if (status != 200) {
                    return Future.failedFuture(new QueryExecutionException(SqlErrorClassifier.classifyStatus(status),
                        "Management API returned " + status + ": " + response.bodyAsString()));
                }
                try {
                    JsonArray rows = RowConverter.fromColumnsAndRows(response.bodyAsJsonObject());
                    LogUtil.logDebug(vertx, "Management API returned " + rows.size() + " rows", COMPONENT, "Execute", "Database");
                    return Future.succeededFuture(rows);
                } catch (DecodeException e) {
                    return Future.failedFuture(new QueryExecutionException(ErrorCategory.SERVER_ERROR,
                        "Management API response is not JSON", e));
                }
            });
    }
}
