package sdkusage.querybridge.execution;

import com.microsoft.sqlserver.jdbc.SQLServerDataSource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.json.JsonArray;
import sdkusage.querybridge.config.QueryBridgeConfig;
import sdkusage.querybridge.services.LogUtil;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Direct TDS connection to Azure SQL with an Entra ID access token. JDBC work runs on the client's
 * bounded worker pool; a new connection is opened per attempt.
 */
public class DirectSqlTransport implements QueryTransport {

    private static final String COMPONENT = "DirectSqlTransport";

    private final Vertx vertx;
    private final WorkerExecutor workers;
    private final String server;
    private final String database;
    private final int connectTimeoutSeconds;
    private final int executionTimeoutSeconds;

    public DirectSqlTransport(Vertx vertx, WorkerExecutor workers, QueryBridgeConfig config) {
        this.vertx = vertx;
        this.workers = workers;
        this.server = config.getSqlServer();
        this.database = config.getSqlDatabase();
        this.connectTimeoutSeconds = config.getConnectTimeoutSeconds();
        this.executionTimeoutSeconds = config.getExecutionTimeoutSeconds();
    }

    @Override
    public String name() {
        return "direct-sql";
    }

    @Override
    public String tokenScope() {
        return AccessTokenProvider.SQL_SCOPE;
    }

    @Override
    public Future<JsonArray> execute(String sql, String accessToken, ExecutionTrace trace) {
        return workers.executeBlocking(() -> {
            SQLServerDataSource dataSource = new SQLServerDataSource();
            dataSource.setServerName(server);
            dataSource.setDatabaseName(database);
            dataSource.setAccessToken(accessToken);
            dataSource.setEncrypt("true");
            dataSource.setTrustServerCertificate(false);
            dataSource.setHostNameInCertificate("*.database.windows.net");
            dataSource.setLoginTimeout(connectTimeoutSeconds);

            try (Connection conn = dataSource.getConnection()) {
                trace.enter(ExecutionState.EXECUTING);
                try (Statement stmt = conn.createStatement()) {
                    stmt.setQueryTimeout(executionTimeoutSeconds);
                    try (ResultSet rs = stmt.executeQuery(sql)) {
                        JsonArray rows = RowConverter.toJson(rs);
                        LogUtil.logDebug(vertx, "Direct query returned " + rows.size() + " rows", COMPONENT, "Execute", "Database");
                        return rows;
                    }
                }
            } catch (SQLException e) {
                throw new QueryExecutionException(SqlErrorClassifier.classify(e),
                    "SQL error " + e.getErrorCode() + ": " + e.getMessage(), e);
            }
        }, false);
    }
}
