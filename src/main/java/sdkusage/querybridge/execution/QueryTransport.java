package sdkusage.querybridge.execution;

import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;

/**
 * One way of reaching the usage database.
 *
 * <p>Implementations move the trace to {@link ExecutionState#EXECUTING} once connected and fail the
 * returned future with a {@link QueryExecutionException} so the client can decide on retry and fallback.</p>
 */
public interface QueryTransport {

    /**
     * Short name reported in result metadata.
     */
    String name();

    /**
     * OAuth scope of the access token this transport needs.
     */
    String tokenScope();

    Future<JsonArray> execute(String sql, String accessToken, ExecutionTrace trace);

    /**
     * Release resources held by the transport. Called once when the owning client closes.
     */
    default Future<Void> close() {
        return Future.succeededFuture();
    }
}
