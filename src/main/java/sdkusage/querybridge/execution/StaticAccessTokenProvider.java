package sdkusage.querybridge.execution;

import io.vertx.core.Future;

/**
 * Hands out one pre-issued token for every scope. Used when SQL_ACCESS_TOKEN is configured.
 */
public class StaticAccessTokenProvider implements AccessTokenProvider {

    private final String token;

    public StaticAccessTokenProvider(String token) {
        this.token = token;
    }

    @Override
    public Future<String> getToken(String scope) {
        if (token == null || token.isBlank()) {
            return Future.failedFuture(new QueryExecutionException(ErrorCategory.AUTHENTICATION,
                "No access token configured for scope " + scope));
        }
        return Future.succeededFuture(token);
    }
}
