package sdkusage.querybridge.execution;

import io.vertx.core.Future;

/**
 * Source of bearer tokens for a given OAuth scope. Failures should be {@link QueryExecutionException}s:
 * {@link ErrorCategory#AUTHENTICATION} for a refusal, a retryable category when the issuer is unreachable.
 */
public interface AccessTokenProvider {

    String SQL_SCOPE = "https://database.windows.net/.default";
    String MANAGEMENT_SCOPE = "https://management.azure.com/.default";

    Future<String> getToken(String scope);
}
