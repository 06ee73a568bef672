package sdkusage.querybridge.execution;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.WebClient;
import sdkusage.querybridge.services.LogUtil;

/**
 * Requests tokens from the managed identity endpoint of the hosting environment.
 *
 * <p>With {@code IDENTITY_HEADER} set the App Service flavour of the protocol is used, otherwise the
 * instance metadata service one.</p>
 */
public class ManagedIdentityTokenProvider implements AccessTokenProvider {

    private static final String COMPONENT = "ManagedIdentityTokenProvider";
    private static final long REQUEST_TIMEOUT_MS = 10_000;

    private final Vertx vertx;
    private final WebClient webClient;
    private final String endpoint;
    private final String identityHeader;

    public ManagedIdentityTokenProvider(Vertx vertx, WebClient webClient, String endpoint, String identityHeader) {
        this.vertx = vertx;
        this.webClient = webClient;
        this.endpoint = endpoint;
        this.identityHeader = identityHeader;
    }

    @Override
    public Future<String> getToken(String scope) {
        String resource = scope.endsWith("/.default") ? scope.substring(0, scope.length() - "/.default".length()) : scope;

        HttpRequest<Buffer> request = webClient.getAbs(endpoint)
            .addQueryParam("resource", resource)
            .timeout(REQUEST_TIMEOUT_MS);
        if (identityHeader != null) {
            request.addQueryParam("api-version", "2019-08-01").putHeader("X-IDENTITY-HEADER", identityHeader);
        } else {
            request.addQueryParam("api-version", "2018-02-01").putHeader("Metadata", "true");
        }

        LogUtil.logDebug(vertx, "Requesting managed identity token for " + resource, COMPONENT, "Token", "Auth");
        return request.send()
            .recover(err -> Future.failedFuture(new QueryExecutionException(ErrorCategory.CONNECTION,
                "Token endpoint unreachable: " + err.getMessage(), err)))
            .compose(response -> {
                if (response.statusCode() != 200) {
                    return Future.failedFuture(new QueryExecutionException(refusalCategory(response.statusCode()),
                        "Token request refused (" + response.statusCode() + "): " + response.bodyAsString()));
                }
                try {
                    JsonObject body = response.bodyAsJsonObject();
                    String token = body != null ? body.getString("access_token") : null;
                    if (token == null || token.isBlank()) {
                        return Future.failedFuture(new QueryExecutionException(ErrorCategory.AUTHENTICATION,
                            "Token response did not contain an access_token"));
                    }
                    return Future.succeededFuture(token);
                } catch (DecodeException e) {
                    return Future.failedFuture(new QueryExecutionException(ErrorCategory.AUTHENTICATION,
                        "Token response is not JSON", e));
                }
            });
    }

    // Only an identity the endpoint rejects outright is fatal; throttling and setup delays are retried
    static ErrorCategory refusalCategory(int status) {
        if (status == 400 || status == 401 || status == 403) {
            return ErrorCategory.AUTHENTICATION;
        }
        if (status >= 500) {
            return ErrorCategory.TRANSIENT;
        }
        return SqlErrorClassifier.classifyStatus(status);
    }
}
