package sdkusage.querybridge.config;

import java.util.function.Function;

/**
 * Settings for the query bridge, read from system properties (loaded from .env.local by dotenv)
 * and then from the OS environment.
 *
 * <p>Only the SQL target is needed for execution; translation works without it. Numeric values
 * that do not parse fail fast with a descriptive exception.</p>
 */
public class QueryBridgeConfig {

    public static final String DEFAULT_SCHEMA_FILE = "schemas/sdk_usage_schema.json";
    public static final String DEFAULT_IDENTITY_ENDPOINT = "http://169.254.169.254/metadata/identity/oauth2/token";
    public static final String DEFAULT_MANAGEMENT_ENDPOINT = "https://management.azure.com";

    private final String sqlServer;
    private final String sqlDatabase;
    private final String subscriptionId;
    private final String resourceGroup;
    private final String schemaFilePath;
    private final int mcpPort;
    private final int connectTimeoutSeconds;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final int workerPoolSize;
    private final String staticAccessToken;
    private final String identityEndpoint;
    private final String identityHeader;
    private final String managementEndpoint;

    private QueryBridgeConfig(Function<String, String> lookup) {
        this.sqlServer = optional(lookup, "SQL_SERVER", null);
        this.sqlDatabase = optional(lookup, "SQL_DATABASE", null);
        this.subscriptionId = optional(lookup, "AZURE_SUBSCRIPTION_ID", null);
        this.resourceGroup = optional(lookup, "AZURE_RESOURCE_GROUP", null);
        this.schemaFilePath = optional(lookup, "SCHEMA_FILE_PATH", DEFAULT_SCHEMA_FILE);
        this.mcpPort = positiveInt(lookup, "MCP_PORT", 8080);
        this.connectTimeoutSeconds = positiveInt(lookup, "SQL_CONNECT_TIMEOUT_SECONDS", 30);
        this.maxAttempts = positiveInt(lookup, "SQL_MAX_ATTEMPTS", 3);
        this.retryDelayMs = positiveInt(lookup, "SQL_RETRY_DELAY_MS", 1000);
        this.workerPoolSize = positiveInt(lookup, "SQL_WORKER_POOL_SIZE", 4);
        this.staticAccessToken = optional(lookup, "SQL_ACCESS_TOKEN", null);
        this.identityEndpoint = optional(lookup, "IDENTITY_ENDPOINT", DEFAULT_IDENTITY_ENDPOINT);
        this.identityHeader = optional(lookup, "IDENTITY_HEADER", null);
        this.managementEndpoint = optional(lookup, "MANAGEMENT_ENDPOINT", DEFAULT_MANAGEMENT_ENDPOINT);
    }

    /**
     * Checks System.getProperty() (from dotenv) first, then System.getenv() (from OS).
     */
    public static QueryBridgeConfig fromEnvironment() {
        return new QueryBridgeConfig(key -> {
            String value = System.getProperty(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getenv(key);
            }
            return value;
        });
    }

    public static QueryBridgeConfig from(Function<String, String> lookup) {
        return new QueryBridgeConfig(lookup);
    }

    private static String optional(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static int positiveInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = optional(lookup, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalStateException("Invalid " + key + " value: '" + value + "'. Must be a positive number.");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid " + key + " value: '" + value + "'. Must be a valid number.", e);
        }
    }

    /**
     * Fails with the names of the missing settings when the SQL target is not configured.
     */
    public void requireExecutionSettings() {
        if (!isExecutionConfigured()) {
            throw new IllegalStateException(
                "Required configuration 'SQL_SERVER' and 'SQL_DATABASE' is not set. " +
                "Please ensure .env.local file contains the SQL target.");
        }
    }

    public boolean isExecutionConfigured() {
        return sqlServer != null && sqlDatabase != null;
    }

    public boolean isManagementApiConfigured() {
        return isExecutionConfigured() && subscriptionId != null && resourceGroup != null;
    }

    public String getSqlServer() {
        return sqlServer;
    }

    /**
     * Server name without the DNS suffix, as the management API addresses it.
     */
    public String getSqlServerShortName() {
        if (sqlServer == null) {
            return null;
        }
        int dot = sqlServer.indexOf('.');
        return dot > 0 ? sqlServer.substring(0, dot) : sqlServer;
    }

    public String getSqlDatabase() {
        return sqlDatabase;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public String getResourceGroup() {
        return resourceGroup;
    }

    public String getSchemaFilePath() {
        return schemaFilePath;
    }

    public int getMcpPort() {
        return mcpPort;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    /**
     * Statement timeout, twice the connection timeout.
     */
    public int getExecutionTimeoutSeconds() {
        return connectTimeoutSeconds * 2;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public String getStaticAccessToken() {
        return staticAccessToken;
    }

    public String getIdentityEndpoint() {
        return identityEndpoint;
    }

    public String getIdentityHeader() {
        return identityHeader;
    }

    public String getManagementEndpoint() {
        return managementEndpoint;
    }
}
