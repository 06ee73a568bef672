package sdkusage.querybridge.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * A JSON-RPC 2.0 request addressed to one of the MCP servers. Numeric ids are kept as their
 * string form so responses echo them back unchanged.
 */
public class MCPRequest {

    static final String JSONRPC_VERSION = "2.0";

    private final String id;
    private final String version;
    private final String method;
    private final JsonObject params;

    private MCPRequest(String id, String version, String method, JsonObject params) {
        this.id = id;
        this.version = version;
        this.method = method;
        this.params = params;
    }

    /**
     * @throws ClassCastException when {@code params} is present but not an object
     */
    public static MCPRequest parse(JsonObject body) {
        Object rawId = body.getValue("id");
        return new MCPRequest(
            rawId != null ? String.valueOf(rawId) : null,
            body.getString("jsonrpc"),
            body.getString("method"),
            body.getJsonObject("params", new JsonObject()));
    }

    /**
     * Version 2.0 with both an id and a method.
     */
    public boolean isValid() {
        return JSONRPC_VERSION.equals(version)
            && id != null && !id.isEmpty()
            && method != null && !method.isEmpty();
    }

    public String getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Name of the tool a {@code tools/call} request targets, or null.
     */
    public String toolName() {
        Object name = params.getValue("name");
        return name instanceof String ? (String) name : null;
    }

    /**
     * Whether {@code arguments} is absent or an object; anything else is rejected as invalid params.
     */
    public boolean hasWellFormedArguments() {
        Object arguments = params.getValue("arguments");
        return arguments == null || arguments instanceof JsonObject;
    }

    public JsonObject toolArguments() {
        Object arguments = params.getValue("arguments");
        return arguments instanceof JsonObject ? (JsonObject) arguments : new JsonObject();
    }
}
