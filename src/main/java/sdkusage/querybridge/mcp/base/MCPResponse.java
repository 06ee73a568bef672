package sdkusage.querybridge.mcp.base;

import io.vertx.core.json.JsonObject;

import java.util.UUID;

/**
 * Reply to an {@link MCPRequest}. Tool outcomes, including failed queries, travel as results;
 * only protocol problems (bad JSON, unknown tool, missing argument) become JSON-RPC errors.
 */
public final class MCPResponse {

    private final String id;
    private final JsonObject result;
    private final int errorCode;
    private final String errorMessage;

    private MCPResponse(String id, JsonObject result, int errorCode, String errorMessage) {
        // Unparseable requests have no id to echo
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.result = result;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static MCPResponse result(String id, JsonObject result) {
        return new MCPResponse(id, result, 0, null);
    }

    public static MCPResponse error(String id, int code, String message) {
        return new MCPResponse(id, null, code, message);
    }

    public boolean isError() {
        return result == null;
    }

    public int httpStatus() {
        return isError() ? 400 : 200;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", MCPRequest.JSONRPC_VERSION)
            .put("id", id);
        if (isError()) {
            json.put("error", new JsonObject().put("code", errorCode).put("message", errorMessage));
        } else {
            json.put("result", result);
        }
        return json;
    }

    public String encode() {
        return toJson().encode();
    }

    /** Standard JSON-RPC error codes. */
    public static final class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;

        private ErrorCodes() {
        }
    }
}
