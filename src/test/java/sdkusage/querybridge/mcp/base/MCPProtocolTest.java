package sdkusage.querybridge.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MCPProtocolTest {

    private static JsonObject call(Object id, JsonObject params) {
        return new JsonObject().put("jsonrpc", "2.0").put("id", id).put("method", "tools/call").put("params", params);
    }

    @Test
    @DisplayName("Numeric ids are echoed in string form")
    void numericId() {
        MCPRequest request = MCPRequest.parse(call(7, new JsonObject().put("name", "list_tables")));
        assertTrue(request.isValid());
        assertEquals("7", request.getId());
        assertEquals("list_tables", request.toolName());
        assertTrue(request.toolArguments().isEmpty());
    }

    @Test
    @DisplayName("Version, id and method are all required")
    void validity() {
        assertFalse(MCPRequest.parse(call("1", new JsonObject()).put("jsonrpc", "1.0")).isValid());
        assertFalse(MCPRequest.parse(call(null, new JsonObject())).isValid());
        assertFalse(MCPRequest.parse(call("1", new JsonObject()).putNull("method")).isValid());
    }

    @Test
    @DisplayName("Arguments must be an object when present")
    void argumentShape() {
        MCPRequest bad = MCPRequest.parse(call("1", new JsonObject().put("name", "x").put("arguments", "text")));
        assertFalse(bad.hasWellFormedArguments());
        assertTrue(bad.toolArguments().isEmpty());

        MCPRequest good = MCPRequest.parse(call("1", new JsonObject().put("name", "x")
            .put("arguments", new JsonObject().put("user_question", "q"))));
        assertTrue(good.hasWellFormedArguments());
        assertEquals("q", good.toolArguments().getString("user_question"));
    }

    @Test
    @DisplayName("Non-object params are rejected while parsing")
    void paramsNotObject() {
        JsonObject body = new JsonObject().put("jsonrpc", "2.0").put("id", "1").put("method", "tools/call")
            .put("params", new JsonArray().add(1));
        assertThrows(ClassCastException.class, () -> MCPRequest.parse(body));
    }

    @Test
    @DisplayName("Errors carry code and message and map to HTTP 400")
    void errorResponse() {
        MCPResponse response = MCPResponse.error("9", MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Tool not found: x");
        JsonObject json = response.toJson();
        assertTrue(response.isError());
        assertEquals(400, response.httpStatus());
        assertEquals("9", json.getString("id"));
        assertEquals(-32601, json.getJsonObject("error").getInteger("code"));
        assertNull(json.getValue("result"));
    }

    @Test
    @DisplayName("A response without a request id still gets one")
    void generatedId() {
        MCPResponse response = MCPResponse.result(null, new JsonObject().put("success", false));
        assertEquals(200, response.httpStatus());
        assertNotNull(response.toJson().getString("id"));
        assertFalse(response.toJson().getJsonObject("result").getBoolean("success"));
    }

    @Test
    @DisplayName("Tool schemas list the single required argument")
    void toolSchema() {
        MCPTool withArgument = MCPTool.withStringArgument("parse_user_query", "d", "user_question", "q");
        assertEquals(List.of("user_question"), withArgument.requiredArguments());
        JsonObject schema = withArgument.toJson().getJsonObject("inputSchema");
        assertEquals("string", schema.getJsonObject("properties").getJsonObject("user_question").getString("type"));
        assertEquals(new JsonArray().add("user_question"), schema.getJsonArray("required"));

        MCPTool bare = MCPTool.withoutArguments("list_tables", "d");
        assertTrue(bare.requiredArguments().isEmpty());
        assertFalse(bare.inputSchema().containsKey("required"));
    }
}
