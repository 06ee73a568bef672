package sdkusage.querybridge.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Tool definition as listed by {@code tools/list}. The query tools take at most one string
 * argument, so the input schema is built from that argument rather than supplied by hand.
 */
public final class MCPTool {

    private final String name;
    private final String description;
    private final String argument;
    private final String argumentDescription;

    private MCPTool(String name, String description, String argument, String argumentDescription) {
        this.name = name;
        this.description = description;
        this.argument = argument;
        this.argumentDescription = argumentDescription;
    }

    /**
     * Tool taking one required string argument.
     */
    public static MCPTool withStringArgument(String name, String description, String argument, String argumentDescription) {
        return new MCPTool(name, description, argument, argumentDescription);
    }

    public static MCPTool withoutArguments(String name, String description) {
        return new MCPTool(name, description, null, null);
    }

    public String getName() {
        return name;
    }

    public List<String> requiredArguments() {
        return argument != null ? List.of(argument) : List.of();
    }

    public JsonObject inputSchema() {
        JsonObject properties = new JsonObject();
        JsonObject schema = new JsonObject()
            .put("type", "object")
            .put("properties", properties);
        if (argument != null) {
            properties.put(argument, new JsonObject()
                .put("type", "string")
                .put("description", argumentDescription));
            schema.put("required", new JsonArray().add(argument));
        }
        return schema;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("inputSchema", inputSchema());
    }
}
