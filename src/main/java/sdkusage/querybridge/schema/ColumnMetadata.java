package sdkusage.querybridge.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Metadata for one column, resolved from the manifest definition it references.
 */
public final class ColumnMetadata {

    private final String name;
    private final String title;
    private final String description;
    private final String type;
    private final List<String> enumValues;
    private final String pattern;
    private final String format;
    private final Double minimum;
    private final String definitionName;

    public ColumnMetadata(String name, String title, String description, String type,
                          List<String> enumValues, String pattern, String format,
                          Double minimum, String definitionName) {
        this.name = name;
        this.title = title != null && !title.isBlank() ? title : name;
        this.description = description != null ? description : "";
        this.type = type != null && !type.isBlank() ? type : "string";
        this.enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
        this.pattern = pattern;
        this.format = format;
        this.minimum = minimum;
        this.definitionName = definitionName;
    }

    /**
     * Column with no definition behind it: title is the name, type is string.
     */
    public static ColumnMetadata plain(String name) {
        return new ColumnMetadata(name, null, null, null, null, null, null, null, null);
    }

    public String getName() {
        return name;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getType() {
        return type;
    }

    public List<String> getEnumValues() {
        return enumValues;
    }

    public boolean hasEnum() {
        return !enumValues.isEmpty();
    }

    public String getPattern() {
        return pattern;
    }

    public String getFormat() {
        return format;
    }

    public Double getMinimum() {
        return minimum;
    }

    public String getDefinitionName() {
        return definitionName;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("name", name)
            .put("title", title)
            .put("description", description)
            .put("type", type);
        if (hasEnum()) {
            json.put("enum", new JsonArray(enumValues));
        }
        if (pattern != null) {
            json.put("pattern", pattern);
        }
        if (format != null) {
            json.put("format", format);
        }
        if (minimum != null) {
            json.put("minimum", minimum);
        }
        return json;
    }
}
