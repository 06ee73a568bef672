package sdkusage.querybridge.schema;

import java.util.List;

/**
 * Named, ordered list of canonical literals taken from a manifest definition.
 */
public final class EnumDefinition {

    private final String name;
    private final List<String> literals;

    public EnumDefinition(String name, List<String> literals) {
        this.name = name;
        this.literals = List.copyOf(literals);
    }

    public String getName() {
        return name;
    }

    public List<String> getLiterals() {
        return literals;
    }

    @Override
    public String toString() {
        return "EnumDefinition{name='" + name + "', literals=" + literals + "}";
    }
}
